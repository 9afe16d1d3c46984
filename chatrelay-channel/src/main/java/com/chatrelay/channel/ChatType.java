package com.chatrelay.channel;

/**
 * Normalized conversation kind.
 */
public enum ChatType {
    DIRECT,
    GROUP
}
