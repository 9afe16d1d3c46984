package com.chatrelay.channel.adapter;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound channel adapter interface.
 */
public interface ChannelOutboundAdapter {

    /** Channel identifier (e.g. "whatsapp"). */
    String getChannelId();

    /** Send a text message. */
    CompletableFuture<Void> sendText(OutboundTextPayload payload);

    /**
     * Show a typing indicator in the conversation. Channels without one complete
     * immediately.
     */
    default CompletableFuture<Void> sendTyping(String target) {
        return CompletableFuture.completedFuture(null);
    }

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class OutboundTextPayload {
        private String target;
        private String text;
    }
}
