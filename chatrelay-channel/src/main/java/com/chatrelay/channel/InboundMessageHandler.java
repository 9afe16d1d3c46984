package com.chatrelay.channel;

import java.util.concurrent.CompletableFuture;

/**
 * Receives messages parsed by a channel. Implemented by the reply dispatcher so
 * that channels do not depend on it.
 */
public interface InboundMessageHandler {

    /**
     * Handle one inbound message. Returns as soon as the message is classified
     * and, if admitted, queued.
     */
    HandleResult handle(InboundMessage message);

    /**
     * Outcome of {@link #handle}: whether the message was admitted, and a future
     * that completes when its reply work has finished.
     */
    record HandleResult(boolean accepted, CompletableFuture<Void> completion) {

        public static HandleResult ignored() {
            return new HandleResult(false, CompletableFuture.completedFuture(null));
        }

        public static HandleResult accepted(CompletableFuture<Void> completion) {
            return new HandleResult(true, completion);
        }
    }
}
