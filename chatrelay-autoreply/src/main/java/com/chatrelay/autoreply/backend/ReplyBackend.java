package com.chatrelay.autoreply.backend;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The external service that turns a cleaned query into reply text.
 */
public interface ReplyBackend {

    /**
     * Ask the backend for a reply.
     *
     * @param message cleaned query text
     * @param isGroup whether the query came from a group conversation
     * @return the reply, empty when the backend had nothing to say; completes
     *         exceptionally with {@link BackendCallException} on failure
     */
    CompletableFuture<Optional<String>> query(String message, boolean isGroup);
}
