package com.chatrelay.autoreply;

import com.chatrelay.autoreply.backend.ReplyBackend;
import com.chatrelay.autoreply.queue.ConversationQueue;
import com.chatrelay.channel.InboundMessage;
import com.chatrelay.channel.InboundMessageHandler;
import com.chatrelay.channel.TriggerClassifier;
import com.chatrelay.channel.delivery.MessageDeliveryService;
import com.chatrelay.common.config.RelayConfig;
import com.chatrelay.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Turns admitted inbound messages into queued backend round-trips.
 * <p>
 * Flow per message: classify; if rejected, do nothing. Otherwise queue a task
 * that shows typing, asks the backend, and delivers the reply (or the apology
 * if the backend fails). When the conversation already has work in flight the
 * "please wait" notice is sent first, and the new task waits for it. Task
 * bodies never fail: backend errors become the apology and delivery errors
 * are logged.
 */
@Slf4j
public class AutoReplyDispatcher implements InboundMessageHandler {

    private final TriggerClassifier classifier;
    private final ConversationQueue queue;
    private final ReplyBackend backend;
    private final MessageDeliveryService delivery;
    private final RelayConfig.RepliesConfig replies;

    public AutoReplyDispatcher(TriggerClassifier classifier,
            ConversationQueue queue,
            ReplyBackend backend,
            MessageDeliveryService delivery,
            RelayConfig.RepliesConfig replies) {
        this.classifier = classifier;
        this.queue = queue;
        this.backend = backend;
        this.delivery = delivery;
        this.replies = replies != null ? replies : new RelayConfig.RepliesConfig();
    }

    @Override
    public HandleResult handle(InboundMessage message) {
        TriggerClassifier.Classification classification = classifier.classify(message);
        String conversationId = message.getConversationId();
        if (!classification.admitted()) {
            log.debug("Ignoring message in {}: {}", conversationId, classification.reason());
            return HandleResult.ignored();
        }

        String query = classification.text();
        log.info("Accepted query in {}: {}", conversationId, LogRedact.preview(query));

        String channelId = message.getChannelId();
        CompletableFuture<Void> completion = queue.enqueue(conversationId,
                () -> answer(channelId, conversationId, query, message.isGroup()),
                () -> deliver(channelId, conversationId, replies.getPleaseWait(), "please-wait notice"));
        return HandleResult.accepted(completion);
    }

    private CompletableFuture<Void> answer(String channelId, String conversationId, String query, boolean isGroup) {
        return delivery.sendTyping(channelId, conversationId)
                .handle((ignored, ex) -> {
                    if (ex != null) {
                        log.debug("Typing indicator for {} failed: {}", conversationId, unwrap(ex).getMessage());
                    }
                    return null;
                })
                .thenCompose(ignored -> callBackend(query, isGroup))
                .handle((reply, ex) -> {
                    if (ex != null) {
                        log.error("Backend error for {}: {}", conversationId, unwrap(ex).getMessage());
                        return replies.getApology();
                    }
                    return reply;
                })
                .thenCompose(text -> {
                    if (text == null || text.isBlank()) {
                        log.debug("No reply text for {}", conversationId);
                        return CompletableFuture.completedFuture(null);
                    }
                    return deliver(channelId, conversationId, text, "reply");
                });
    }

    private CompletableFuture<String> callBackend(String query, boolean isGroup) {
        try {
            return backend.query(query, isGroup).thenApply(reply -> reply.orElse(null));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Void> deliver(String channelId, String conversationId, String text, String what) {
        return delivery.deliverText(channelId, conversationId, text)
                .exceptionally(ex -> {
                    log.warn("Failed to deliver {} to {}: {}", what, conversationId, unwrap(ex).getMessage());
                    return null;
                });
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
