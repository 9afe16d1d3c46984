package com.chatrelay.channel.delivery;

import com.chatrelay.channel.adapter.ChannelOutboundAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unified message delivery service.
 * Handles text splitting and adapter dispatch.
 */
@Slf4j
public class MessageDeliveryService {

    public static final int DEFAULT_MAX_TEXT_LENGTH = 4096;

    private record Registration(ChannelOutboundAdapter adapter, int maxTextLength) {
    }

    private final Map<String, Registration> adapters = new ConcurrentHashMap<>();

    public void registerAdapter(ChannelOutboundAdapter adapter) {
        registerAdapter(adapter, DEFAULT_MAX_TEXT_LENGTH);
    }

    public void registerAdapter(ChannelOutboundAdapter adapter, int maxTextLength) {
        int limit = maxTextLength > 0 ? maxTextLength : DEFAULT_MAX_TEXT_LENGTH;
        adapters.put(adapter.getChannelId(), new Registration(adapter, limit));
        log.info("Registered outbound adapter: {} (max text length {})", adapter.getChannelId(), limit);
    }

    /**
     * Deliver a text message, splitting if necessary. Chunks are sent one after
     * another; the first failure fails the whole delivery.
     */
    public CompletableFuture<Void> deliverText(String channelId, String target, String text) {
        Registration registration = adapters.get(channelId);
        if (registration == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("No adapter for channel: " + channelId));
        }
        ChannelOutboundAdapter adapter = registration.adapter();

        if (text.length() > registration.maxTextLength()) {
            List<String> chunks = splitText(text, registration.maxTextLength());
            log.debug("Splitting message into {} chunks for {}", chunks.size(), channelId);

            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (String chunk : chunks) {
                ChannelOutboundAdapter.OutboundTextPayload chunkPayload = ChannelOutboundAdapter.OutboundTextPayload
                        .builder()
                        .target(target)
                        .text(chunk)
                        .build();
                chain = chain.thenCompose(v -> adapter.sendText(chunkPayload));
            }
            return chain;
        }

        return adapter.sendText(ChannelOutboundAdapter.OutboundTextPayload.builder()
                .target(target)
                .text(text)
                .build());
    }

    /**
     * Show a typing indicator through the channel's adapter.
     */
    public CompletableFuture<Void> sendTyping(String channelId, String target) {
        Registration registration = adapters.get(channelId);
        if (registration == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("No adapter for channel: " + channelId));
        }
        return registration.adapter().sendTyping(target);
    }

    /**
     * Split text into chunks at natural boundaries (newlines, then spaces).
     */
    List<String> splitText(String text, int maxLen) {
        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLen >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            // Find best break point
            int end = start + maxLen;
            int breakAt = text.lastIndexOf('\n', end);
            if (breakAt <= start) {
                breakAt = text.lastIndexOf(' ', end);
            }
            if (breakAt <= start) {
                breakAt = end; // force break
            }

            chunks.add(text.substring(start, breakAt));
            start = breakAt;
            // Skip the break character
            if (start < text.length() && (text.charAt(start) == '\n' || text.charAt(start) == ' ')) {
                start++;
            }
        }
        return chunks;
    }

    public boolean hasAdapter(String channelId) {
        return adapters.containsKey(channelId);
    }
}
