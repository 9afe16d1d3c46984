package com.chatrelay.channel.whatsapp;

import com.chatrelay.channel.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code messages.upsert} events forwarded by the WhatsApp bridge into
 * {@link InboundMessage}s.
 * <p>
 * Only {@code notify} events are considered (history syncs and appends are
 * not new traffic), and entries without a {@code message} body are skipped.
 */
@Slf4j
public class WhatsAppInboundParser {

    public static final String NOTIFY = "notify";

    public List<InboundMessage> parse(JsonNode event) {
        if (event == null || !NOTIFY.equals(text(event, "type"))) {
            log.debug("Ignoring upsert event of type {}", event != null ? text(event, "type") : null);
            return List.of();
        }
        JsonNode messages = event.get("messages");
        if (messages == null || !messages.isArray()) {
            return List.of();
        }

        List<InboundMessage> result = new ArrayList<>();
        for (JsonNode entry : messages) {
            InboundMessage parsed = parseEntry(entry);
            if (parsed != null) {
                result.add(parsed);
            }
        }
        return result;
    }

    InboundMessage parseEntry(JsonNode entry) {
        JsonNode body = entry.get("message");
        if (body == null || body.isNull()) {
            return null;
        }
        JsonNode key = entry.path("key");
        String remoteJid = text(key, "remoteJid");
        if (remoteJid == null || remoteJid.isBlank()) {
            log.warn("Skipping upsert entry without remoteJid");
            return null;
        }
        String participant = text(key, "participant");

        return InboundMessage.builder()
                .channelId(WhatsAppBridgeOutboundAdapter.CHANNEL_ID)
                .conversationId(remoteJid)
                .chatType(WhatsAppJids.chatTypeOf(remoteJid))
                .senderId(participant != null ? participant : remoteJid)
                .senderName(text(entry, "pushName"))
                .messageId(text(key, "id"))
                .body(text(body, "conversation"))
                .extendedText(text(body.path("extendedTextMessage"), "text"))
                .imageCaption(text(body.path("imageMessage"), "caption"))
                .videoCaption(text(body.path("videoMessage"), "caption"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
