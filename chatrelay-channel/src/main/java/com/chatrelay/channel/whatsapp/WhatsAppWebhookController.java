package com.chatrelay.channel.whatsapp;

import com.chatrelay.channel.InboundMessage;
import com.chatrelay.channel.InboundMessageHandler;
import com.chatrelay.channel.delivery.MessageDeliveryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handler for the WhatsApp HTTP surface.
 * <p>
 * Not annotated with @RestController; routes are registered by
 * {@link WhatsAppWebhookRouterConfig}.
 * <p>
 * Handles:
 * - POST /whatsapp/inbound → upsert events forwarded by the bridge
 * - POST /send → text to a phone number
 * - POST /send-group → text to a group JID
 * - GET /groups → groups the account participates in
 */
@Slf4j
public class WhatsAppWebhookController {

    static final Duration SEND_TIMEOUT = Duration.ofSeconds(30);

    private final WhatsAppInboundParser parser;
    private final InboundMessageHandler messageHandler;
    private final MessageDeliveryService deliveryService;
    private final WhatsAppBridgeOutboundAdapter bridge;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WhatsAppWebhookController(WhatsAppInboundParser parser,
            InboundMessageHandler messageHandler,
            MessageDeliveryService deliveryService,
            WhatsAppBridgeOutboundAdapter bridge) {
        this.parser = parser;
        this.messageHandler = messageHandler;
        this.deliveryService = deliveryService;
        this.bridge = bridge;
    }

    /**
     * Receive a {@code messages.upsert} event. Every admitted message is queued;
     * the response only reports how many were accepted.
     */
    public ResponseEntity<Map<String, Object>> receiveUpsert(String jsonBody) {
        JsonNode event;
        try {
            event = objectMapper.readTree(jsonBody == null ? "" : jsonBody);
        } catch (JsonProcessingException e) {
            log.warn("Malformed WhatsApp upsert payload: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body(Map.of("error", "invalid JSON body"));
        }

        List<InboundMessage> messages = parser.parse(event);
        int accepted = 0;
        for (InboundMessage message : messages) {
            if (messageHandler.handle(message).accepted()) {
                accepted++;
            }
        }
        return ResponseEntity.ok(Map.of("accepted", accepted));
    }

    public ResponseEntity<Map<String, Object>> sendDirect(String jsonBody) {
        JsonNode body = readQuietly(jsonBody);
        String number = field(body, "number");
        String message = field(body, "message");
        if (number == null || message == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "number & message required"));
        }
        String jid = WhatsAppJids.directJidFromNumber(number);
        if (jid == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "number & message required"));
        }
        return deliver(jid, message, "Message sent successfully");
    }

    public ResponseEntity<Map<String, Object>> sendGroup(String jsonBody) {
        JsonNode body = readQuietly(jsonBody);
        String groupId = field(body, "groupId");
        String message = field(body, "message");
        if (groupId == null || message == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "groupId & message required"));
        }
        return deliver(groupId, message, "Group message sent successfully");
    }

    public ResponseEntity<?> listGroups() {
        try {
            List<WhatsAppBridgeOutboundAdapter.GroupInfo> groups = bridge.listGroups()
                    .get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            return ResponseEntity.ok(groups);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(e);
        } catch (ExecutionException | TimeoutException e) {
            return error(e);
        }
    }

    private ResponseEntity<Map<String, Object>> deliver(String target, String text, String status) {
        try {
            deliveryService.deliverText(WhatsAppBridgeOutboundAdapter.CHANNEL_ID, target, text)
                    .get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            return ResponseEntity.ok(Map.of("status", status));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(e);
        } catch (ExecutionException | TimeoutException e) {
            return error(e);
        }
    }

    private static ResponseEntity<Map<String, Object>> error(Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.warn("WhatsApp bridge request failed: {}", message);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", message));
    }

    private JsonNode readQuietly(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable request body: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String field(JsonNode body, String name) {
        if (body == null) {
            return null;
        }
        JsonNode value = body.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
