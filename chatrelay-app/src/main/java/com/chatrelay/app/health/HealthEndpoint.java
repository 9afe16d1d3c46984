package com.chatrelay.app.health;

import com.chatrelay.autoreply.queue.ConversationQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness probe with queue occupancy.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ConversationQueue conversationQueue;

    public HealthEndpoint(ConversationQueue conversationQueue) {
        this.conversationQueue = conversationQueue;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());
        node.put("activeConversations", conversationQueue.activeConversations());
        return node;
    }
}
