package com.chatrelay.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for the relay, deserialized from the JSON config
 * file.
 */
@Data
public class RelayConfig {

    /** Who the bot answers to. */
    private TriggerConfig trigger;

    /** Reply backend endpoint. */
    private BackendConfig backend;

    /** Messaging transport bridge. */
    private BridgeConfig bridge;

    /** Fixed reply texts. */
    private RepliesConfig replies;

    /** Conversation queue settings. */
    private QueueConfig queue;

    // --- Nested config types ---

    @Data
    public static class TriggerConfig {
        /** Display-name aliases, matched case-insensitively as {@code @alias}. */
        private List<String> nameAliases = new ArrayList<>(List.of(
                "yesbank bot", "yes bank bot", "ai response"));
        /** Numeric ids the transport may inject instead of the display name. */
        private List<String> numberAliases = new ArrayList<>(List.of("65559051915364"));
        /** Leading commands that address the bot (e.g. "/bot"). */
        private List<String> commandPrefixes = new ArrayList<>(List.of("/bot", "!bot"));
    }

    @Data
    public static class BackendConfig {
        private String url = "https://pinjarin8n.app.n8n.cloud/webhook/whatsapp-rag";
        /** Upper bound for a whole backend call, in seconds. */
        private int timeoutSeconds = 30;
        private int connectTimeoutSeconds = 10;
    }

    @Data
    public static class BridgeConfig {
        private String baseUrl = "http://localhost:3001";
        /** Optional bearer token sent to the bridge. */
        private String token;
        private int maxTextLength = 4096;
    }

    @Data
    public static class RepliesConfig {
        private String pleaseWait = "⏳ Please wait, I’m processing your previous request…";
        private String apology = "⚠️ Sorry, something went wrong. Please try again.";
    }

    @Data
    public static class QueueConfig {
        /** Worker threads for queued tasks; 0 means an unbounded cached pool. */
        private int workerThreads = 0;
    }
}
