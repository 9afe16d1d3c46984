package com.chatrelay.autoreply.backend;

import com.chatrelay.common.config.RelayConfig;
import com.chatrelay.common.logging.LogRedact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reply backend reached through an HTTP webhook (e.g. an n8n workflow).
 * <p>
 * Request: {@code POST {"message": ..., "isGroup": ...}}. The reply is read
 * from the {@code reply} field of the JSON response, falling back to
 * {@code output}. The whole call is bounded by the configured timeout so a
 * hung backend cannot stall a conversation.
 */
@Slf4j
public class WebhookReplyBackend implements ReplyBackend {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final String url;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookReplyBackend(RelayConfig.BackendConfig config) {
        this(config.getUrl(), new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(config.getConnectTimeoutSeconds()))
                .callTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build());
        log.info("Reply backend: {} (timeout {}s)", url, config.getTimeoutSeconds());
    }

    /**
     * Package-private constructor taking a preconfigured HTTP client.
     */
    WebhookReplyBackend(String url, OkHttpClient httpClient) {
        this.url = url;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public CompletableFuture<Optional<String>> query(String message, boolean isGroup) {
        CompletableFuture<Optional<String>> future = new CompletableFuture<>();

        Request request;
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", message);
            body.put("isGroup", isGroup);
            request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                    .build();
        } catch (IOException | IllegalArgumentException e) {
            future.completeExceptionally(new BackendCallException("Cannot build backend request", e));
            return future;
        }

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(new BackendCallException("Backend call failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody responseBody = response.body()) {
                    String respStr = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new BackendCallException(response.code(),
                                "Backend HTTP error " + response.code() + ": " + LogRedact.preview(respStr)));
                        return;
                    }
                    future.complete(extractReply(respStr));
                } catch (IOException e) {
                    future.completeExceptionally(new BackendCallException("Unreadable backend response", e));
                }
            }
        });
        return future;
    }

    Optional<String> extractReply(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Backend response is not a JSON object");
        }
        for (String field : new String[] { "reply", "output" }) {
            JsonNode value = root.get(field);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }
}
