package com.chatrelay.channel.whatsapp;

import com.chatrelay.channel.adapter.ChannelOutboundAdapter;
import com.chatrelay.common.config.RelayConfig;
import com.chatrelay.common.logging.LogRedact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * WhatsApp outbound adapter talking to the transport bridge over HTTP.
 * <p>
 * The bridge owns the WhatsApp session (pairing, reconnects); this adapter
 * only calls its REST surface:
 * {@code POST /messages {jid,text}}, {@code POST /presence {jid,presence}} and
 * {@code GET /groups}.
 */
@Slf4j
public class WhatsAppBridgeOutboundAdapter implements ChannelOutboundAdapter {

    public static final String CHANNEL_ID = "whatsapp";
    public static final String PRESENCE_COMPOSING = "composing";

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    /** A group the bridge's account participates in. */
    public record GroupInfo(String id, String name) {
    }

    private final HttpUrl baseUrl;
    private final String token;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WhatsAppBridgeOutboundAdapter(RelayConfig.BridgeConfig config) {
        this(config.getBaseUrl(), config.getToken(), new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build());
    }

    /**
     * Package-private constructor taking a preconfigured HTTP client.
     */
    WhatsAppBridgeOutboundAdapter(String baseUrl, String token, OkHttpClient httpClient) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid bridge base URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.token = token != null && !token.isBlank() ? token : null;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        log.info("WhatsApp bridge adapter targeting {} (token {})", parsed,
                this.token != null ? LogRedact.maskToken(this.token) : "none");
    }

    @Override
    public String getChannelId() {
        return CHANNEL_ID;
    }

    @Override
    public CompletableFuture<Void> sendText(OutboundTextPayload payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jid", payload.getTarget());
        body.put("text", payload.getText());
        return post("messages", body).thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<Void> sendTyping(String target) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jid", target);
        body.put("presence", PRESENCE_COMPOSING);
        return post("presence", body).thenApply(ignored -> null);
    }

    /**
     * List the groups the bridge's account participates in.
     */
    public CompletableFuture<List<GroupInfo>> listGroups() {
        Request request = authorized(new Request.Builder().url(endpoint("groups")).get()).build();
        return execute(request, this::parseGroups);
    }

    List<GroupInfo> parseGroups(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        List<GroupInfo> groups = new ArrayList<>();
        if (root == null || !root.isObject()) {
            return groups;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode subject = field.getValue().get("subject");
            groups.add(new GroupInfo(field.getKey(), subject != null && !subject.isNull() ? subject.asText() : null));
        }
        return groups;
    }

    private CompletableFuture<String> post(String path, Map<String, Object> body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        Request request = authorized(new Request.Builder()
                .url(endpoint(path))
                .post(RequestBody.create(json, JSON)))
                .build();
        return execute(request, responseBody -> responseBody);
    }

    @FunctionalInterface
    private interface BodyParser<T> {
        T parse(String body) throws IOException;
    }

    private <T> CompletableFuture<T> execute(Request request, BodyParser<T> parser) {
        CompletableFuture<T> future = new CompletableFuture<>();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("WhatsApp bridge call {} failed: {}", request.url().encodedPath(), e.getMessage());
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody responseBody = response.body()) {
                    String respStr = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        log.warn("WhatsApp bridge HTTP error {} on {}: {}", response.code(),
                                request.url().encodedPath(), LogRedact.preview(respStr));
                        future.completeExceptionally(new IOException(
                                "WhatsApp bridge HTTP error " + response.code() + ": " + respStr));
                        return;
                    }
                    future.complete(parser.parse(respStr));
                } catch (IOException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    private HttpUrl endpoint(String path) {
        return baseUrl.newBuilder().addPathSegments(path).build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }
}
