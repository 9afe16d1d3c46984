package com.chatrelay.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole relay on a random port with default configuration and
 * exercises the HTTP surface that does not need a live bridge or backend.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "chatrelay.config.path=target/no-such-dir/config.json")
class ChatRelayApplicationTest {

    @Autowired
    private TestRestTemplate rest;

    private final ObjectMapper mapper = new ObjectMapper();

    private ResponseEntity<String> postJson(String path, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return rest.postForEntity(path, new HttpEntity<>(body, headers), String.class);
    }

    @Test
    void health_reportsIdleQueue() throws Exception {
        ResponseEntity<String> response = rest.getForEntity("/health", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = mapper.readTree(response.getBody());
        assertEquals("ok", body.get("status").asText());
        assertTrue(body.get("uptime").asLong() >= 0);
        assertEquals(0, body.get("activeConversations").asInt());
    }

    @Test
    void inbound_untriggeredGroupMessage_notAccepted() throws Exception {
        ResponseEntity<String> response = postJson("/whatsapp/inbound", """
                {"type":"notify","messages":[{
                  "key":{"remoteJid":"120363041234567890@g.us","participant":"91@s.whatsapp.net","id":"A1"},
                  "message":{"conversation":"lunch anyone?"}
                }]}
                """);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(0, mapper.readTree(response.getBody()).get("accepted").asInt());
    }

    @Test
    void inbound_malformedBody_badRequest() {
        ResponseEntity<String> response = postJson("/whatsapp/inbound", "{oops");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void send_missingFields_badRequest() throws Exception {
        ResponseEntity<String> response = postJson("/send", "{\"number\":\"919876543210\"}");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("number & message required", mapper.readTree(response.getBody()).get("error").asText());
    }
}
