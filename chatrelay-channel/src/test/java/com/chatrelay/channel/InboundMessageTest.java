package com.chatrelay.channel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InboundMessage} text resolution.
 */
class InboundMessageTest {

    @Test
    void resolveText_prefersBody() {
        InboundMessage message = InboundMessage.builder()
                .body("plain")
                .extendedText("extended")
                .imageCaption("caption")
                .build();

        assertEquals("plain", message.resolveText());
    }

    @Test
    void resolveText_skipsEmptyFields() {
        InboundMessage message = InboundMessage.builder()
                .body("")
                .extendedText("")
                .imageCaption(null)
                .videoCaption("video caption")
                .build();

        assertEquals("video caption", message.resolveText());
    }

    @Test
    void resolveText_noFields_returnsEmpty() {
        assertEquals("", new InboundMessage().resolveText());
    }
}
