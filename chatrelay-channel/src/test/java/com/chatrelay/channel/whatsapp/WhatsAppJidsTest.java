package com.chatrelay.channel.whatsapp;

import com.chatrelay.channel.ChatType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WhatsAppJidsTest {

    @Test
    void groupSuffix_isGroup() {
        assertTrue(WhatsAppJids.isGroup("120363041234567890@g.us"));
        assertFalse(WhatsAppJids.isGroup("919876543210@s.whatsapp.net"));
        assertFalse(WhatsAppJids.isGroup(null));
    }

    @Test
    void chatTypeOf_defaultsToDirect() {
        assertEquals(ChatType.GROUP, WhatsAppJids.chatTypeOf("1@g.us"));
        assertEquals(ChatType.DIRECT, WhatsAppJids.chatTypeOf("1@s.whatsapp.net"));
        assertEquals(ChatType.DIRECT, WhatsAppJids.chatTypeOf(null));
    }

    @Test
    void directJidFromNumber_stripsFormatting() {
        assertEquals("919876543210@s.whatsapp.net", WhatsAppJids.directJidFromNumber("+91 98765-43210"));
        assertNull(WhatsAppJids.directJidFromNumber("n/a"));
        assertNull(WhatsAppJids.directJidFromNumber(null));
    }
}
