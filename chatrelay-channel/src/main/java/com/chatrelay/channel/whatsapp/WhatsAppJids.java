package com.chatrelay.channel.whatsapp;

import com.chatrelay.channel.ChatType;

import java.util.regex.Pattern;

/**
 * WhatsApp conversation id (JID) helpers.
 */
public final class WhatsAppJids {

    private WhatsAppJids() {
    }

    public static final String GROUP_SUFFIX = "@g.us";
    public static final String USER_SUFFIX = "@s.whatsapp.net";

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    public static boolean isGroup(String jid) {
        return jid != null && jid.endsWith(GROUP_SUFFIX);
    }

    public static ChatType chatTypeOf(String jid) {
        return isGroup(jid) ? ChatType.GROUP : ChatType.DIRECT;
    }

    /**
     * Build a direct-chat JID from a phone number in any format.
     *
     * @return the JID, or null when the number contains no digits
     */
    public static String directJidFromNumber(String number) {
        if (number == null) {
            return null;
        }
        String digits = NON_DIGITS.matcher(number).replaceAll("");
        return digits.isEmpty() ? null : digits + USER_SUFFIX;
    }
}
