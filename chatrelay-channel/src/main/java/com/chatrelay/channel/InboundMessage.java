package com.chatrelay.channel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message received from the transport. Read-only input to the trigger
 * classifier; not retained after dispatch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    /** Channel the message arrived on (e.g. "whatsapp"); replies go back through it. */
    private String channelId;
    /** Conversation the message belongs to (direct or group). */
    private String conversationId;
    private ChatType chatType;
    /** Participant who sent the message (equal to conversationId in direct chats). */
    private String senderId;
    private String senderName;
    private String messageId;

    // --- Text-bearing fields, in precedence order ---
    private String body;
    private String extendedText;
    private String imageCaption;
    private String videoCaption;

    /**
     * First non-empty text among body, extended text, image caption and video
     * caption; empty string when none is present.
     */
    public String resolveText() {
        for (String candidate : new String[] { body, extendedText, imageCaption, videoCaption }) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }

    public boolean isGroup() {
        return chatType == ChatType.GROUP;
    }
}
