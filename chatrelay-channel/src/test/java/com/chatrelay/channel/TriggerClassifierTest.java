package com.chatrelay.channel;

import com.chatrelay.channel.TriggerClassifier.Classification;
import com.chatrelay.channel.TriggerClassifier.RejectReason;
import com.chatrelay.common.config.RelayConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TriggerClassifier}.
 */
class TriggerClassifierTest {

    private TriggerClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new TriggerClassifier(new TriggerRules(
                List.of("yesbank bot", "ai response"),
                List.of("65559051915364"),
                List.of("/bot", "!bot")));
    }

    // =========================================================================
    // Admission
    // =========================================================================

    @Test
    void direct_plainText_admitted() {
        Classification result = classifier.classify("hello", ChatType.DIRECT);

        assertTrue(result.admitted());
        assertEquals("hello", result.text());
    }

    @Test
    void group_plainText_rejectedSilently() {
        Classification result = classifier.classify("hello", ChatType.GROUP);

        assertFalse(result.admitted());
        assertNull(result.text());
        assertEquals(RejectReason.NOT_TRIGGERED, result.reason());
    }

    @Test
    void group_nameMention_admittedWithMentionRemoved() {
        Classification result = classifier.classify("@ai response please help", ChatType.GROUP);

        assertTrue(result.admitted());
        assertEquals("please help", result.text());
    }

    @Test
    void group_nameMention_isCaseInsensitive() {
        Classification result = classifier.classify("@AI Response What is the rate?", ChatType.GROUP);

        assertTrue(result.admitted());
        assertEquals("What is the rate?", result.text());
    }

    @Test
    void group_nameMentionInMiddle_admitted() {
        Classification result = classifier.classify("hey @yesbank bot open an account", ChatType.GROUP);

        assertTrue(result.admitted());
        assertEquals("hey  open an account", result.text());
    }

    @Test
    void group_numericMention_admitted() {
        Classification result = classifier.classify("@65559051915364 balance please", ChatType.GROUP);

        assertTrue(result.admitted());
        assertEquals("balance please", result.text());
    }

    @Test
    void group_commandPrefix_admittedWithCommandRemoved() {
        Classification result = classifier.classify("/bot what is x", ChatType.GROUP);

        assertTrue(result.admitted());
        assertEquals("what is x", result.text());
    }

    @Test
    void group_commandPrefix_isCaseInsensitiveAndPreservesCase() {
        Classification result = classifier.classify("!BOT What Is X", ChatType.GROUP);

        assertTrue(result.admitted());
        assertEquals("What Is X", result.text());
    }

    @Test
    void group_commandNotAtStart_rejected() {
        Classification result = classifier.classify("please /bot help", ChatType.GROUP);

        assertFalse(result.admitted());
        assertEquals(RejectReason.NOT_TRIGGERED, result.reason());
    }

    @Test
    void group_mentionOfSomeoneElse_rejected() {
        Classification result = classifier.classify("@alice are you there", ChatType.GROUP);

        assertFalse(result.admitted());
    }

    @Test
    void direct_otherMentionsAreStripped() {
        Classification result = classifier.classify("@alice @bob ping", ChatType.DIRECT);

        assertTrue(result.admitted());
        assertEquals("ping", result.text());
    }

    @Test
    void direct_commandStrippedEvenWithoutGroupRule() {
        Classification result = classifier.classify("/bot  hi there ", ChatType.DIRECT);

        assertTrue(result.admitted());
        assertEquals("hi there", result.text());
    }

    // =========================================================================
    // Rejection on empty text
    // =========================================================================

    @Test
    void emptyText_rejected() {
        assertEquals(RejectReason.EMPTY_TEXT, classifier.classify("", ChatType.DIRECT).reason());
        assertEquals(RejectReason.EMPTY_TEXT, classifier.classify("", ChatType.GROUP).reason());
        assertEquals(RejectReason.EMPTY_TEXT, classifier.classify(null, ChatType.GROUP).reason());
    }

    @Test
    void group_mentionOnly_rejectedAfterCleanup() {
        Classification result = classifier.classify("@ai response", ChatType.GROUP);

        assertFalse(result.admitted());
        assertEquals(RejectReason.EMPTY_AFTER_CLEANUP, result.reason());
    }

    @Test
    void group_commandOnly_rejectedAfterCleanup() {
        Classification result = classifier.classify("/bot   ", ChatType.GROUP);

        assertFalse(result.admitted());
        assertEquals(RejectReason.EMPTY_AFTER_CLEANUP, result.reason());
    }

    @Test
    void direct_whitespaceOnly_rejectedAfterCleanup() {
        Classification result = classifier.classify("   ", ChatType.DIRECT);

        assertFalse(result.admitted());
        assertEquals(RejectReason.EMPTY_AFTER_CLEANUP, result.reason());
    }

    // =========================================================================
    // Message field precedence
    // =========================================================================

    @Test
    void classifyMessage_usesImageCaptionWhenNoBody() {
        InboundMessage message = InboundMessage.builder()
                .conversationId("123@g.us")
                .chatType(ChatType.GROUP)
                .imageCaption("!bot what is this")
                .build();

        Classification result = classifier.classify(message);

        assertTrue(result.admitted());
        assertEquals("what is this", result.text());
    }

    @Test
    void classifyMessage_noTextFields_rejected() {
        InboundMessage message = InboundMessage.builder()
                .conversationId("1@s.whatsapp.net")
                .chatType(ChatType.DIRECT)
                .build();

        assertEquals(RejectReason.EMPTY_TEXT, classifier.classify(message).reason());
    }

    // =========================================================================
    // Rules
    // =========================================================================

    @Test
    void rules_fromDefaultConfig() {
        TriggerRules rules = TriggerRules.fromConfig(new RelayConfig.TriggerConfig());

        assertTrue(rules.nameAliases().contains("yes bank bot"));
        assertEquals(List.of("65559051915364"), rules.numberAliases());
        assertTrue(rules.commandPrefixes().containsAll(List.of("/bot", "!bot")));
    }

    @Test
    void rules_areLowerCasedTrimmedAndDeduplicated() {
        TriggerRules rules = new TriggerRules(List.of(" AI Response ", "ai response"), null, List.of("/Bot"));

        assertEquals(List.of("ai response"), rules.nameAliases());
        assertEquals(List.of(), rules.numberAliases());
        assertEquals(List.of("/bot"), rules.commandPrefixes());
    }
}
