package com.chatrelay.channel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether an inbound message should produce a backend query and
 * extracts the query text.
 * <p>
 * Direct messages are always admitted. Group messages are admitted only when
 * the bot is addressed: an {@code @alias} mention (name or numeric) anywhere in
 * the text, or a command prefix at the very start. Admitted text is cleaned of
 * mentions and the leading command; a message that is empty before or after
 * cleaning is rejected. Rejection is silent and never an error.
 */
public class TriggerClassifier {

    /** Why a message was not admitted. */
    public enum RejectReason {
        EMPTY_TEXT,
        NOT_TRIGGERED,
        EMPTY_AFTER_CLEANUP
    }

    /** Classification outcome: either admitted with clean text, or rejected. */
    public record Classification(boolean admitted, String text, RejectReason reason) {

        public static Classification admit(String text) {
            return new Classification(true, text, null);
        }

        public static Classification reject(RejectReason reason) {
            return new Classification(false, null, reason);
        }
    }

    private static final Pattern ANY_MENTION = Pattern.compile("@\\S+");

    private final TriggerRules rules;
    private final List<Pattern> aliasMentions;
    private final List<Pattern> commandPatterns;

    public TriggerClassifier(TriggerRules rules) {
        this.rules = rules;
        this.aliasMentions = new ArrayList<>();
        for (String alias : rules.nameAliases()) {
            aliasMentions.add(Pattern.compile("@" + Pattern.quote(alias) + "(?![\\p{L}\\p{N}_])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        for (String alias : rules.numberAliases()) {
            aliasMentions.add(Pattern.compile("@" + Pattern.quote(alias) + "(?!\\d)"));
        }
        this.commandPatterns = new ArrayList<>();
        for (String prefix : rules.commandPrefixes()) {
            commandPatterns.add(Pattern.compile("^" + Pattern.quote(prefix),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
    }

    public TriggerRules getRules() {
        return rules;
    }

    public Classification classify(InboundMessage message) {
        return classify(message.resolveText(), message.getChatType());
    }

    public Classification classify(String text, ChatType chatType) {
        if (text == null || text.isEmpty()) {
            return Classification.reject(RejectReason.EMPTY_TEXT);
        }

        if (chatType == ChatType.GROUP && !isTriggered(text)) {
            return Classification.reject(RejectReason.NOT_TRIGGERED);
        }

        String cleaned = clean(text);
        if (cleaned.isEmpty()) {
            return Classification.reject(RejectReason.EMPTY_AFTER_CLEANUP);
        }
        return Classification.admit(cleaned);
    }

    /**
     * True when the text mentions a configured alias or starts with a command
     * prefix (all case-insensitive).
     */
    public boolean isTriggered(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        boolean nameMentioned = rules.nameAliases().stream().anyMatch(name -> lower.contains("@" + name));
        boolean numberMentioned = rules.numberAliases().stream().anyMatch(num -> lower.contains("@" + num));
        boolean commandTriggered = rules.commandPrefixes().stream().anyMatch(lower::startsWith);
        return nameMentioned || numberMentioned || commandTriggered;
    }

    /**
     * Strip alias mentions (which may contain spaces), then any remaining
     * {@code @token}, then leading command prefixes; finally trim.
     */
    String clean(String text) {
        String result = text;
        for (Pattern alias : aliasMentions) {
            result = alias.matcher(result).replaceAll("");
        }
        result = ANY_MENTION.matcher(result).replaceAll("");
        for (Pattern command : commandPatterns) {
            result = command.matcher(result).replaceFirst("");
        }
        return result.trim();
    }
}
