package com.chatrelay.channel;

import com.chatrelay.common.config.RelayConfig;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Who the bot answers to: display-name aliases, numeric aliases and command
 * prefixes. Aliases and prefixes are stored lower-cased, longest first.
 */
public record TriggerRules(List<String> nameAliases, List<String> numberAliases, List<String> commandPrefixes) {

    public TriggerRules {
        nameAliases = normalize(nameAliases);
        numberAliases = normalize(numberAliases);
        commandPrefixes = normalize(commandPrefixes);
    }

    public static TriggerRules fromConfig(RelayConfig.TriggerConfig config) {
        if (config == null) {
            config = new RelayConfig.TriggerConfig();
        }
        return new TriggerRules(config.getNameAliases(), config.getNumberAliases(), config.getCommandPrefixes());
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .filter(v -> !v.isEmpty())
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }
}
