package com.exframe.pattern;

import java.util.Locale;

public enum MatchKind {
    SUBSTRING,
    EXACT,
    ALL_WORDS;

    public static MatchKind fromKey(String value) {
        if (value == null || value.isBlank()) {
            return SUBSTRING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "substring", "text" -> SUBSTRING;
            case "exact" -> EXACT;
            case "all_words", "keywords" -> ALL_WORDS;
            default -> throw new IllegalArgumentException("Unknown matcher type: " + value);
        };
    }
}
