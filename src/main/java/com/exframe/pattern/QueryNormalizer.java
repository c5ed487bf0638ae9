package com.exframe.pattern;

import java.util.Locale;
import java.util.regex.Pattern;

public final class QueryNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
