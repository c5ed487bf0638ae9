package com.exframe.pattern;

/** A successful lookup. An empty {@code answer} is still a match. */
public record PatternMatch(String patternId, String answer, PatternMatcher matcher, int matchedLength) {
}
