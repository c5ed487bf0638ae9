package com.exframe.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class PatternStoreTest {

    @Test
    void shouldPreferLongestMatchedText() {
        PatternStore store = new PatternStore(List.of(
                entry("p1", "Country answer", PatternMatcher.substring("france")),
                entry("p2", "Paris", PatternMatcher.substring("capital of france"))));

        PatternMatch match = store.lookup("What is the capital of France?").orElseThrow();

        assertEquals("p2", match.patternId());
        assertEquals("Paris", match.answer());
        assertEquals("capital of france".length(), match.matchedLength());
    }

    @Test
    void shouldBreakTiesByLowestPatternId() {
        PatternStore store = new PatternStore(List.of(
                entry("p9", "nine", PatternMatcher.substring("reset password")),
                entry("p10", "ten", PatternMatcher.substring("reset password")),
                entry("p2", "two", PatternMatcher.substring("reset password"))));

        assertEquals("p10", store.lookup("how do I reset password").orElseThrow().patternId());
    }

    @Test
    void shouldMatchRegardlessOfCaseAndSpacing() {
        PatternStore store = new PatternStore(List.of(entry("p1", "Paris", PatternMatcher.substring("Capital  of France"))));

        assertTrue(store.lookup("  CAPITAL\tof\n france ").isPresent());
    }

    @Test
    void shouldDistinguishNoMatchFromEmptyAnswer() {
        PatternStore store = new PatternStore(List.of(entry("p1", "", PatternMatcher.substring("ping"))));

        Optional<PatternMatch> hit = store.lookup("ping");
        Optional<PatternMatch> miss = store.lookup("pong");

        assertTrue(hit.isPresent());
        assertEquals("", hit.get().answer());
        assertFalse(miss.isPresent());
    }

    @Test
    void shouldNeverMatchEmptyMatcher() {
        PatternStore store = new PatternStore(List.of(entry("p1", "anything", PatternMatcher.substring("   "))));

        assertFalse(store.lookup("any query at all").isPresent());
    }

    @Test
    void shouldReturnEmptyForEmptyStore() {
        assertFalse(PatternStore.empty().lookup("capital of France").isPresent());
    }

    @Test
    void shouldHonourExactAndAllWordsMatchers() {
        PatternStore store = new PatternStore(List.of(
                entry("exact", "exact answer", new PatternMatcher(MatchKind.EXACT, "status")),
                entry("words", "words answer", new PatternMatcher(MatchKind.ALL_WORDS, "refund order"))));

        assertEquals("exact", store.lookup("Status").orElseThrow().patternId());
        assertFalse(store.lookup("status please").isPresent());
        assertEquals("words", store.lookup("order 42 needs a refund").orElseThrow().patternId());
        assertFalse(store.lookup("order 42 needs a refunding").isPresent());
    }

    @Test
    void shouldRejectDuplicatePatternIds() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> new PatternStore(List.of(
                entry("p1", "a", PatternMatcher.substring("a")),
                entry("p1", "b", PatternMatcher.substring("b")))));

        assertEquals("Duplicate pattern id: p1", ex.getMessage());
    }

    @Test
    void shouldGiveSameResultForRepeatedLookups() {
        PatternStore store = new PatternStore(List.of(entry("p1", "Paris", PatternMatcher.substring("france"))));

        assertEquals(store.lookup("france?"), store.lookup("france?"));
        assertEquals(1, store.size());
    }

    private static PatternEntry entry(String id, String answer, PatternMatcher matcher) {
        return new PatternEntry(id, id, "", answer, List.of(matcher), 0L);
    }
}
