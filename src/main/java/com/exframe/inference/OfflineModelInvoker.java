package com.exframe.inference;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic stand-in used when no model endpoint is configured. It answers
 * with the context sentence that best overlaps the query.
 */
public class OfflineModelInvoker implements ModelInvoker {
    private final String modelName;

    public OfflineModelInvoker() {
        this("offline");
    }

    public OfflineModelInvoker(String modelName) {
        this.modelName = modelName;
    }

    @Override
    public ModelReply invoke(String query, String context, boolean showThinking) {
        if (query == null || query.isBlank()) {
            throw new ModelInvocationException("Query must not be blank");
        }
        Set<String> keywords = keywords(query);
        String evidence = context == null || context.isBlank()
                ? "No context supplied; answering without retrieved material."
                : firstMatchingSentence(context, keywords);

        String answer = "Model=" + modelName
                + "\nRequest: " + query.strip()
                + "\nGrounded evidence: " + evidence;
        if (!showThinking) {
            return ModelReply.answerOnly(answer);
        }
        String reasoning = "Matched query keywords " + keywords
                + " against " + (context == null ? 0 : context.length()) + " context characters.";
        return new ModelReply(answer, reasoning);
    }

    private static Set<String> keywords(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String firstMatchingSentence(String text, Set<String> keywords) {
        String[] sentences = text.strip().split("(?<=[.!?])\\s+|\\n+");
        for (String sentence : sentences) {
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                return sentence.trim();
            }
        }
        return sentences[0].trim();
    }
}
