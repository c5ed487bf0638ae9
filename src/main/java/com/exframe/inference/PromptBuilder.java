package com.exframe.inference;

public final class PromptBuilder {
    private static final String SYSTEM_POLICY = String.join("\n",
            "You are a helpful assistant answering within a single knowledge domain.",
            "Behavior rules:",
            "- Prefer the supplied context over general knowledge when it is relevant.",
            "- If the context does not cover the question, say so before answering from general knowledge.",
            "- Keep answers concise and direct.");
    private static final String THINKING_SYSTEM_SUFFIX =
            "\n- Always show your step-by-step reasoning before providing your final answer.";
    static final String THINKING_INSTRUCTION = "Before answering, briefly explain your reasoning process.";

    private PromptBuilder() {
    }

    public static String systemMessage(boolean showThinking) {
        return showThinking ? SYSTEM_POLICY + THINKING_SYSTEM_SUFFIX : SYSTEM_POLICY;
    }

    public static String userPrompt(String query, String context, boolean showThinking) {
        StringBuilder builder = new StringBuilder();
        if (context != null && !context.isBlank()) {
            builder.append("Context:\n")
                    .append(context)
                    .append("\n\n");
        }
        builder.append("Query: ").append(query);
        if (showThinking) {
            builder.append("\n\n").append(THINKING_INSTRUCTION);
        }
        return builder.toString();
    }
}
