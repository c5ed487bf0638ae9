package com.exframe.inference;

import java.util.Optional;

public record ModelReply(String answer, String reasoning) {
    public ModelReply {
        answer = answer == null ? "" : answer;
        reasoning = reasoning == null || reasoning.isBlank() ? null : reasoning;
    }

    public static ModelReply answerOnly(String answer) {
        return new ModelReply(answer, null);
    }

    public Optional<String> reasoningText() {
        return Optional.ofNullable(reasoning);
    }
}
