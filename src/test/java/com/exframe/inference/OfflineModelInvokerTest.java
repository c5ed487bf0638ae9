package com.exframe.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OfflineModelInvokerTest {

    private final OfflineModelInvoker invoker = new OfflineModelInvoker("glm-4.7");

    @Test
    void shouldQuoteMatchingContextSentence() {
        ModelReply reply = invoker.invoke("Where is the archive kept?",
                "Office hours start at nine. The archive is kept in the basement.", false);

        assertEquals("Model=glm-4.7\nRequest: Where is the archive kept?\n"
                + "Grounded evidence: The archive is kept in the basement.", reply.answer());
        assertTrue(reply.reasoningText().isEmpty());
    }

    @Test
    void shouldAnswerWithoutContext() {
        ModelReply reply = invoker.invoke("write a haiku", "", true);

        assertTrue(reply.answer().contains("No context supplied"));
        assertTrue(reply.reasoningText().orElseThrow().contains("haiku"));
    }

    @Test
    void shouldRejectBlankQuery() {
        assertThrows(ModelInvocationException.class, () -> invoker.invoke(" ", "context", false));
    }
}
