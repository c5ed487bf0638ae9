package com.exframe.persona;

import java.util.Locale;
import java.util.Objects;

/**
 * Named capability bundle: which knowledge source a domain falls back to and
 * whether reasoning is revealed when the caller does not say.
 */
public record Persona(String name, DataSource dataSource, boolean revealReasoningDefault) {
    public Persona {
        Objects.requireNonNull(dataSource, "dataSource");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Persona name must not be blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
    }
}
