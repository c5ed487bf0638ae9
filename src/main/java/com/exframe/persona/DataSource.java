package com.exframe.persona;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DataSource {
    NONE("none"),
    LIBRARY("library"),
    INTERNET("internet");

    private final String key;

    DataSource(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static DataSource fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Data source must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("void".equals(normalized)) {
            return NONE;
        }
        for (DataSource source : values()) {
            if (source.key.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Invalid data source: " + value + ". Valid: none, library, internet");
    }
}
