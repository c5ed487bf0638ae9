package com.exframe.query;

import com.exframe.persona.DataSource;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceUsed {
    PATTERN("pattern"),
    NONE("none"),
    LIBRARY("library"),
    INTERNET("internet");

    private final String key;

    SourceUsed(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static SourceUsed of(DataSource dataSource) {
        return switch (dataSource) {
            case NONE -> NONE;
            case LIBRARY -> LIBRARY;
            case INTERNET -> INTERNET;
        };
    }
}
