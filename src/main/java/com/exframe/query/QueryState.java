package com.exframe.query;

public enum QueryState {
    START,
    PATTERN_CHECK,
    PATTERN_HIT,
    FALLBACK,
    DATA_SOURCE_DISPATCH,
    DONE
}
