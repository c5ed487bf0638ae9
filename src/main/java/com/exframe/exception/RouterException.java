package com.exframe.exception;

/**
 * Base unchecked failure for query routing. Carries the name of the offending
 * configuration field when one can be attributed.
 */
public class RouterException extends RuntimeException {
    private final String field;

    public RouterException(String message) {
        this(message, null, null);
    }

    public RouterException(String message, String field) {
        this(message, field, null);
    }

    public RouterException(String message, String field, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{message=" + getMessage()
                + (field == null ? "" : ", field=" + field)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
