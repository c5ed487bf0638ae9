package com.exframe.exception;

/** A domain, persona or deployment setting that cannot serve queries as configured. */
public class ConfigurationException extends RouterException {
    private final String domainId;

    public ConfigurationException(String domainId, String field, String message) {
        this(domainId, field, message, null);
    }

    public ConfigurationException(String domainId, String field, String message, Throwable cause) {
        super(message, field, cause);
        this.domainId = domainId;
    }

    public String domainId() {
        return domainId;
    }
}
