package com.exframe.exception;

public class UnknownDomainException extends ConfigurationException {
    public UnknownDomainException(String domainId) {
        super(domainId, "domain_id", "Unknown domain: " + domainId);
    }
}
