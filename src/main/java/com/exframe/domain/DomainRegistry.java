package com.exframe.domain;

import java.util.List;

import com.exframe.exception.ConfigurationException;

public interface DomainRegistry {
    /**
     * @throws ConfigurationException when the domain is unknown or was rejected at registration
     */
    DomainConfiguration getDomain(String domainId);

    List<String> domainIds();
}
