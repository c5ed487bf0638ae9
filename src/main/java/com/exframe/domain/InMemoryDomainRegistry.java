package com.exframe.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exframe.exception.ConfigurationException;
import com.exframe.exception.UnknownDomainException;
import com.exframe.persona.PersonaCatalog;

/**
 * Process-wide domain table handed to the query processor. A domain that fails
 * validation is remembered as rejected so lookups report the recorded problem.
 */
public class InMemoryDomainRegistry implements DomainRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDomainRegistry.class);

    private final DomainValidator validator;
    private final Map<String, DomainConfiguration> domains = new ConcurrentHashMap<>();
    private final Map<String, ConfigurationException> rejected = new ConcurrentHashMap<>();

    public InMemoryDomainRegistry(PersonaCatalog personas) {
        this.validator = new DomainValidator(personas);
    }

    public void register(DomainConfiguration domain) {
        try {
            validator.validate(domain);
        } catch (ConfigurationException e) {
            domains.remove(domain.domainId());
            rejected.put(domain.domainId(), e);
            log.warn("domain.rejected id={} field={} reason={}", domain.domainId(), e.field(), e.getMessage());
            throw e;
        }
        rejected.remove(domain.domainId());
        domains.put(domain.domainId(), domain);
        log.info("domain.registered id={} persona={} patterns={}",
                domain.domainId(), domain.persona(), domain.patterns().size());
    }

    public void reject(String domainId, ConfigurationException failure) {
        domains.remove(domainId);
        rejected.put(domainId, failure);
    }

    public void remove(String domainId) {
        domains.remove(domainId);
        rejected.remove(domainId);
    }

    public Optional<ConfigurationException> rejection(String domainId) {
        return Optional.ofNullable(rejected.get(domainId));
    }

    @Override
    public DomainConfiguration getDomain(String domainId) {
        DomainConfiguration domain = domains.get(domainId);
        if (domain != null) {
            return domain;
        }
        ConfigurationException failure = rejected.get(domainId);
        if (failure != null) {
            throw new ConfigurationException(domainId, failure.field(), failure.getMessage(), failure);
        }
        throw new UnknownDomainException(domainId);
    }

    @Override
    public List<String> domainIds() {
        return new ArrayList<>(new TreeSet<>(domains.keySet()));
    }
}
