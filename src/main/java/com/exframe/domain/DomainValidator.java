package com.exframe.domain;

import java.nio.file.Files;

import com.exframe.exception.ConfigurationException;
import com.exframe.persona.DataSource;
import com.exframe.persona.Persona;
import com.exframe.persona.PersonaCatalog;

public class DomainValidator {
    private final PersonaCatalog personas;

    public DomainValidator(PersonaCatalog personas) {
        this.personas = personas;
    }

    public Persona validate(DomainConfiguration domain) {
        Persona persona;
        try {
            persona = personas.get(domain.persona());
        } catch (ConfigurationException e) {
            throw new ConfigurationException(domain.domainId(), "persona", e.getMessage());
        }
        if (persona.dataSource() == DataSource.LIBRARY) {
            if (domain.libraryBasePath() == null || domain.libraryBasePath().toString().isBlank()) {
                throw new ConfigurationException(domain.domainId(), "library_base_path",
                        "Persona " + persona.name() + " requires library_base_path for domain " + domain.domainId());
            }
            if (!Files.isDirectory(domain.libraryBasePath())) {
                throw new ConfigurationException(domain.domainId(), "library_base_path",
                        "library_base_path " + domain.libraryBasePath() + " for domain " + domain.domainId()
                                + " does not exist or is not a directory");
            }
        }
        return persona;
    }
}
