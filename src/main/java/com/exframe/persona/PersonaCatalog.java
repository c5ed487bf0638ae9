package com.exframe.persona;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.exframe.exception.ConfigurationException;

/**
 * Closed table of personas, fixed at startup. New personas are added as rows,
 * never as new types.
 */
public final class PersonaCatalog {
    public static final Persona POET = new Persona("poet", DataSource.NONE, false);
    public static final Persona LIBRARIAN = new Persona("librarian", DataSource.LIBRARY, true);
    public static final Persona RESEARCHER = new Persona("researcher", DataSource.INTERNET, true);

    private final Map<String, Persona> personas;

    private PersonaCatalog(Map<String, Persona> personas) {
        this.personas = Collections.unmodifiableMap(personas);
    }

    public static PersonaCatalog builtIn() {
        return withAdditional(List.of());
    }

    public static PersonaCatalog withAdditional(List<Persona> additional) {
        Map<String, Persona> all = new LinkedHashMap<>();
        for (Persona persona : List.of(POET, LIBRARIAN, RESEARCHER)) {
            all.put(persona.name(), persona);
        }
        for (Persona persona : additional) {
            if (all.containsKey(persona.name())) {
                throw new ConfigurationException(null, "personas",
                        "Persona " + persona.name() + " is already defined and cannot be redefined");
            }
            all.put(persona.name(), persona);
        }
        return new PersonaCatalog(all);
    }

    public Persona get(String name) {
        Persona persona = name == null ? null : personas.get(name.trim().toLowerCase(Locale.ROOT));
        if (persona == null) {
            throw new ConfigurationException(null, "persona",
                    "Unknown persona: " + name + ". Valid: " + String.join(", ", personas.keySet()));
        }
        return persona;
    }

    public boolean contains(String name) {
        return name != null && personas.containsKey(name.trim().toLowerCase(Locale.ROOT));
    }

    public Collection<Persona> all() {
        return personas.values();
    }
}
