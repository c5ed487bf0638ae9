package com.exframe.runtime;

import org.junit.jupiter.api.Test;

import com.exframe.library.LibraryLimits;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToOfflineModelAndBoundedLibrary() {
        AppConfig config = new AppConfig();

        assertEquals("offline", config.getModel().getProvider());
        assertEquals(LibraryLimits.defaults(), config.getLibrary().toLimits());
        assertEquals(4, config.getDispatch().getWorkerThreads());
        assertTrue(config.getSearch().getEndpoint().isEmpty());
        assertTrue(config.additionalPersonas().isEmpty());
    }

    @Test
    void shouldReplaceNullSectionsWithDefaults() {
        AppConfig config = new AppConfig();
        config.setLibrary(null);
        config.setModel(null);
        config.setPersonas(null);

        assertEquals(LibraryLimits.DEFAULT_MAX_DOCUMENTS, config.getLibrary().getMaxDocuments());
        assertEquals(8192, config.getModel().getMaxTokens());
        assertTrue(config.getPersonas().isEmpty());
    }
}
