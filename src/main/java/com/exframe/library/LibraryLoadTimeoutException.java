package com.exframe.library;

import java.nio.file.Path;

/** Enumeration exceeded the wall-clock or file-count ceiling. */
public class LibraryLoadTimeoutException extends LibraryPathException {
    public LibraryLoadTimeoutException(Path path, String message) {
        super(path, message);
    }
}
