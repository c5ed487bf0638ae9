package com.exframe.library;

import java.io.IOException;
import java.nio.file.Path;

public class LibraryPathException extends IOException {
    private final Path path;

    public LibraryPathException(Path path, String message) {
        this(path, message, null);
    }

    public LibraryPathException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
