package com.exframe.library;

/** One accepted library file; {@code identifier} is its path relative to the base, with '/' separators. */
public record LibraryDocument(String identifier, String content, boolean truncated) {
}
