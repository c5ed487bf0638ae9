package com.exframe.query;

import java.util.List;
import java.util.stream.Collectors;

import com.exframe.library.LibraryDocument;

final class ContextAssembler {
    private ContextAssembler() {
    }

    static String library(List<LibraryDocument> documents) {
        if (documents.isEmpty()) {
            return "";
        }
        return documents.stream()
                .map(document -> "**Document: " + document.identifier() + "**\n" + document.content())
                .collect(Collectors.joining("\n\n", "Library documents:\n\n", ""));
    }
}
