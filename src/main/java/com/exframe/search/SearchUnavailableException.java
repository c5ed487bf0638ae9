package com.exframe.search;

public class SearchUnavailableException extends Exception {
    public SearchUnavailableException(String message) {
        super(message);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
