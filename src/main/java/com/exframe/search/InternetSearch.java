package com.exframe.search;

/** Best-effort web lookup; the returned text is used verbatim as query context. */
public interface InternetSearch {
    String search(String query) throws SearchUnavailableException;
}
