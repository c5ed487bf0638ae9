package com.exframe.search;

public class UnavailableInternetSearch implements InternetSearch {
    @Override
    public String search(String query) throws SearchUnavailableException {
        throw new SearchUnavailableException("No internet search endpoint is configured");
    }
}
