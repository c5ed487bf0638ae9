package com.exframe.search;

import java.time.Duration;

import com.exframe.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class InternetSearches {
    private InternetSearches() {
    }

    public static InternetSearch fromConfig(AppConfig.SearchConfig config, OkHttpClient httpClient) {
        String endpoint = System.getenv("EXFRAME_SEARCH_URL");
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = config.getEndpoint();
        }
        if (endpoint == null || endpoint.isBlank()) {
            return new UnavailableInternetSearch();
        }
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new HttpInternetSearch(client, endpoint);
    }
}
