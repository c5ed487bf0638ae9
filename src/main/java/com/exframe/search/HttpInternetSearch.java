package com.exframe.search;

import java.io.IOException;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpInternetSearch implements InternetSearch {
    private final OkHttpClient httpClient;
    private final HttpUrl endpoint;

    public HttpInternetSearch(OkHttpClient httpClient, String endpoint) {
        this.httpClient = httpClient;
        HttpUrl parsed = HttpUrl.parse(endpoint);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid search endpoint: " + endpoint);
        }
        this.endpoint = parsed;
    }

    @Override
    public String search(String query) throws SearchUnavailableException {
        Request request = new Request.Builder()
                .url(endpoint.newBuilder().addQueryParameter("q", query).build())
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new SearchUnavailableException("Search endpoint returned HTTP " + response.code());
            }
            String text = body.string();
            if (text.isBlank()) {
                throw new SearchUnavailableException("Search endpoint returned an empty body");
            }
            return text;
        } catch (IOException e) {
            throw new SearchUnavailableException("Search endpoint unreachable: " + e.getMessage(), e);
        }
    }
}
