package com.exframe.inference;

import java.time.Duration;
import java.util.Locale;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exframe.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class ModelInvokers {
    private static final Logger log = LoggerFactory.getLogger(ModelInvokers.class);

    private ModelInvokers() {
    }

    public static ModelInvoker fromEnvironment(AppConfig.ModelConfig config, OkHttpClient httpClient) {
        return fromEnvironment(config, httpClient, System::getenv);
    }

    static ModelInvoker fromEnvironment(AppConfig.ModelConfig config,
            OkHttpClient httpClient,
            UnaryOperator<String> environment) {
        String model = valueOrDefault(environment.apply("LLM_MODEL"), config.getModel());
        String provider = config.getProvider() == null ? "offline" : config.getProvider().toLowerCase(Locale.ROOT);
        if ("offline".equals(provider)) {
            return new OfflineModelInvoker(model);
        }
        if (!"openai-compatible".equals(provider)) {
            throw new IllegalArgumentException("Unknown model provider: " + config.getProvider());
        }
        String apiKey = environment.apply(config.getApiKeyEnv());
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("model.unconfigured env={} missing; using offline model", config.getApiKeyEnv());
            return new OfflineModelInvoker(model);
        }
        String baseUrl = valueOrDefault(environment.apply("OPENAI_BASE_URL"), config.getBaseUrl());
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new ChatCompletionModelInvoker(client, baseUrl, apiKey, model, config.getTemperature(), config.getMaxTokens());
    }

    private static String valueOrDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
