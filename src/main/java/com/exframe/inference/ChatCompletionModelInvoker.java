package com.exframe.inference;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Calls an OpenAI-compatible {@code /chat/completions} endpoint. */
public class ChatCompletionModelInvoker implements ModelInvoker {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionModelInvoker.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final Pattern THINK_BLOCK = Pattern.compile("^\\s*<think>(.*?)</think>\\s*", Pattern.DOTALL);

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public ChatCompletionModelInvoker(OkHttpClient httpClient,
            String baseUrl,
            String apiKey,
            String model,
            double temperature,
            int maxTokens) {
        this.httpClient = httpClient;
        this.endpoint = stripTrailingSlash(baseUrl) + "/chat/completions";
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public ModelReply invoke(String query, String context, boolean showThinking) {
        Map<String, Object> payload = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "temperature", temperature,
                "stream", false,
                "messages", List.of(
                        Map.of("role", "system", "content", PromptBuilder.systemMessage(showThinking)),
                        Map.of("role", "user", "content", PromptBuilder.userPrompt(query, context, showThinking))));
        try {
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            log.debug("model.call endpoint={} model={} temperature={}", endpoint, model, temperature);
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new ModelInvocationException("Model endpoint returned HTTP " + response.code());
                }
                return parse(mapper.readTree(body.string()));
            }
        } catch (IOException e) {
            throw new ModelInvocationException("Model endpoint call failed: " + e.getMessage(), e);
        }
    }

    ModelReply parse(JsonNode root) {
        JsonNode message = root.path("choices").path(0).path("message");
        if (!message.hasNonNull("content")) {
            throw new ModelInvocationException("Unexpected model response format");
        }
        String content = message.path("content").asText();
        String reasoning = message.path("reasoning_content").asText(null);
        if (reasoning == null || reasoning.isBlank()) {
            Matcher think = THINK_BLOCK.matcher(content);
            if (think.find()) {
                reasoning = think.group(1).trim();
                content = content.substring(think.end());
            }
        }
        return new ModelReply(content.strip(), reasoning);
    }

    private static String stripTrailingSlash(String value) {
        String trimmed = value == null ? "" : value.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
