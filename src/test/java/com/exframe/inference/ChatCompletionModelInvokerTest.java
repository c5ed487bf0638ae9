package com.exframe.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

class ChatCompletionModelInvokerTest {
    private static final MediaType JSON = MediaType.get("application/json");

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<Request> captured = new AtomicReference<>();

    @Test
    void shouldPostChatCompletionRequest() throws Exception {
        ChatCompletionModelInvoker invoker = invoker(respond(200,
                "{\"choices\":[{\"message\":{\"content\":\"Paris\",\"reasoning_content\":\"France's capital\"}}]}"));

        ModelReply reply = invoker.invoke("capital of France?", "Library documents:", true);

        assertEquals("Paris", reply.answer());
        assertEquals("France's capital", reply.reasoning());
        Request request = captured.get();
        assertEquals("https://models.example.test/v1/chat/completions", request.url().toString());
        assertEquals("Bearer secret", request.header("Authorization"));
        JsonNode payload = mapper.readTree(bodyOf(request));
        assertEquals("glm-4.7", payload.path("model").asText());
        assertEquals(512, payload.path("max_tokens").asInt());
        assertEquals("system", payload.path("messages").path(0).path("role").asText());
        assertTrue(payload.path("messages").path(1).path("content").asText().startsWith("Context:\nLibrary documents:"));
    }

    @Test
    void shouldSplitLeadingThinkBlock() {
        ChatCompletionModelInvoker invoker = invoker(respond(200, "{}"));

        ModelReply reply = invoker.parse(mapper.valueToTree(Map.of("choices", List.of(
                Map.of("message", Map.of("content", "<think>weighing options</think>\nAnswer text"))))));

        assertEquals("Answer text", reply.answer());
        assertEquals("weighing options", reply.reasoning());
    }

    @Test
    void shouldReturnNoReasoningWhenModelGivesNone() {
        ModelReply reply = invoker(respond(200, "{\"choices\":[{\"message\":{\"content\":\"plain\"}}]}"))
                .invoke("q", "", false);

        assertEquals("plain", reply.answer());
        assertNull(reply.reasoning());
    }

    @Test
    void shouldFailOnErrorStatus() {
        ChatCompletionModelInvoker invoker = invoker(respond(503, "{\"error\":\"overloaded\"}"));

        ModelInvocationException ex = assertThrows(ModelInvocationException.class, () -> invoker.invoke("q", "", false));

        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    void shouldFailOnUnexpectedBody() {
        ChatCompletionModelInvoker invoker = invoker(respond(200, "{\"choices\":[]}"));

        assertThrows(ModelInvocationException.class, () -> invoker.invoke("q", "", false));
    }

    @Test
    void shouldWrapTransportFailure() {
        ChatCompletionModelInvoker invoker = invoker(chain -> {
            throw new IOException("connection reset");
        });

        ModelInvocationException ex = assertThrows(ModelInvocationException.class, () -> invoker.invoke("q", "", false));

        assertTrue(ex.getCause() instanceof IOException);
    }

    private ChatCompletionModelInvoker invoker(Interceptor interceptor) {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(interceptor).build();
        return new ChatCompletionModelInvoker(client, "https://models.example.test/v1/", "secret", "glm-4.7", 0.2, 512);
    }

    private Interceptor respond(int code, String body) {
        return chain -> {
            captured.set(chain.request());
            return new Response.Builder()
                    .request(chain.request())
                    .protocol(Protocol.HTTP_1_1)
                    .code(code)
                    .message("status " + code)
                    .body(ResponseBody.create(body, JSON))
                    .build();
        };
    }

    private static String bodyOf(Request request) throws IOException {
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        return buffer.readUtf8();
    }
}
