package com.openforge.streamkit.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.streamkit.config.AppConfig;
import com.openforge.streamkit.config.Resilience4jConfig;
import com.openforge.streamkit.llm.model.StreamChunk;
import com.openforge.streamkit.llm.stream.MessageStreamSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmStreamClientTest {

    private static final String SSE_BODY = """
            event: message_start
            data: {"type":"message_start","message":{"id":"msg_1","usage":{"input_tokens":4}}}

            event: content_block_delta
            data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"Hi"}}

            event: message_stop
            data: {"type":"message_stop"}

            """;

    private HttpClient httpClient;
    private HttpResponse<InputStream> response;
    private ObjectMapper objectMapper;
    private LlmStreamClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        objectMapper = new AppConfig().objectMapper();
        client = new LlmStreamClient(httpClient, objectMapper, new LlmProperties.ProviderConfig(
                "primary", "https://llm.example.test/v1", "sk-test", "model-a", "2023-06-01", 45));
    }

    private ObjectNode requestBody() {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("max_tokens", 256);
        body.putArray("messages").addObject().put("role", "user").put("content", "Hello");
        return body;
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    private static String bodyOf(HttpRequest request) throws Exception {
        CompletableFuture<String> done = new CompletableFuture<>();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        request.bodyPublisher().orElseThrow().subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(ByteBuffer item) {
                byte[] bytes = new byte[item.remaining()];
                item.get(bytes);
                out.write(bytes, 0, bytes.length);
            }

            @Override
            public void onError(Throwable throwable) {
                done.completeExceptionally(throwable);
            }

            @Override
            public void onComplete() {
                done.complete(out.toString(StandardCharsets.UTF_8));
            }
        });
        return done.get(5, TimeUnit.SECONDS);
    }

    // ===== Request =====

    @Test
    void shouldPostStreamingRequestWithProviderHeaders() throws Exception {
        respond(200, SSE_BODY);

        client.openStream(requestBody());

        HttpRequest request = sentRequest();
        assertEquals("POST", request.method());
        assertEquals("https://llm.example.test/v1/messages", request.uri().toString());
        assertEquals("sk-test", request.headers().firstValue("x-api-key").orElseThrow());
        assertEquals("2023-06-01", request.headers().firstValue("anthropic-version").orElseThrow());
        assertEquals("text/event-stream", request.headers().firstValue("Accept").orElseThrow());
        assertEquals("application/json", request.headers().firstValue("Content-Type").orElseThrow());
        assertEquals(Duration.ofSeconds(45), request.timeout().orElseThrow());

        JsonNode sent = objectMapper.readTree(bodyOf(request));
        assertTrue(sent.get("stream").asBoolean());
        assertEquals("model-a", sent.get("model").asText());
        assertEquals(256, sent.get("max_tokens").asInt());
    }

    @Test
    void shouldKeepCallerModelAndLeaveCallerBodyUntouched() throws Exception {
        respond(200, SSE_BODY);
        ObjectNode body = requestBody().put("model", "caller-model");

        client.openStream(body);

        JsonNode sent = objectMapper.readTree(bodyOf(sentRequest()));
        assertEquals("caller-model", sent.get("model").asText());
        assertFalse(body.has("stream"));
    }

    @Test
    void shouldRejectNullBody() {
        assertThrows(LlmException.class, () -> client.openStream(null));
        verifyNoInteractions(httpClient);
    }

    // ===== Response =====

    @Test
    void shouldDecodeEventStreamBody() throws Exception {
        respond(200, SSE_BODY);

        try (MessageStreamSession session = client.openStream(requestBody())) {
            assertEquals(new StreamChunk.TextDelta("Hi"), session.nextChunk().orElseThrow());
            assertTrue(session.nextChunk().isEmpty());
            assertEquals(MessageStreamSession.State.TERMINAL_EOF, session.state());
        }
    }

    @Test
    void shouldThrowRateLimitOn429() throws Exception {
        respond(429, "{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\"}}");

        LlmException e = assertThrows(LlmException.class, () -> client.openStream(requestBody()));

        assertInstanceOf(LlmException.LlmRateLimitException.class, e);
        assertTrue(Resilience4jConfig.isRetryable(e));
    }

    @Test
    void shouldIncludeStatusAndBodySnippetOnHttpError() throws Exception {
        respond(400, "{\"type\":\"error\",\"error\":{\"type\":\"invalid_request_error\",\"message\":\"bad model\"}}");

        LlmException e = assertThrows(LlmException.class, () -> client.openStream(requestBody()));

        assertTrue(e.getMessage().contains("HTTP 400"));
        assertTrue(e.getMessage().contains("bad model"));
        assertFalse(Resilience4jConfig.isRetryable(e));
    }

    @Test
    void shouldWrapNetworkFailure() throws Exception {
        doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        LlmException e = assertThrows(LlmException.class, () -> client.openStream(requestBody()));

        assertInstanceOf(IOException.class, e.getCause());
        assertTrue(Resilience4jConfig.isRetryable(e));
    }

    @Test
    void shouldRestoreInterruptFlag() throws Exception {
        doThrow(new InterruptedException()).when(httpClient).send(any(HttpRequest.class), any());

        try {
            LlmException e = assertThrows(LlmException.class, () -> client.openStream(requestBody()));
            assertInstanceOf(InterruptedException.class, e.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldExposeProviderIdentity() {
        assertEquals("primary", client.providerName());
        assertEquals("model-a", client.modelName());
    }
}
