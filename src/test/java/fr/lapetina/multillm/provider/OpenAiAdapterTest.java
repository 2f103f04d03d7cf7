package fr.lapetina.multillm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ErrorType;
import fr.lapetina.multillm.domain.model.HandshakeResult;
import fr.lapetina.multillm.domain.model.ModelDefinition;
import fr.lapetina.multillm.exception.HandshakeException;
import fr.lapetina.multillm.exception.TransportException;
import fr.lapetina.multillm.exception.ValidationException;
import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.StubProviderHttpClient;
import fr.lapetina.multillm.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiAdapterTest {

    private StubProviderHttpClient httpClient;
    private MetricsRegistry metrics;
    private ConnectionRegistry registry;
    private OpenAiAdapter adapter;
    private ModelDefinition model;

    @BeforeEach
    void setUp() {
        httpClient = new StubProviderHttpClient();
        metrics = new MetricsRegistry("test", new SimpleMeterRegistry());
        registry = new ConnectionRegistry(
                credential -> CompletableFuture.completedFuture(HandshakeResult.success("ok", "gen_1")),
                metrics, Clock.systemUTC());
        registry.updateStatus("openai", "Connected", true);
        adapter = new OpenAiAdapter("openai", URI.create("https://api.example.com"), httpClient, registry, metrics);
        model = ModelDefinition.builder()
                .name("GPT")
                .provider("openai")
                .modelId("gpt-4o-mini")
                .build();
    }

    @Test
    @DisplayName("should reject a blank credential without any network call")
    void shouldRejectBlankCredential() {
        for (String credential : new String[]{null, "", "   "}) {
            CompletableFuture<String> result = adapter.complete(model, List.of(ChatMessage.user("hi")), credential);

            assertThatThrownBy(result::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(ValidationException.class);
        }
        assertThat(httpClient.callCount()).isZero();
    }

    @Test
    @DisplayName("should extract choices[0].message.content")
    void shouldExtractContent() {
        httpClient.respondWith(200, "{\"choices\":[{\"message\":{\"content\":\"hi\"}}]}");

        String reply = adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test").join();

        assertThat(reply).isEqualTo("hi");
    }

    @Test
    @DisplayName("should serialize each message as role then content")
    void shouldSerializeExactBody() {
        httpClient.respondWith(200, "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");

        adapter.complete(model, List.of(ChatMessage.user("hi"), ChatMessage.assistant("hey")), "sk-test").join();

        assertThat(httpClient.lastCall().body()).isEqualTo(
                "{\"model\":\"gpt-4o-mini\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"},"
                        + "{\"role\":\"assistant\",\"content\":\"hey\"}],\"max_tokens\":1000,\"temperature\":0.7}");
    }

    @Test
    @DisplayName("should post to v1/chat/completions with bearer auth and default parameters")
    void shouldBuildRequest() {
        httpClient.respondWith(200, "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");

        adapter.complete(model,
                List.of(ChatMessage.system("Be brief"), ChatMessage.user("hello"), ChatMessage.assistant("hey")),
                "sk-test").join();

        ProviderCall call = httpClient.lastCall();
        assertThat(call.uri()).isEqualTo(URI.create("https://api.example.com/v1/chat/completions"));
        assertThat(call.header("Authorization")).isEqualTo("Bearer sk-test");

        JsonNode body = httpClient.body(call);
        assertThat(body.get("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.get("max_tokens").asInt()).isEqualTo(1000);
        assertThat(body.get("temperature").asDouble()).isEqualTo(0.7);
        assertThat(body.get("messages").size()).isEqualTo(3);
        assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("system");
        assertThat(body.get("messages").get(2).get("role").asText()).isEqualTo("assistant");
        assertThat(body.get("messages").get(1).get("content").asText()).isEqualTo("hello");
    }

    @Test
    @DisplayName("should use model parameter defaults matched case-insensitively")
    void shouldUseParameterDefaults() {
        httpClient.respondWith(200, "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");
        ModelDefinition tuned = ModelDefinition.builder()
                .name("GPT")
                .provider("openai")
                .modelId("gpt-4o-mini")
                .addParameter("Temperature", 0.8)
                .addParameter("MAX_TOKENS", 42)
                .build();

        adapter.complete(tuned, List.of(ChatMessage.user("hello")), "sk-test").join();

        assertThat(httpClient.lastCall().body()).contains("\"temperature\":0.8");
        assertThat(httpClient.body(httpClient.lastCall()).get("max_tokens").asInt()).isEqualTo(42);
    }

    @Test
    @DisplayName("should fall back to defaults when parameter types do not match")
    void shouldFallBackOnMismatchedTypes() {
        httpClient.respondWith(200, "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");
        ModelDefinition mismatched = ModelDefinition.builder()
                .name("GPT")
                .provider("openai")
                .modelId("gpt-4o-mini")
                .addParameter("temperature", "hot")
                .addParameter("max_tokens", 12.5)
                .build();

        adapter.complete(mismatched, List.of(ChatMessage.user("hello")), "sk-test").join();

        JsonNode body = httpClient.body(httpClient.lastCall());
        assertThat(body.get("max_tokens").asInt()).isEqualTo(1000);
        assertThat(body.get("temperature").asDouble()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("should return an unrecognized success body verbatim")
    void shouldReturnRawBodyOnUnknownShape() {
        httpClient.respondWith(200, "{\"unexpected\":true}");

        String reply = adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test").join();

        assertThat(reply).isEqualTo("{\"unexpected\":true}");
        assertThat(metrics.getRegistry().find("test_errors_total")
                .tag("type", ErrorType.PROTOCOL_ERROR.name())
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return a non-JSON success body verbatim")
    void shouldReturnNonJsonBody() {
        httpClient.respondWith(200, "plain text");

        assertThat(adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test").join())
                .isEqualTo("plain text");
    }

    @Test
    @DisplayName("should fail with TransportException on non-success status")
    void shouldFailOnErrorStatus() {
        httpClient.respondWith(500, "boom");

        assertThatThrownBy(() -> adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test").join())
                .hasCauseInstanceOf(TransportException.class)
                .cause()
                .satisfies(e -> {
                    TransportException transport = (TransportException) e;
                    assertThat(transport.getStatusCode()).isEqualTo(500);
                    assertThat(transport.getBody()).isEqualTo("boom");
                });
        assertThat(httpClient.callCount()).isEqualTo(1);
        assertThat(registry.isConnected("openai")).isTrue();
    }

    @Test
    @DisplayName("should mark the provider disconnected on authentication failure")
    void shouldDisconnectOnAuthFailure() {
        httpClient.respondWith(401, "{\"error\":\"invalid key\"}");

        assertThatThrownBy(() -> adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-bad").join())
                .hasCauseInstanceOf(TransportException.class);

        assertThat(registry.isConnected("openai")).isFalse();
    }

    @Test
    @DisplayName("should wrap I/O failures in TransportException with status 0")
    void shouldWrapIoFailures() {
        httpClient.failWith(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test").join())
                .hasCauseInstanceOf(TransportException.class)
                .cause()
                .satisfies(e -> {
                    assertThat(((TransportException) e).getStatusCode()).isZero();
                    assertThat(e.getCause()).isInstanceOf(IOException.class);
                });
    }

    @Test
    @DisplayName("should handshake first when the provider is not connected")
    void shouldHandshakeWhenDisconnected() {
        registry.updateStatus("openai", "Reset", false);
        registry.registerProbe("openai", new OpenAiHandshakeProbe(
                "openai", URI.create("https://api.example.com/"), null, httpClient, Clock.systemUTC()));
        httpClient.respondWith(200, "{\"choices\":[{\"message\":{\"content\":\"hi\"}}]}");

        String reply = adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test").join();

        assertThat(reply).isEqualTo("hi");
        assertThat(httpClient.callCount()).isEqualTo(2);
        assertThat(httpClient.body(httpClient.getCalls().get(0)).get("model").asText()).isEqualTo("gpt-3.5-turbo");
        assertThat(registry.isConnected("openai")).isTrue();
    }

    @Test
    @DisplayName("should abort with HandshakeException when the handshake fails")
    void shouldAbortOnHandshakeFailure() {
        registry.updateStatus("openai", "Reset", false);
        registry.registerProbe("openai",
                credential -> CompletableFuture.completedFuture(HandshakeResult.failure("denied")));

        assertThatThrownBy(() -> adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test").join())
                .hasCauseInstanceOf(HandshakeException.class)
                .hasMessageContaining("Handshake failed: denied");
        assertThat(httpClient.callCount()).isZero();
    }

    @Test
    @DisplayName("should cancel the in-flight exchange when the caller cancels")
    void shouldCancelInFlightExchange() {
        httpClient.hang();

        CompletableFuture<String> result = adapter.complete(model, List.of(ChatMessage.user("hello")), "sk-test");
        result.cancel(true);

        assertThat(httpClient.getPending()).hasSize(1);
        assertThat(httpClient.getPending().get(0)).isCancelled();
        assertThatThrownBy(result::join).isInstanceOf(CancellationException.class);
    }
}
