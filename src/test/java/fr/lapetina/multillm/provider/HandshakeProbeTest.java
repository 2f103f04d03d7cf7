package fr.lapetina.multillm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.multillm.domain.model.HandshakeResult;
import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.StubProviderHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class HandshakeProbeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private StubProviderHttpClient httpClient;

    @BeforeEach
    void setUp() {
        httpClient = new StubProviderHttpClient();
        httpClient.respondWith(200, "pong");
    }

    @Test
    @DisplayName("should send a minimal OpenAI chat request and build an oai_ id")
    void shouldProbeOpenAi() {
        OpenAiHandshakeProbe probe = new OpenAiHandshakeProbe(
                "openai", URI.create("https://openai.test"), null, httpClient, CLOCK);

        HandshakeResult result = probe.probe("sk-test").join();

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("OpenAI connection established. Response: pong");
        assertThat(result.handshakeId()).matches("oai_20240501101530_[0-9a-f]{32}");

        ProviderCall call = httpClient.lastCall();
        assertThat(call.uri()).isEqualTo(URI.create("https://openai.test/v1/chat/completions"));
        JsonNode body = httpClient.body(call);
        assertThat(body.get("model").asText()).isEqualTo("gpt-3.5-turbo");
        assertThat(body.get("max_tokens").asInt()).isEqualTo(50);
        assertThat(body.get("messages").get(0).get("content").asText()).isEqualTo("hello");
        assertThat(call.body()).isEqualTo(
                "{\"model\":\"gpt-3.5-turbo\",\"messages\":[{\"role\":\"user\",\"content\":\"hello\"}],"
                        + "\"max_tokens\":50}");
    }

    @Test
    @DisplayName("should send Anthropic headers and honour the configured handshake model")
    void shouldProbeAnthropic() {
        AnthropicHandshakeProbe probe = new AnthropicHandshakeProbe(
                "anthropic", URI.create("https://anthropic.test/"), "claude-custom", httpClient, CLOCK);

        HandshakeResult result = probe.probe("sk-ant").join();

        assertThat(result.handshakeId()).startsWith("ant_");
        ProviderCall call = httpClient.lastCall();
        assertThat(call.header("x-api-key")).isEqualTo("sk-ant");
        assertThat(call.header("anthropic-version")).isEqualTo("2023-06-01");
        assertThat(httpClient.body(call).get("model").asText()).isEqualTo("claude-custom");
        assertThat(call.body()).contains("\"messages\":[{\"role\":\"user\",\"content\":\"hello\"}]");
    }

    @Test
    @DisplayName("should send HuggingFace inputs with handshake parameters")
    void shouldProbeHuggingFace() {
        HuggingFaceHandshakeProbe probe = new HuggingFaceHandshakeProbe(
                "huggingface", URI.create("https://hf.test/"), null, httpClient, CLOCK);

        HandshakeResult result = probe.probe("hf_x").join();

        assertThat(result.handshakeId()).startsWith("hf_");
        ProviderCall call = httpClient.lastCall();
        assertThat(call.uri()).isEqualTo(URI.create("https://hf.test/models/microsoft/DialoGPT-medium"));
        JsonNode body = httpClient.body(call);
        assertThat(body.get("inputs").asText()).isEqualTo("hello");
        assertThat(body.get("parameters").get("max_new_tokens").asInt()).isEqualTo(50);
        assertThat(body.get("parameters").get("temperature").asDouble()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("should report a failed result with status and body on non-success status")
    void shouldReportFailure() {
        httpClient.respondWith(401, "invalid key");
        OpenAiHandshakeProbe probe = new OpenAiHandshakeProbe(
                "openai", URI.create("https://openai.test/"), null, httpClient, CLOCK);

        HandshakeResult result = probe.probe("sk-bad").join();

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("OpenAI handshake failed: 401 - invalid key");
        assertThat(result.handshakeId()).isEmpty();
    }

    @Test
    @DisplayName("should cancel the exchange when the probe future is cancelled")
    void shouldCancelExchange() {
        httpClient.hang();
        OpenAiHandshakeProbe probe = new OpenAiHandshakeProbe(
                "openai", URI.create("https://openai.test/"), null, httpClient, CLOCK);

        CompletableFuture<HandshakeResult> result = probe.probe("sk-test");
        result.cancel(true);

        assertThat(httpClient.getPending().get(0)).isCancelled();
    }
}
