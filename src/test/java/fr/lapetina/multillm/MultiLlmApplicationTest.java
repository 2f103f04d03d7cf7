package fr.lapetina.multillm;

import fr.lapetina.multillm.infrastructure.http.ProviderResponse;
import fr.lapetina.multillm.integration.TestOrchestratorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class MultiLlmApplicationTest {

    private TestOrchestratorFactory factory;
    private MultiLlmApplication application;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        factory = TestOrchestratorFactory.create();
        factory.respondLikeProviders();
        application = new MultiLlmApplication(factory);
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        application.close();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should broadcast a line to every session")
    void shouldBroadcastLine() {
        assertThat(application.handle("hello there", out)).isTrue();

        assertThat(output()).contains(
                "[Test GPT] openai reply",
                "[Test Claude] anthropic reply",
                "[Test HF] hf reply");
    }

    @Test
    @DisplayName("should report a failing session without stopping the others")
    void shouldReportFailingSession() {
        factory.getStubHttpClient().respondWith(call -> call.uri().getPath().endsWith("/generate")
                ? new ProviderResponse(503, "loading")
                : new ProviderResponse(200,
                        "{\"choices\":[{\"message\":{\"content\":\"ok\"}}],\"content\":[{\"text\":\"ok\"}]}"));

        application.handle("hello", out);

        assertThat(output()).contains("[Test GPT] ok", "[Test Claude] ok", "[Test HF] Warning: ");
    }

    @Test
    @DisplayName("should stop on quit and ignore blank lines")
    void shouldHandleControlLines() {
        assertThat(application.handle("", out)).isTrue();
        assertThat(application.handle("/quit", out)).isFalse();
        assertThat(factory.getStubHttpClient().callCount()).isZero();
    }

    @Test
    @DisplayName("should print connection status")
    void shouldPrintStatus() {
        application.handle("/status", out);
        assertThat(output()).contains("No connections yet.");

        application.handle("hello", out);
        application.handle("/status", out);
        assertThat(output()).contains("openai: connected (last handshake 2024-05-01T10:15:30Z)");
    }

    @Test
    @DisplayName("should print summaries of every session")
    void shouldPrintSummaries() {
        application.handle("/summary", out);
        assertThat(output()).contains("Test GPT: No conversation yet.", "Test HF: No conversation yet.");

        application.handle("hello", out);
        application.handle("/summary", out);
        assertThat(output()).contains("Test GPT: openai reply", "Test Claude: anthropic reply");
        assertThat(factory.getStubHttpClient().body(factory.getStubHttpClient().lastCall()).toString())
                .contains("Test summary prompt");
    }

    @Test
    @DisplayName("should run the console until quit")
    void shouldRunConsole() throws IOException {
        application.runConsole(new BufferedReader(new StringReader("hello\n/quit\nignored\n")), out);

        assertThat(output()).contains("[Test GPT] openai reply");
        assertThat(output()).doesNotContain("ignored");
    }

    @Test
    @DisplayName("should skip startup handshakes when disabled")
    void shouldSkipStartupWhenDisabled() {
        application.start(out);

        assertThat(output()).isEmpty();
        assertThat(factory.getStubHttpClient().callCount()).isZero();
    }
}
