package fr.lapetina.multillm.integration;

import fr.lapetina.multillm.OrchestratorFactory;
import fr.lapetina.multillm.infrastructure.config.ConfigLoader;
import fr.lapetina.multillm.infrastructure.http.ProviderResponse;
import fr.lapetina.multillm.infrastructure.http.StubProviderHttpClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Test extension of OrchestratorFactory wired to a stub HTTP client and a fixed clock.
 */
public final class TestOrchestratorFactory extends OrchestratorFactory {

    static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
    static final String API_KEY = "sk-test-override";

    private final StubProviderHttpClient stubHttpClient;

    private TestOrchestratorFactory(String configPath, StubProviderHttpClient stubHttpClient) {
        super(new ConfigLoader(configPath).load(), stubHttpClient, API_KEY, Clock.fixed(NOW, ZoneOffset.UTC));
        this.stubHttpClient = stubHttpClient;
    }

    /**
     * Creates a test factory from the default test configuration.
     */
    public static TestOrchestratorFactory create() {
        return create("test-config.yaml");
    }

    public static TestOrchestratorFactory create(String configPath) {
        return new TestOrchestratorFactory(configPath, new StubProviderHttpClient());
    }

    public StubProviderHttpClient getStubHttpClient() {
        return stubHttpClient;
    }

    /**
     * Answers every provider with a well-formed reply naming the provider.
     */
    public void respondLikeProviders() {
        stubHttpClient.respondWith(call -> {
            String path = call.uri().getPath();
            if (path.endsWith("/chat/completions")) {
                return new ProviderResponse(200, "{\"choices\":[{\"message\":{\"content\":\"openai reply\"}}]}");
            }
            if (path.endsWith("/messages")) {
                return new ProviderResponse(200, "{\"content\":[{\"text\":\"anthropic reply\"}]}");
            }
            return new ProviderResponse(200, "[{\"generated_text\":\"hf reply\"}]");
        });
    }
}
