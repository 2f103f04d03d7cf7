package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import fr.lapetina.multillm.infrastructure.connection.HandshakeProbe;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;
import fr.lapetina.multillm.infrastructure.metrics.MetricsRegistry;

import java.net.URI;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Wire protocols understood by the gateway, with their adapter and probe constructors.
 *
 * Several provider keys may share a type, e.g. any OpenAI-compatible endpoint.
 */
public enum ProviderType {

    OPENAI("https://api.openai.com/") {
        @Override
        public ProviderAdapter createAdapter(String key, URI baseUri, ProviderHttpClient httpClient,
                                             ConnectionRegistry registry, MetricsRegistry metrics) {
            return new OpenAiAdapter(key, baseUri, httpClient, registry, metrics);
        }

        @Override
        public HandshakeProbe createProbe(String key, URI baseUri, String handshakeModel,
                                          ProviderHttpClient httpClient, Clock clock) {
            return new OpenAiHandshakeProbe(key, baseUri, handshakeModel, httpClient, clock);
        }
    },

    ANTHROPIC("https://api.anthropic.com/") {
        @Override
        public ProviderAdapter createAdapter(String key, URI baseUri, ProviderHttpClient httpClient,
                                             ConnectionRegistry registry, MetricsRegistry metrics) {
            return new AnthropicAdapter(key, baseUri, httpClient, registry, metrics);
        }

        @Override
        public HandshakeProbe createProbe(String key, URI baseUri, String handshakeModel,
                                          ProviderHttpClient httpClient, Clock clock) {
            return new AnthropicHandshakeProbe(key, baseUri, handshakeModel, httpClient, clock);
        }
    },

    HUGGINGFACE("https://api-inference.huggingface.co/") {
        @Override
        public ProviderAdapter createAdapter(String key, URI baseUri, ProviderHttpClient httpClient,
                                             ConnectionRegistry registry, MetricsRegistry metrics) {
            return new HuggingFaceAdapter(key, baseUri, httpClient, registry, metrics);
        }

        @Override
        public HandshakeProbe createProbe(String key, URI baseUri, String handshakeModel,
                                          ProviderHttpClient httpClient, Clock clock) {
            return new HuggingFaceHandshakeProbe(key, baseUri, handshakeModel, httpClient, clock);
        }
    };

    private final URI defaultBaseUri;

    ProviderType(String defaultBaseUri) {
        this.defaultBaseUri = URI.create(defaultBaseUri);
    }

    public URI getDefaultBaseUri() {
        return defaultBaseUri;
    }

    public abstract ProviderAdapter createAdapter(String key, URI baseUri, ProviderHttpClient httpClient,
                                                  ConnectionRegistry registry, MetricsRegistry metrics);

    public abstract HandshakeProbe createProbe(String key, URI baseUri, String handshakeModel,
                                               ProviderHttpClient httpClient, Clock clock);

    /**
     * Looks up a type by its configuration name, case-insensitively.
     */
    public static Optional<ProviderType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
