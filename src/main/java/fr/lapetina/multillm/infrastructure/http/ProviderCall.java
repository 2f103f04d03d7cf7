package fr.lapetina.multillm.infrastructure.http;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully built JSON POST to a provider: target, headers and serialized body.
 * Immutable and thread-safe.
 */
public record ProviderCall(String provider, URI uri, Map<String, String> headers, String body) {

    public ProviderCall {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(uri, "URI is required");
        Objects.requireNonNull(body, "Body is required");
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public String header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    public static Builder builder(String provider, URI uri) {
        return new Builder(provider, uri);
    }

    public static final class Builder {
        private final String provider;
        private final URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body = "";

        private Builder(String provider, URI uri) {
            this.provider = provider;
            this.uri = uri;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder bearer(String credential) {
            return header("Authorization", "Bearer " + credential);
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public ProviderCall build() {
            return new ProviderCall(provider, uri, headers, body);
        }
    }
}
