package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ModelDefinition;
import fr.lapetina.multillm.exception.UnsupportedProviderException;
import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point for completions: dispatches to the adapter registered for the
 * model's provider key.
 *
 * The provider table is fixed at build time and never mutated afterwards.
 */
public final class CompletionGateway {

    private static final Logger log = LoggerFactory.getLogger(CompletionGateway.class);

    private final Map<String, ProviderAdapter> adapters;

    private CompletionGateway(Map<String, ProviderAdapter> adapters) {
        this.adapters = Map.copyOf(adapters);
    }

    /**
     * Returns the adapter for a provider key, case-insensitively.
     *
     * @throws UnsupportedProviderException when no adapter is registered for the key
     */
    public ProviderAdapter resolve(String provider) {
        ProviderAdapter adapter = adapters.get(ConnectionRegistry.normalize(provider));
        if (adapter == null) {
            throw new UnsupportedProviderException(provider);
        }
        return adapter;
    }

    /**
     * Completes a conversation with the model's provider.
     * An unsupported provider yields a failed future.
     */
    public CompletableFuture<String> complete(ModelDefinition model, List<ChatMessage> messages, String credential) {
        ProviderAdapter adapter;
        try {
            adapter = resolve(model.provider());
        } catch (UnsupportedProviderException e) {
            log.error("No adapter for model: model={}, provider={}", model.name(), model.provider());
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Dispatching completion: model={}, provider={}, messages={}",
                model.name(), adapter.provider(), messages.size());
        return adapter.complete(model, messages, credential);
    }

    public Set<String> providers() {
        return adapters.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();

        public Builder register(String provider, ProviderAdapter adapter) {
            adapters.put(ConnectionRegistry.normalize(provider), adapter);
            return this;
        }

        public Builder register(ProviderAdapter adapter) {
            return register(adapter.provider(), adapter);
        }

        public CompletionGateway build() {
            return new CompletionGateway(adapters);
        }
    }
}
