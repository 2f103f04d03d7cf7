package fr.lapetina.multillm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ModelDefinition;
import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;
import fr.lapetina.multillm.infrastructure.metrics.MetricsRegistry;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inference API: the conversation is flattened into a single text prompt.
 */
public final class HuggingFaceAdapter extends AbstractProviderAdapter {

    static final String MODELS_PATH = "models/";

    public HuggingFaceAdapter(
            String provider,
            URI baseUri,
            ProviderHttpClient httpClient,
            ConnectionRegistry connectionRegistry,
            MetricsRegistry metricsRegistry
    ) {
        super(provider, baseUri, httpClient, connectionRegistry, metricsRegistry);
    }

    @Override
    protected ProviderCall buildCall(ModelDefinition model, List<ChatMessage> messages, String credential) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inputs", buildPrompt(messages));
        payload.put("parameters", ParameterResolver.collectDefaults(model));

        return ProviderCall.builder(provider, endpointFor(model))
                .bearer(credential)
                .body(serialize(payload))
                .build();
    }

    /**
     * Endpoint override, absolute or relative to the base URI, else {@code models/<modelId>}.
     */
    URI endpointFor(ModelDefinition model) {
        return model.endpointOverride()
                .map(baseUri::resolve)
                .orElseGet(() -> baseUri.resolve(MODELS_PATH + model.modelId()));
    }

    static String buildPrompt(List<ChatMessage> messages) {
        StringBuilder prompt = new StringBuilder();
        for (ChatMessage message : messages) {
            switch (message.role()) {
                case SYSTEM -> prompt.append("System: ");
                case USER -> prompt.append("User: ");
                case ASSISTANT -> prompt.append("Assistant: ");
            }
            prompt.append(message.content().trim()).append('\n');
        }
        prompt.append("Assistant:");
        return prompt.toString();
    }

    @Override
    protected Optional<String> extractText(JsonNode root) {
        if (root.isObject()) {
            return textOf(root.get("generated_text"));
        }
        if (root.isArray() && root.size() > 0) {
            JsonNode first = root.get(0);
            Optional<String> text = textOf(first.get("generated_text"));
            if (text.isPresent()) {
                return text;
            }
            return textOf(first.path("generated_texts").get(0));
        }
        return Optional.empty();
    }
}
