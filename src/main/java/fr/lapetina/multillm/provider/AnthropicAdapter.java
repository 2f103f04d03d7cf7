package fr.lapetina.multillm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ChatRole;
import fr.lapetina.multillm.domain.model.ModelDefinition;
import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;
import fr.lapetina.multillm.infrastructure.metrics.MetricsRegistry;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Messages API: {@code POST v1/messages}.
 *
 * The system prompt travels as a top-level field, never inside {@code messages}.
 */
public final class AnthropicAdapter extends AbstractProviderAdapter {

    static final String MESSAGES_PATH = "v1/messages";
    static final String API_KEY_HEADER = "x-api-key";
    static final String VERSION_HEADER = "anthropic-version";
    static final String API_VERSION = "2023-06-01";

    public AnthropicAdapter(
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
        String system = null;
        List<Map<String, String>> conversation = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == ChatRole.SYSTEM) {
                if (system == null) {
                    system = message.content();
                }
                continue;
            }
            String role = message.role() == ChatRole.ASSISTANT ? "assistant" : "user";
            conversation.add(WireMessages.of(role, message.content()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model.modelId());
        payload.put("max_tokens", ParameterResolver.maxTokens(model));
        payload.put("temperature", ParameterResolver.temperature(model));
        if (system != null && !system.isEmpty()) {
            payload.put("system", system);
        }
        payload.put("messages", conversation);

        return ProviderCall.builder(provider, baseUri.resolve(MESSAGES_PATH))
                .header(API_KEY_HEADER, credential)
                .header(VERSION_HEADER, API_VERSION)
                .body(serialize(payload))
                .build();
    }

    @Override
    protected Optional<String> extractText(JsonNode root) {
        return textOf(root.path("content").path(0).path("text"));
    }
}
