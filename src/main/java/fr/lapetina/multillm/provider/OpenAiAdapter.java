package fr.lapetina.multillm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.multillm.domain.model.ChatMessage;
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
 * Chat completions API: {@code POST v1/chat/completions} with bearer authentication.
 */
public final class OpenAiAdapter extends AbstractProviderAdapter {

    static final String CHAT_COMPLETIONS_PATH = "v1/chat/completions";

    public OpenAiAdapter(
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
        List<Map<String, String>> wireMessages = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            wireMessages.add(WireMessages.of(message.role().wireName(), message.content()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model.modelId());
        payload.put("messages", wireMessages);
        payload.put("max_tokens", ParameterResolver.maxTokens(model));
        payload.put("temperature", ParameterResolver.temperature(model));

        return ProviderCall.builder(provider, baseUri.resolve(CHAT_COMPLETIONS_PATH))
                .bearer(credential)
                .body(serialize(payload))
                .build();
    }

    @Override
    protected Optional<String> extractText(JsonNode root) {
        return textOf(root.path("choices").path(0).path("message").path("content"));
    }
}
