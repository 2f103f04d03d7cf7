package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AnthropicHandshakeProbe extends AbstractHandshakeProbe {

    public static final String DEFAULT_MODEL = "claude-3-haiku-20240307";

    public AnthropicHandshakeProbe(String provider, URI baseUri, String handshakeModel,
                                   ProviderHttpClient httpClient, Clock clock) {
        super(provider, baseUri, handshakeModel != null ? handshakeModel : DEFAULT_MODEL, httpClient, clock);
    }

    @Override
    protected ProviderCall buildCall(String credential) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", handshakeModel);
        payload.put("max_tokens", HANDSHAKE_MAX_TOKENS);
        payload.put("messages", List.of(WireMessages.of("user", HANDSHAKE_MESSAGE)));

        return ProviderCall.builder(provider, baseUri.resolve(AnthropicAdapter.MESSAGES_PATH))
                .header(AnthropicAdapter.API_KEY_HEADER, credential)
                .header(AnthropicAdapter.VERSION_HEADER, AnthropicAdapter.API_VERSION)
                .body(httpClient.toJson(payload))
                .build();
    }

    @Override
    protected String displayName() {
        return "Anthropic";
    }

    @Override
    protected String idPrefix() {
        return "ant_";
    }
}
