package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class OpenAiHandshakeProbe extends AbstractHandshakeProbe {

    public static final String DEFAULT_MODEL = "gpt-3.5-turbo";

    public OpenAiHandshakeProbe(String provider, URI baseUri, String handshakeModel,
                                ProviderHttpClient httpClient, Clock clock) {
        super(provider, baseUri, handshakeModel != null ? handshakeModel : DEFAULT_MODEL, httpClient, clock);
    }

    @Override
    protected ProviderCall buildCall(String credential) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", handshakeModel);
        payload.put("messages", List.of(WireMessages.of("user", HANDSHAKE_MESSAGE)));
        payload.put("max_tokens", HANDSHAKE_MAX_TOKENS);

        return ProviderCall.builder(provider, baseUri.resolve(OpenAiAdapter.CHAT_COMPLETIONS_PATH))
                .bearer(credential)
                .body(httpClient.toJson(payload))
                .build();
    }

    @Override
    protected String displayName() {
        return "OpenAI";
    }

    @Override
    protected String idPrefix() {
        return "oai_";
    }
}
