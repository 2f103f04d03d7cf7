package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

public final class HuggingFaceHandshakeProbe extends AbstractHandshakeProbe {

    public static final String DEFAULT_MODEL = "microsoft/DialoGPT-medium";

    public HuggingFaceHandshakeProbe(String provider, URI baseUri, String handshakeModel,
                                     ProviderHttpClient httpClient, Clock clock) {
        super(provider, baseUri, handshakeModel != null ? handshakeModel : DEFAULT_MODEL, httpClient, clock);
    }

    @Override
    protected ProviderCall buildCall(String credential) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("max_new_tokens", HANDSHAKE_MAX_TOKENS);
        parameters.put("temperature", 0.1);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inputs", HANDSHAKE_MESSAGE);
        payload.put("parameters", parameters);

        return ProviderCall.builder(provider, baseUri.resolve(HuggingFaceAdapter.MODELS_PATH + handshakeModel))
                .bearer(credential)
                .body(httpClient.toJson(payload))
                .build();
    }

    @Override
    protected String displayName() {
        return "HuggingFace";
    }

    @Override
    protected String idPrefix() {
        return "hf_";
    }
}
