package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.domain.model.HandshakeResult;
import fr.lapetina.multillm.infrastructure.connection.HandshakeIds;
import fr.lapetina.multillm.infrastructure.connection.HandshakeProbe;
import fr.lapetina.multillm.infrastructure.http.Futures;
import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;
import fr.lapetina.multillm.infrastructure.http.ProviderResponse;

import java.net.URI;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Handshake performed as a minimal real request against the provider.
 * A 2xx answer means the credential and endpoint are usable.
 */
public abstract class AbstractHandshakeProbe implements HandshakeProbe {

    static final String HANDSHAKE_MESSAGE = "hello";
    static final int HANDSHAKE_MAX_TOKENS = 50;

    protected final String provider;
    protected final URI baseUri;
    protected final String handshakeModel;
    protected final ProviderHttpClient httpClient;
    private final Clock clock;

    protected AbstractHandshakeProbe(
            String provider,
            URI baseUri,
            String handshakeModel,
            ProviderHttpClient httpClient,
            Clock clock
    ) {
        this.provider = provider;
        this.baseUri = AbstractProviderAdapter.withTrailingSlash(baseUri);
        this.handshakeModel = handshakeModel;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<HandshakeResult> probe(String credential) {
        CompletableFuture<ProviderResponse> exchange = httpClient.execute(buildCall(credential));
        CompletableFuture<HandshakeResult> result = exchange.thenApply(this::toResult);
        Futures.propagateCancellation(result, exchange);
        return result;
    }

    private HandshakeResult toResult(ProviderResponse response) {
        if (response.isSuccess()) {
            return HandshakeResult.success(
                    displayName() + " connection established. Response: " + response.body(),
                    HandshakeIds.next(idPrefix(), clock));
        }
        return HandshakeResult.failure(
                displayName() + " handshake failed: " + response.statusCode() + " - " + response.body());
    }

    /**
     * Builds the handshake request carrying {@link #HANDSHAKE_MESSAGE}.
     */
    protected abstract ProviderCall buildCall(String credential);

    protected abstract String displayName();

    protected abstract String idPrefix();
}
