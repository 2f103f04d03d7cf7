package fr.lapetina.multillm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ErrorType;
import fr.lapetina.multillm.domain.model.HandshakeResult;
import fr.lapetina.multillm.domain.model.ModelDefinition;
import fr.lapetina.multillm.exception.HandshakeException;
import fr.lapetina.multillm.exception.MultiLlmException;
import fr.lapetina.multillm.exception.TransportException;
import fr.lapetina.multillm.exception.ValidationException;
import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import fr.lapetina.multillm.infrastructure.http.Futures;
import fr.lapetina.multillm.infrastructure.http.ProviderCall;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;
import fr.lapetina.multillm.infrastructure.http.ProviderResponse;
import fr.lapetina.multillm.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Shared completion flow: credential check, lazy handshake, HTTP exchange,
 * status handling and text extraction.
 *
 * Subclasses only build the vendor request and pick the text out of the vendor answer.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final String provider;
    protected final URI baseUri;
    protected final ProviderHttpClient httpClient;
    protected final ConnectionRegistry connectionRegistry;
    protected final MetricsRegistry metricsRegistry;

    protected AbstractProviderAdapter(
            String provider,
            URI baseUri,
            ProviderHttpClient httpClient,
            ConnectionRegistry connectionRegistry,
            MetricsRegistry metricsRegistry
    ) {
        this.provider = ConnectionRegistry.normalize(provider);
        this.baseUri = withTrailingSlash(Objects.requireNonNull(baseUri, "Base URI is required"));
        this.httpClient = httpClient;
        this.connectionRegistry = connectionRegistry;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public String provider() {
        return provider;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    @Override
    public CompletableFuture<String> complete(ModelDefinition model, List<ChatMessage> messages, String credential) {
        if (credential == null || credential.isBlank()) {
            metricsRegistry.incrementErrorCount(provider, ErrorType.VALIDATION_ERROR);
            return CompletableFuture.failedFuture(
                    new ValidationException("A credential is required for provider: " + provider));
        }
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(messages, "Messages are required");

        CompletableFuture<String> result = new CompletableFuture<>();
        CompletableFuture<Void> ready = ensureConnected(credential);
        Futures.propagateCancellation(result, ready);

        ready.whenComplete((ignored, ex) -> {
            if (ex != null) {
                fail(result, ex);
                return;
            }
            if (result.isDone()) {
                return;
            }
            ProviderCall call;
            try {
                call = buildCall(model, messages, credential);
            } catch (RuntimeException e) {
                fail(result, e);
                return;
            }
            send(call, result);
        });

        return result;
    }

    private CompletableFuture<Void> ensureConnected(String credential) {
        if (connectionRegistry.isConnected(provider)) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Provider not connected, performing handshake: provider={}", provider);
        CompletableFuture<HandshakeResult> handshake = connectionRegistry.performHandshake(provider, credential);
        CompletableFuture<Void> ready = handshake.thenAccept(outcome -> {
            if (!outcome.success()) {
                throw new HandshakeException(provider, outcome.message());
            }
        });
        Futures.propagateCancellation(ready, handshake);
        return ready;
    }

    private void send(ProviderCall call, CompletableFuture<String> result) {
        Instant startTime = Instant.now();
        CompletableFuture<ProviderResponse> exchange = httpClient.execute(call);
        Futures.propagateCancellation(result, exchange);

        exchange.whenComplete((response, ex) -> {
            metricsRegistry.recordCompletionLatency(provider, Duration.between(startTime, Instant.now()));
            if (ex != null) {
                Throwable cause = Futures.unwrap(ex);
                fail(result, cause instanceof CancellationException || cause instanceof MultiLlmException
                        ? cause
                        : new TransportException(provider, cause));
                return;
            }
            if (!response.isSuccess()) {
                TransportException failure = new TransportException(provider, response.statusCode(), response.body());
                if (failure.isAuthenticationFailure()) {
                    connectionRegistry.updateStatus(provider,
                            "Authentication rejected: HTTP " + response.statusCode(), false);
                }
                fail(result, failure);
                return;
            }
            try {
                String text = extractReply(response.body());
                metricsRegistry.incrementCompletionCount(provider, "success");
                result.complete(text);
            } catch (RuntimeException e) {
                fail(result, e);
            }
        });
    }

    private String extractReply(String body) {
        Optional<String> text = httpClient.parse(body).flatMap(this::extractText);
        if (text.isPresent()) {
            return text.get();
        }
        log.warn("Unrecognized response shape, returning raw body: provider={}", provider);
        metricsRegistry.incrementErrorCount(provider, ErrorType.PROTOCOL_ERROR);
        return body;
    }

    private void fail(CompletableFuture<String> result, Throwable throwable) {
        Throwable cause = Futures.unwrap(throwable);
        if (cause instanceof CancellationException) {
            log.info("Completion cancelled: provider={}", provider);
            metricsRegistry.incrementCompletionCount(provider, "cancelled");
            result.completeExceptionally(cause);
            return;
        }
        ErrorType errorType = cause instanceof MultiLlmException multiLlm
                ? multiLlm.getErrorType()
                : ErrorType.INTERNAL_ERROR;
        log.error("Completion failed: provider={}, errorType={}, error={}", provider, errorType, cause.getMessage());
        metricsRegistry.incrementErrorCount(provider, errorType);
        metricsRegistry.incrementCompletionCount(provider, "failure");
        result.completeExceptionally(cause);
    }

    /**
     * Builds the vendor request for one completion.
     */
    protected abstract ProviderCall buildCall(ModelDefinition model, List<ChatMessage> messages, String credential);

    /**
     * Picks the generated text out of a parsed success body, or empty when the shape is not recognized.
     */
    protected abstract Optional<String> extractText(JsonNode root);

    /**
     * Returns the text of a JSON string node; {@code null} JSON becomes an empty string.
     */
    protected static Optional<String> textOf(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isNull()) {
            return Optional.of("");
        }
        return node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }

    protected String serialize(Object payload) {
        return httpClient.toJson(payload);
    }

    static URI withTrailingSlash(URI uri) {
        String value = uri.toString();
        return value.endsWith("/") ? uri : URI.create(value + "/");
    }
}
