package fr.lapetina.multillm.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client shared by every provider adapter and handshake probe.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. The returned future can be
 * cancelled to abandon the exchange.
 */
public class ProviderHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public ProviderHttpClient(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ProviderHttpClient() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(120));
    }

    /**
     * Sends a provider call.
     *
     * @param call fully built request
     * @return future with the raw response; completes exceptionally on I/O failure
     */
    public CompletableFuture<ProviderResponse> execute(ProviderCall call) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(call.uri())
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(call.body()));
        call.headers().forEach(builder::header);

        Instant startTime = Instant.now();
        log.debug("Sending request: provider={}, uri={}", call.provider(), call.uri());

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString());
        CompletableFuture<ProviderResponse> result = exchange.thenApply(response -> {
            log.debug("Response received: provider={}, status={}, latencyMs={}",
                    call.provider(), response.statusCode(),
                    Duration.between(startTime, Instant.now()).toMillis());
            return new ProviderResponse(response.statusCode(), response.body());
        });
        Futures.propagateCancellation(result, exchange);
        return result;
    }

    /**
     * Serializes a payload. Null fields are omitted.
     */
    public String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize payload", e);
        }
    }

    /**
     * Parses a body as a JSON tree, or empty when it is not valid JSON.
     */
    public Optional<JsonNode> parse(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            log.debug("Body is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}
