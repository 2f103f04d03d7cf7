package fr.lapetina.multillm;

import fr.lapetina.multillm.domain.model.ModelDefinition;
import fr.lapetina.multillm.domain.model.ParameterDefinition;
import fr.lapetina.multillm.domain.session.ChatSession;
import fr.lapetina.multillm.domain.session.SessionOrchestrator;
import fr.lapetina.multillm.infrastructure.config.ApiKeyResolver;
import fr.lapetina.multillm.infrastructure.config.ConfigLoader;
import fr.lapetina.multillm.infrastructure.config.MultiLlmConfig;
import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import fr.lapetina.multillm.infrastructure.connection.SimulatedHandshakeProbe;
import fr.lapetina.multillm.infrastructure.http.ProviderHttpClient;
import fr.lapetina.multillm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.multillm.provider.CompletionGateway;
import fr.lapetina.multillm.provider.ProviderType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating a fully-wired orchestrator from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml")) {
 *     SessionOrchestrator orchestrator = factory.getOrchestrator();
 *     orchestrator.broadcast(factory.getSessions(), "hello", factory.getCredentials()).join();
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final MultiLlmConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ProviderHttpClient httpClient;
    private final ConnectionRegistry connectionRegistry;
    private final CompletionGateway gateway;
    private final SessionOrchestrator orchestrator;
    private final ApiKeyResolver credentials;
    private final List<ChatSession> sessions;

    protected OrchestratorFactory(MultiLlmConfig config, ProviderHttpClient httpClientOverride,
                                  String apiKeyOverride, Clock clock) {
        this.config = config;

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : new MetricsRegistry(config.getMetrics().getPrefix(), new SimpleMeterRegistry());

        // Initialize HTTP client (allow override for testing)
        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        // Registry, probes and adapters
        this.connectionRegistry = new ConnectionRegistry(new SimulatedHandshakeProbe(Duration.ofMillis(100), clock),
                metricsRegistry, clock);
        this.gateway = registerProviders(clock);

        this.orchestrator = new SessionOrchestrator(connectionRegistry, gateway, clock);
        this.credentials = new ApiKeyResolver(config, apiKeyOverride);
        this.sessions = createSessions();

        log.info("OrchestratorFactory initialized with {} providers and {} sessions",
                gateway.providers().size(), sessions.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        return create(configPath, null);
    }

    /**
     * Creates a factory whose credential lookup starts with an explicit API key.
     */
    public static OrchestratorFactory create(String configPath, String apiKeyOverride) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);
        MultiLlmConfig config = new ConfigLoader(configPath).load();
        return new OrchestratorFactory(config, null, apiKeyOverride, Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    public MultiLlmConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ProviderHttpClient getHttpClient() {
        return httpClient;
    }

    public ConnectionRegistry getConnectionRegistry() {
        return connectionRegistry;
    }

    public CompletionGateway getGateway() {
        return gateway;
    }

    public SessionOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ApiKeyResolver getCredentials() {
        return credentials;
    }

    public List<ChatSession> getSessions() {
        return sessions;
    }

    private ProviderHttpClient createHttpClient() {
        return new ProviderHttpClient(
                Duration.ofMillis(config.getHttp().getConnectTimeoutMs()),
                Duration.ofMillis(config.getHttp().getRequestTimeoutMs())
        );
    }

    private CompletionGateway registerProviders(Clock clock) {
        CompletionGateway.Builder builder = CompletionGateway.builder();
        for (MultiLlmConfig.ProviderConfig providerConfig : config.effectiveProviders()) {
            ProviderType type = ProviderType.fromName(providerConfig.getType())
                    .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                            "Unknown provider type '" + providerConfig.getType()
                                    + "' for provider: " + providerConfig.getKey()));
            String key = ConnectionRegistry.normalize(providerConfig.getKey());
            URI baseUri = providerConfig.getBaseUrl() == null || providerConfig.getBaseUrl().isBlank()
                    ? type.getDefaultBaseUri()
                    : URI.create(providerConfig.getBaseUrl().trim());

            connectionRegistry.registerProbe(key,
                    type.createProbe(key, baseUri, providerConfig.getHandshakeModel(), httpClient, clock));
            builder.register(key, type.createAdapter(key, baseUri, httpClient, connectionRegistry, metricsRegistry));
            log.debug("Registered provider: key={}, type={}, baseUri={}", key, type, baseUri);
        }
        return builder.build();
    }

    private List<ChatSession> createSessions() {
        List<ChatSession> result = new ArrayList<>();
        for (MultiLlmConfig.ModelConfig modelConfig : config.getModels()) {
            ModelDefinition.Builder model = ModelDefinition.builder()
                    .name(modelConfig.getName())
                    .provider(ConnectionRegistry.normalize(modelConfig.getProvider()))
                    .modelId(modelConfig.getModelId())
                    .description(modelConfig.getDescription())
                    .endpoint(modelConfig.getEndpoint());
            for (MultiLlmConfig.ParameterConfig parameter : modelConfig.getParameters()) {
                try {
                    model.addParameter(new ParameterDefinition(
                            parameter.getName(), parameter.getDescription(), parameter.getDefault()));
                } catch (IllegalArgumentException e) {
                    throw new ConfigLoader.ConfigurationException(
                            "Invalid parameter for model '" + modelConfig.getName() + "': " + e.getMessage(), e);
                }
            }
            ChatSession session = new ChatSession(model.build());
            result.add(session);
            log.debug("Created session: {}", session);
        }
        return List.copyOf(result);
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("OrchestratorFactory shut down");
    }
}
