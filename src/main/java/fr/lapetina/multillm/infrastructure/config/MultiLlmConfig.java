package fr.lapetina.multillm.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object of the orchestrator.
 * Designed to be populated from YAML.
 */
public class MultiLlmConfig {

    private HttpConfig http = new HttpConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private List<ModelConfig> models = new ArrayList<>();
    private SummaryConfig summary = new SummaryConfig();
    private Map<String, String> apiKeys = new LinkedHashMap<>();
    private ConnectionConfig connection = new ConnectionConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public SummaryConfig getSummary() { return summary; }
    public void setSummary(SummaryConfig summary) { this.summary = summary; }

    public Map<String, String> getApiKeys() { return apiKeys; }
    public void setApiKeys(Map<String, String> apiKeys) { this.apiKeys = apiKeys; }

    public ConnectionConfig getConnection() { return connection; }
    public void setConnection(ConnectionConfig connection) { this.connection = connection; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Providers to register: the configured ones, or the three public APIs when none are configured.
     */
    public List<ProviderConfig> effectiveProviders() {
        if (providers != null && !providers.isEmpty()) {
            return providers;
        }
        return List.of(
                ProviderConfig.of("openai", "openai"),
                ProviderConfig.of("anthropic", "anthropic"),
                ProviderConfig.of("huggingface", "huggingface"));
    }

    /**
     * Outbound HTTP configuration.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 120000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Provider key bound to a wire protocol.
     * A blank base URL means the protocol's public endpoint.
     */
    public static class ProviderConfig {
        private String key;
        private String type;
        private String baseUrl;
        private String handshakeModel;

        static ProviderConfig of(String key, String type) {
            ProviderConfig config = new ProviderConfig();
            config.setKey(key);
            config.setType(type);
            return config;
        }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getHandshakeModel() { return handshakeModel; }
        public void setHandshakeModel(String handshakeModel) { this.handshakeModel = handshakeModel; }
    }

    /**
     * Model catalog entry; one chat session is opened per entry.
     */
    public static class ModelConfig {
        private String name;
        private String provider;
        private String modelId;
        private String description = "";
        private String endpoint;
        private List<ParameterConfig> parameters = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public List<ParameterConfig> getParameters() { return parameters; }
        public void setParameters(List<ParameterConfig> parameters) { this.parameters = parameters; }
    }

    /**
     * Model parameter with an optional scalar default.
     */
    public static class ParameterConfig {
        private String name;
        private String description = "";
        private Object defaultValue;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public Object getDefault() { return defaultValue; }
        public void setDefault(Object defaultValue) { this.defaultValue = defaultValue; }
    }

    /**
     * Cross-session summary configuration.
     */
    public static class SummaryConfig {
        private String systemPrompt = "Summarize the following assistant conversations in concise bullet points.";

        public String getSystemPrompt() { return systemPrompt; }
        public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }
    }

    /**
     * Startup connection behaviour.
     */
    public static class ConnectionConfig {
        private boolean autoHandshakeOnStartup = true;

        public boolean isAutoHandshakeOnStartup() { return autoHandshakeOnStartup; }
        public void setAutoHandshakeOnStartup(boolean autoHandshakeOnStartup) { this.autoHandshakeOnStartup = autoHandshakeOnStartup; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "multillm";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
