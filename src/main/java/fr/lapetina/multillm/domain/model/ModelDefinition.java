package fr.lapetina.multillm.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A configured model reachable through one provider.
 * Immutable; sessions hold a reference to it, never a copy.
 */
public record ModelDefinition(
        String name,
        String provider,
        String modelId,
        String description,
        String endpoint,
        List<ParameterDefinition> parameters
) {
    public ModelDefinition {
        Objects.requireNonNull(name, "Model name is required");
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(modelId, "Model ID is required");
        if (description == null) {
            description = "";
        }
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    /**
     * Endpoint override, if one was configured.
     */
    public Optional<String> endpointOverride() {
        return endpoint == null || endpoint.isBlank() ? Optional.empty() : Optional.of(endpoint.trim());
    }

    /**
     * Finds a parameter by case-insensitive name. The first match wins.
     */
    public Optional<ParameterDefinition> findParameter(String parameterName) {
        return parameters.stream()
                .filter(p -> p.hasName(parameterName))
                .findFirst();
    }

    @Override
    public String toString() {
        return name;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String provider;
        private String modelId;
        private String description;
        private String endpoint;
        private final List<ParameterDefinition> parameters = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder addParameter(ParameterDefinition parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder addParameter(String parameterName, Object defaultValue) {
            return addParameter(ParameterDefinition.of(parameterName, defaultValue));
        }

        public Builder parameters(List<ParameterDefinition> parameters) {
            this.parameters.addAll(parameters);
            return this;
        }

        public ModelDefinition build() {
            return new ModelDefinition(name, provider, modelId, description, endpoint, parameters);
        }
    }
}
