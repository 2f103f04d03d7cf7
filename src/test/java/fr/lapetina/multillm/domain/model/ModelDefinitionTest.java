package fr.lapetina.multillm.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelDefinitionTest {

    private ModelDefinition model;

    @BeforeEach
    void setUp() {
        model = ModelDefinition.builder()
                .name("GPT")
                .provider("openai")
                .modelId("gpt-4o-mini")
                .description("Fast model")
                .addParameter("temperature", 0.8)
                .addParameter("Temperature", 0.1)
                .addParameter(new ParameterDefinition("max_tokens", "Maximum tokens", 256))
                .build();
    }

    @Test
    @DisplayName("should create model with builder")
    void shouldCreateModelWithBuilder() {
        assertThat(model.name()).isEqualTo("GPT");
        assertThat(model.provider()).isEqualTo("openai");
        assertThat(model.modelId()).isEqualTo("gpt-4o-mini");
        assertThat(model.description()).isEqualTo("Fast model");
        assertThat(model.parameters()).hasSize(3);
        assertThat(model).hasToString("GPT");
    }

    @Test
    @DisplayName("should find the first parameter by case-insensitive name")
    void shouldFindParameter() {
        assertThat(model.findParameter("TEMPERATURE")).hasValueSatisfying(p ->
                assertThat(p.defaultValue()).isEqualTo(0.8));
        assertThat(model.findParameter("top_p")).isEmpty();
    }

    @Test
    @DisplayName("should copy the parameter list")
    void shouldCopyParameters() {
        List<ParameterDefinition> parameters = new ArrayList<>();
        parameters.add(ParameterDefinition.of("temperature", 0.5));
        ModelDefinition copy = new ModelDefinition("m", "openai", "m", null, null, parameters);

        parameters.clear();

        assertThat(copy.parameters()).hasSize(1);
        assertThatThrownBy(() -> copy.parameters().add(ParameterDefinition.of("x", 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should expose a trimmed endpoint override only when set")
    void shouldExposeEndpointOverride() {
        assertThat(model.endpointOverride()).isEmpty();

        ModelDefinition custom = ModelDefinition.builder()
                .name("HF").provider("huggingface").modelId("x").endpoint(" custom/run ").build();
        assertThat(custom.endpointOverride()).contains("custom/run");
    }

    @Test
    @DisplayName("should require name, provider and model id")
    void shouldRequireIdentity() {
        assertThatThrownBy(() -> ModelDefinition.builder().name("x").provider("openai").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Model ID");
    }
}
