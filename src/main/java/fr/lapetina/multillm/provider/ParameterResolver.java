package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.domain.model.ModelDefinition;
import fr.lapetina.multillm.domain.model.ParameterDefinition;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves request parameters from a model's parameter definitions.
 * Lookups are case-insensitive and fall back to the given default on a missing
 * definition, a missing default or a default of the wrong type.
 */
public final class ParameterResolver {

    public static final String MAX_TOKENS = "max_tokens";
    public static final String TEMPERATURE = "temperature";

    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    private ParameterResolver() {
        // Utility class
    }

    public static int resolveInt(ModelDefinition model, String name, int fallback) {
        return model.findParameter(name)
                .flatMap(ParameterDefinition::intDefault)
                .orElse(fallback);
    }

    public static double resolveDouble(ModelDefinition model, String name, double fallback) {
        return model.findParameter(name)
                .flatMap(ParameterDefinition::doubleDefault)
                .orElse(fallback);
    }

    public static int maxTokens(ModelDefinition model) {
        return resolveInt(model, MAX_TOKENS, DEFAULT_MAX_TOKENS);
    }

    public static double temperature(ModelDefinition model) {
        return resolveDouble(model, TEMPERATURE, DEFAULT_TEMPERATURE);
    }

    /**
     * Collects every parameter carrying a default, keyed by parameter name.
     * Empty string defaults are skipped; the first definition of a name wins.
     */
    public static Map<String, Object> collectDefaults(ModelDefinition model) {
        Map<String, Object> result = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (ParameterDefinition parameter : model.parameters()) {
            if (!parameter.hasDefault() || !seen.add(parameter.name().toLowerCase(Locale.ROOT))) {
                continue;
            }
            Object value = parameter.defaultValue();
            if (value instanceof String text && text.isEmpty()) {
                continue;
            }
            result.put(parameter.name(), value);
        }
        return result;
    }
}
