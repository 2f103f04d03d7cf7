package fr.lapetina.multillm.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Tunable model parameter with an optional typed default.
 *
 * The default, when present, is an integer ({@link Integer} or {@link Long}),
 * a float ({@link Double} or {@link Float}), a {@link String} or a {@link Boolean}.
 */
public record ParameterDefinition(String name, String description, Object defaultValue) {

    public ParameterDefinition {
        Objects.requireNonNull(name, "Parameter name is required");
        if (description == null) {
            description = "";
        }
        if (defaultValue != null && !isSupported(defaultValue)) {
            throw new IllegalArgumentException("Unsupported default type for parameter '" + name + "': "
                    + defaultValue.getClass().getSimpleName());
        }
    }

    public static ParameterDefinition of(String name, Object defaultValue) {
        return new ParameterDefinition(name, "", defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean hasName(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate);
    }

    /**
     * Returns the default as an int when it is an integral value in int range.
     */
    public Optional<Integer> intDefault() {
        if (defaultValue instanceof Integer value) {
            return Optional.of(value);
        }
        if (defaultValue instanceof Long value
                && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return Optional.of(value.intValue());
        }
        return Optional.empty();
    }

    /**
     * Returns the default as a double when it is any numeric value.
     */
    public Optional<Double> doubleDefault() {
        if (defaultValue instanceof Number value) {
            return Optional.of(value.doubleValue());
        }
        return Optional.empty();
    }

    public Optional<String> stringDefault() {
        if (defaultValue instanceof String value) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    private static boolean isSupported(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Double
                || value instanceof Float
                || value instanceof String
                || value instanceof Boolean;
    }
}
