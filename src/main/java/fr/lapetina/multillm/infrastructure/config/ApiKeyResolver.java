package fr.lapetina.multillm.infrastructure.config;

import fr.lapetina.multillm.domain.session.CredentialSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the API key for a provider.
 *
 * Priority order:
 * 1. Explicit override (command line)
 * 2. {@code ~/.<PROVIDER>_API_KEY} file
 * 3. {@code apiKeys} section of the configuration
 * 4. {@code <PROVIDER>_API_KEY} environment variable
 *
 * Anthropic also accepts the {@code CLAUDE_API_KEY} file (checked first) and environment variable (checked last).
 */
public final class ApiKeyResolver implements CredentialSource {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyResolver.class);

    private final Map<String, String> configuredKeys;
    private final Path homeDirectory;
    private final Function<String, String> environment;
    private final String override;

    public ApiKeyResolver(Map<String, String> configuredKeys, Path homeDirectory,
                          Function<String, String> environment, String override) {
        this.configuredKeys = configuredKeys != null ? new LinkedHashMap<>(configuredKeys) : Map.of();
        this.homeDirectory = homeDirectory;
        this.environment = environment;
        this.override = override;
    }

    public ApiKeyResolver(MultiLlmConfig config, String override) {
        this(config.getApiKeys(), Paths.get(System.getProperty("user.home")), System::getenv, override);
    }

    /**
     * Resolves a key, honouring an explicit override first.
     */
    public Optional<String> resolve(String provider, String explicitOverride) {
        if (!isBlank(explicitOverride)) {
            log.debug("Using explicit API key override: provider={}", provider);
            return Optional.of(explicitOverride.trim());
        }

        String normalized = provider.trim().toLowerCase(Locale.ROOT);
        List<String> names = variableNames(normalized);

        for (String name : filesFirst(normalized, names)) {
            Optional<String> key = readKeyFile(homeDirectory.resolve("." + name));
            if (key.isPresent()) {
                return key;
            }
        }

        Optional<String> configured = configuredKeys.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().trim().equalsIgnoreCase(normalized))
                .map(Map.Entry::getValue)
                .filter(value -> !isBlank(value))
                .map(String::trim)
                .findFirst();
        if (configured.isPresent()) {
            log.debug("Using configured API key: provider={}", normalized);
            return configured;
        }

        for (String name : names) {
            String value = environment.apply(name);
            if (!isBlank(value)) {
                log.debug("Using API key from environment: provider={}, variable={}", normalized, name);
                return Optional.of(value.trim());
            }
        }

        return Optional.empty();
    }

    @Override
    public Optional<String> credentialFor(String provider) {
        return resolve(provider, override);
    }

    private static List<String> variableNames(String provider) {
        List<String> names = new ArrayList<>();
        names.add(provider.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_") + "_API_KEY");
        if ("anthropic".equals(provider)) {
            names.add("CLAUDE_API_KEY");
        }
        return names;
    }

    private static List<String> filesFirst(String provider, List<String> names) {
        if ("anthropic".equals(provider)) {
            List<String> reordered = new ArrayList<>(names);
            reordered.remove("CLAUDE_API_KEY");
            reordered.add(0, "CLAUDE_API_KEY");
            return reordered;
        }
        return names;
    }

    private Optional<String> readKeyFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            String key = Files.readString(path, StandardCharsets.UTF_8).trim();
            if (!key.isEmpty()) {
                log.debug("Loaded API key from {}", path);
                return Optional.of(key);
            }
        } catch (IOException e) {
            log.warn("Failed to read key file {}: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
