package fr.lapetina.multillm.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the YAML configuration from the file system, falling back to the classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(MultiLlmConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public MultiLlmConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private MultiLlmConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public MultiLlmConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private MultiLlmConfig parse(InputStream inputStream, String source) {
        MultiLlmConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Configuration is empty, using defaults: {}", source);
            return createDefault();
        }
        validate(config, source);
        return config;
    }

    private static void validate(MultiLlmConfig config, String source) {
        for (MultiLlmConfig.ModelConfig model : config.getModels()) {
            if (isBlank(model.getName()) || isBlank(model.getProvider()) || isBlank(model.getModelId())) {
                throw new ConfigurationException(
                        "Model entries require name, provider and modelId in " + source);
            }
            for (MultiLlmConfig.ParameterConfig parameter : model.getParameters()) {
                if (isBlank(parameter.getName())) {
                    throw new ConfigurationException(
                            "Parameter without a name for model '" + model.getName() + "' in " + source);
                }
            }
        }
        for (MultiLlmConfig.ProviderConfig provider : config.getProviders()) {
            if (isBlank(provider.getKey()) || isBlank(provider.getType())) {
                throw new ConfigurationException("Provider entries require key and type in " + source);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Creates a default configuration.
     */
    public static MultiLlmConfig createDefault() {
        return new MultiLlmConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
