package fr.lapetina.pixelator.infrastructure.config;

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
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link PixelatorConfig} from YAML.
 *
 * Looks on the file system first, then on the classpath. An empty document
 * yields the defaults.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG = "pixelator.yaml";

    private final AtomicReference<PixelatorConfig> currentConfig = new AtomicReference<>();
    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(PixelatorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails or values are invalid
     */
    public PixelatorConfig load() {
        PixelatorConfig config = validate(loadFromPath());
        currentConfig.set(config);
        return config;
    }

    private PixelatorConfig loadFromPath() {
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

    private PixelatorConfig loadFromFile(Path path) {
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
    public PixelatorConfig loadFromStream(InputStream inputStream) {
        PixelatorConfig config = validate(parse(inputStream, "stream"));
        currentConfig.set(config);
        return config;
    }

    /**
     * Returns the last loaded configuration, or null before the first load.
     */
    public PixelatorConfig getCurrentConfig() {
        return currentConfig.get();
    }

    private PixelatorConfig parse(InputStream is, String origin) {
        try {
            PixelatorConfig config = yaml.load(is);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    private static PixelatorConfig validate(PixelatorConfig config) {
        if (config.getConcurrency().getMaxExecutors() < 0) {
            throw new ConfigurationException(
                    "concurrency.maxExecutors must not be negative: " + config.getConcurrency().getMaxExecutors());
        }
        if (config.getTimeouts().getCallTimeoutMs() <= 0) {
            throw new ConfigurationException(
                    "timeouts.callTimeoutMs must be positive: " + config.getTimeouts().getCallTimeoutMs());
        }
        if (config.getTimeouts().getShutdownTimeoutMs() <= 0) {
            throw new ConfigurationException(
                    "timeouts.shutdownTimeoutMs must be positive: " + config.getTimeouts().getShutdownTimeoutMs());
        }
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static PixelatorConfig createDefault() {
        return new PixelatorConfig();
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
