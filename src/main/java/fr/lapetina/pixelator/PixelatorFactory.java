package fr.lapetina.pixelator;

import fr.lapetina.pixelator.domain.model.PixelSource;
import fr.lapetina.pixelator.infrastructure.config.ConfigLoader;
import fr.lapetina.pixelator.infrastructure.config.PixelatorConfig;
import fr.lapetina.pixelator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;

/**
 * Factory for creating configured {@link Pixelator} instances that share one
 * configuration and one metrics registry.
 *
 * <p>Usage:
 * <pre>{@code
 * try (PixelatorFactory factory = PixelatorFactory.create("pixelator.yaml")) {
 *     Pixelator pixelator = factory.forSource(ImageSources.fromPath(path));
 *     PixelatedImage image = pixelator.pixelateSync(16, 16);
 * }
 * }</pre>
 */
public class PixelatorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PixelatorFactory.class);

    private final ConfigLoader configLoader;
    private final PixelatorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ThreadFactory threadFactoryOverride;
    private final List<Pixelator> pixelators = new CopyOnWriteArrayList<>();

    protected PixelatorFactory(String configPath, ThreadFactory threadFactoryOverride) {
        log.info("Initializing PixelatorFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(),
                config.getMetrics().isEnabled()
        );

        // Allow override for testing
        this.threadFactoryOverride = threadFactoryOverride;

        log.info("PixelatorFactory initialized: defaultExecutors={}, waitStrategy={}, callTimeoutMs={}",
                config.getConcurrency().resolveDefaultExecutors(),
                config.getDisruptor().getWaitStrategy(),
                config.getTimeouts().getCallTimeoutMs());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static PixelatorFactory create(String configPath) {
        return new PixelatorFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (pixelator.yaml).
     */
    public static PixelatorFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    /**
     * Creates a pixelator bound to the given source. It is disposed with the factory.
     */
    public Pixelator forSource(PixelSource source) {
        Pixelator pixelator = Pixelator.builder()
                .source(source)
                .config(config)
                .metricsRegistry(metricsRegistry)
                .threadFactory(threadFactoryOverride)
                .build();
        pixelators.add(pixelator);
        return pixelator;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public PixelatorConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    @Override
    public void close() {
        log.info("Shutting down PixelatorFactory...");

        for (Pixelator pixelator : pixelators) {
            try {
                pixelator.close();
            } catch (Exception e) {
                log.warn("Error disposing pixelator", e);
            }
        }
        pixelators.clear();

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("PixelatorFactory shut down");
    }
}
