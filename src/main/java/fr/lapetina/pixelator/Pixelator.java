package fr.lapetina.pixelator;

import fr.lapetina.pixelator.disruptor.StripeScheduler;
import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.grid.Partitioner;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import fr.lapetina.pixelator.domain.model.PixelSource;
import fr.lapetina.pixelator.domain.model.PixelateOptions;
import fr.lapetina.pixelator.domain.model.PixelatedImage;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.infrastructure.config.ConfigLoader;
import fr.lapetina.pixelator.infrastructure.config.PixelatorConfig;
import fr.lapetina.pixelator.infrastructure.io.ImageEncoder;
import fr.lapetina.pixelator.infrastructure.io.ImageSources;
import fr.lapetina.pixelator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.pixelator.processing.StripeProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pixelates one source image, as many times as asked.
 *
 * <p>Each {@link #pixelate(int, int, PixelateOptions)} call reads the
 * original source, never a previous result, and gets its own executors from
 * a fresh {@link StripeScheduler}. Calls on one instance run one after the
 * other on a coordinator thread; the caller only blocks for argument
 * validation.
 *
 * <pre>{@code
 * try (Pixelator pixelator = Pixelator.fromImage(Path.of("photo.png"))) {
 *     PixelatedImage image = pixelator.pixelate(32, 24).get();
 *     byte[] png = pixelator.toPng();
 * }
 * }</pre>
 *
 * <p>Closing the instance aborts every queued or running call with
 * {@link ErrorType#DISPOSED}; afterwards every method except {@link #close()}
 * throws that same error.
 */
public final class Pixelator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Pixelator.class);

    private final PixelSource source;
    private final RasterCanvas target;
    private final PixelatorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final boolean ownsMetrics;
    private final ThreadFactory threadFactory;
    private final StripeProcessor stripeProcessor;
    private final ExecutorService coordinator;

    private final Set<StripeScheduler> activeCalls = ConcurrentHashMap.newKeySet();
    private final AtomicReference<PixelatedImage> latest = new AtomicReference<>();
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    private Pixelator(Builder builder) {
        this.source = builder.source;
        this.target = builder.target;
        this.config = builder.config;
        this.ownsMetrics = builder.metricsRegistry == null;
        this.metricsRegistry = ownsMetrics
                ? new MetricsRegistry(config.getMetrics().getPrefix(), config.getMetrics().isEnabled())
                : builder.metricsRegistry;
        this.threadFactory = builder.threadFactory;
        this.stripeProcessor = builder.stripeProcessor;
        this.coordinator = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pixelator-coordinator");
            t.setDaemon(true);
            return t;
        });

        log.debug("Pixelator created: source={}x{}, target={}",
                source.width(), source.height(), target != null ? "attached" : "none");
    }

    public static Pixelator fromImage(Path path) {
        return builder().source(ImageSources.fromPath(path)).build();
    }

    public static Pixelator fromImage(URI uri) {
        return builder().source(ImageSources.fromUri(uri)).build();
    }

    public static Pixelator fromImage(byte[] encoded) {
        return builder().source(ImageSources.fromBytes(encoded)).build();
    }

    /**
     * @param dataUrl a base64 {@code data:image/...} URL
     */
    public static Pixelator fromImage(String dataUrl) {
        return builder().source(ImageSources.fromDataUrl(dataUrl)).build();
    }

    public static Pixelator fromImage(BufferedImage image) {
        return builder().source(ImageSources.fromBufferedImage(image)).build();
    }

    public static Pixelator fromImage(PixelSource source) {
        return builder().source(source).build();
    }

    /**
     * Pixelates with the configured default options.
     */
    public CompletableFuture<PixelatedImage> pixelate(int xCells, int yCells) {
        return pixelate(xCells, yCells,
                PixelateOptions.defaults().withGrayscale(config.getOutput().isGrayscale()));
    }

    /**
     * Starts a pixelation call.
     *
     * @throws PixelationException immediately, with {@link ErrorType#INVALID_DIMENSION},
     *                             {@link ErrorType#DIMENSION_EXCEEDS_SOURCE} or
     *                             {@link ErrorType#DISPOSED}, before any executor exists
     */
    public CompletableFuture<PixelatedImage> pixelate(int xCells, int yCells, PixelateOptions options) {
        ensureOpen();
        Objects.requireNonNull(options, "Options are required");

        GridLayout layout = Partitioner.plan(source.width(), source.height(), xCells, yCells);

        StripeScheduler.Builder schedulerBuilder = StripeScheduler.builder()
                .fromConfig(config)
                .source(source)
                .layout(layout)
                .grayscale(options.grayscale())
                .stripeProcessor(stripeProcessor)
                .metricsRegistry(metricsRegistry)
                .threadFactory(threadFactory);
        options.concurrencyLimitOverride().ifPresent(schedulerBuilder::concurrencyLimit);
        StripeScheduler scheduler = schedulerBuilder.build();

        activeCalls.add(scheduler);
        try {
            return CompletableFuture.supplyAsync(() -> run(scheduler, layout, options.grayscale()), coordinator);
        } catch (RejectedExecutionException e) {
            // Lost the race against close()
            activeCalls.remove(scheduler);
            throw PixelationException.disposed();
        }
    }

    /**
     * Pixelates and waits for the result.
     */
    public PixelatedImage pixelateSync(int xCells, int yCells, PixelateOptions options) {
        CompletableFuture<PixelatedImage> future = pixelate(xCells, yCells, options);
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof PixelationException pe) {
                throw pe;
            }
            throw new PixelationException(ErrorType.PROCESSING_FAILURE,
                    "Pixelation failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PixelationException(ErrorType.CANCELLED, "Interrupted while waiting for pixelation", e);
        }
    }

    public PixelatedImage pixelateSync(int xCells, int yCells) {
        return pixelateSync(xCells, yCells,
                PixelateOptions.defaults().withGrayscale(config.getOutput().isGrayscale()));
    }

    private PixelatedImage run(StripeScheduler scheduler, GridLayout layout, boolean grayscale) {
        try {
            if (disposed.get()) {
                scheduler.abort(PixelationException.disposed());
            }
            Instant start = Instant.now();
            RasterCanvas destination = scheduler.execute();
            Duration elapsed = Duration.between(start, Instant.now());

            PixelBuffer pixels = destination.snapshot();
            if (target != null) {
                target.blit(pixels, 0, 0);
            }
            PixelatedImage image = new PixelatedImage(pixels, layout, grayscale,
                    scheduler.getExecutorCount(), elapsed);
            latest.set(image);
            return image;
        } finally {
            activeCalls.remove(scheduler);
        }
    }

    /**
     * Returns the latest result painted on a canvas; the attached target if there is one.
     */
    public RasterCanvas toCanvas() {
        PixelatedImage image = latestResult();
        if (target != null) {
            return target;
        }
        RasterCanvas canvas = new RasterCanvas(image.width(), image.height());
        canvas.blit(image.pixels(), 0, 0);
        return canvas;
    }

    public byte[] toPng() {
        return ImageEncoder.toPng(latestResult().pixels());
    }

    public String toDataUrl() {
        return ImageEncoder.toDataUrl(latestResult().pixels());
    }

    public BufferedImage toBufferedImage() {
        return ImageEncoder.toBufferedImage(latestResult().pixels());
    }

    /**
     * Returns the latest completed result.
     *
     * @throws IllegalStateException if no call has completed yet
     */
    public PixelatedImage latestResult() {
        ensureOpen();
        PixelatedImage image = latest.get();
        if (image == null) {
            throw new IllegalStateException("No pixelation result available");
        }
        return image;
    }

    public int width() {
        ensureOpen();
        return source.width();
    }

    public int height() {
        ensureOpen();
        return source.height();
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    private void ensureOpen() {
        if (disposed.get()) {
            throw PixelationException.disposed();
        }
    }

    /**
     * Disposes the instance. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        log.info("Disposing pixelator: activeCalls={}", activeCalls.size());

        for (StripeScheduler scheduler : activeCalls) {
            scheduler.abort(PixelationException.disposed());
        }

        // Queued calls still run, see the flag and fail fast
        coordinator.shutdown();
        try {
            long timeoutMs = config.getTimeouts().getShutdownTimeoutMs();
            if (!coordinator.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Coordinator did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while disposing pixelator");
        }

        if (ownsMetrics) {
            metricsRegistry.close();
        }
        log.info("Pixelator disposed");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Pixelator.
     */
    public static final class Builder {
        private PixelSource source;
        private RasterCanvas target;
        private PixelatorConfig config = ConfigLoader.createDefault();
        private MetricsRegistry metricsRegistry;
        private ThreadFactory threadFactory;
        private StripeProcessor stripeProcessor = new StripeProcessor();

        public Builder source(PixelSource source) {
            this.source = source;
            return this;
        }

        /**
         * Canvas that receives every completed result; must match the source size.
         */
        public Builder target(RasterCanvas target) {
            this.target = target;
            return this;
        }

        public Builder config(PixelatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        /**
         * Factory for the executor threads of every call; each call owns the threads it creates.
         */
        public Builder threadFactory(ThreadFactory threadFactory) {
            this.threadFactory = threadFactory;
            return this;
        }

        public Builder stripeProcessor(StripeProcessor processor) {
            this.stripeProcessor = processor;
            return this;
        }

        public Pixelator build() {
            if (source == null) {
                throw new IllegalStateException("PixelSource is required");
            }
            if (config == null) {
                throw new IllegalStateException("PixelatorConfig is required");
            }
            if (stripeProcessor == null) {
                throw new IllegalStateException("StripeProcessor is required");
            }
            if (target != null && (target.width() != source.width() || target.height() != source.height())) {
                throw new IllegalArgumentException("Target canvas " + target.width() + "x" + target.height()
                        + " does not match source " + source.width() + "x" + source.height());
            }
            return new Pixelator(this);
        }
    }
}
