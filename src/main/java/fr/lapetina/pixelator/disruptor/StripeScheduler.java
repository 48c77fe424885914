package fr.lapetina.pixelator.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.disruptor.handlers.CompositingHandler;
import fr.lapetina.pixelator.disruptor.handlers.MetricsHandler;
import fr.lapetina.pixelator.disruptor.handlers.StripeWorkHandler;
import fr.lapetina.pixelator.domain.event.StripeEvent;
import fr.lapetina.pixelator.domain.event.StripeEventFactory;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.PixelSource;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.domain.model.StripeTask;
import fr.lapetina.pixelator.infrastructure.config.PixelatorConfig;
import fr.lapetina.pixelator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.pixelator.processing.Compositor;
import fr.lapetina.pixelator.processing.StripeProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one pixelation call on a Disruptor built for that call alone.
 *
 * <p>Every stripe of the call is published up front into a ring buffer large
 * enough to hold all of them. A worker pool of
 * {@code min(concurrencyLimit, stripeCount)} executors drains the buffer:
 * each executor claims the next unclaimed stripe when it finishes the
 * previous one, so executors are reused rather than created per stripe.
 * Downstream of the pool, a single compositing handler is the only writer
 * of the destination raster, and a metrics handler closes the chain:
 * <pre>
 * StripeWorkHandler x N -> CompositingHandler -> MetricsHandler
 * </pre>
 *
 * <p>The call resolves only when every stripe has landed. On the first
 * failure the remaining stripes are skipped, and the executors are shut
 * down before {@link #execute()} rethrows. Teardown runs exactly once,
 * whatever the outcome, and is also triggered by {@link #close()}.
 */
public final class StripeScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StripeScheduler.class);

    private final PixelationCall call;
    private final Disruptor<StripeEvent> disruptor;
    private final int executorCount;
    private final long callTimeoutMs;
    private final long shutdownTimeoutMs;
    private final MetricsRegistry metricsRegistry;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile boolean dispatched;

    private StripeScheduler(Builder builder) {
        GridLayout layout = builder.layout;
        this.call = new PixelationCall(builder.pixelationId, builder.source, layout, builder.grayscale);
        this.executorCount = Math.min(builder.concurrencyLimit, layout.stripeCount());
        this.callTimeoutMs = builder.callTimeoutMs;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
        this.metricsRegistry = builder.metricsRegistry;

        ThreadFactory threadFactory = builder.threadFactory != null
                ? builder.threadFactory
                : new ExecutorThreadFactory("pixelator-" + call.id());

        this.disruptor = new Disruptor<>(
                new StripeEventFactory(),
                ringBufferSizeFor(layout.stripeCount()),
                threadFactory,
                ProducerType.SINGLE, // Only the calling thread publishes
                createWaitStrategy(builder.waitStrategy)
        );

        StripeWorkHandler[] executors = new StripeWorkHandler[executorCount];
        for (int i = 0; i < executorCount; i++) {
            executors[i] = new StripeWorkHandler(call, builder.stripeProcessor);
        }

        RasterCanvas destination = builder.destination != null
                ? builder.destination
                : new RasterCanvas(layout.width(), layout.height());

        disruptor
                .handleEventsWithWorkerPool(executors)
                .then(new CompositingHandler(call, new Compositor(destination, layout)))
                .then(new MetricsHandler(call, metricsRegistry));

        disruptor.setDefaultExceptionHandler(new StripeExceptionHandler(call));

        log.debug("StripeScheduler created: pixelationId={}, {}, executors={}",
                call.id(), layout, executorCount);
    }

    /**
     * Dispatches every stripe and blocks until the destination is complete.
     *
     * @return the destination raster, fully composited
     * @throws PixelationException if any stripe fails, the call times out, is
     *                             interrupted or aborted; executors are already
     *                             shut down when it is thrown
     * @throws IllegalStateException if called twice
     */
    public RasterCanvas execute() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pixelation call already executed: " + call.id());
        }

        GridLayout layout = call.layout();
        Instant startTime = Instant.now();

        log.info("Pixelation dispatched: pixelationId={}, cells={}x{}, orientation={}, stripes={}, executors={}, grayscale={}",
                call.id(), layout.columns().size(), layout.rows().size(), layout.orientation(),
                layout.stripeCount(), executorCount, call.grayscale());

        try {
            if (call.isAborted()) {
                throw call.getFailure();
            }

            RingBuffer<StripeEvent> ringBuffer = disruptor.start();
            dispatched = true;
            metricsRegistry.callStarted(executorCount);
            publishTasks(ringBuffer, layout);

            RasterCanvas destination = call.completion().get(callTimeoutMs, TimeUnit.MILLISECONDS);
            Duration elapsed = Duration.between(startTime, Instant.now());

            metricsRegistry.recordCall(null, elapsed);
            log.info("Pixelation completed: pixelationId={}, stripes={}, executors={}, latencyMs={}",
                    call.id(), layout.stripeCount(), executorCount, elapsed.toMillis());
            return destination;

        } catch (java.util.concurrent.TimeoutException e) {
            throw failed(new PixelationException(ErrorType.TIMEOUT,
                    "Pixelation did not complete within " + callTimeoutMs + "ms"), startTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed(new PixelationException(ErrorType.CANCELLED,
                    "Interrupted while waiting for pixelation", e), startTime);
        } catch (ExecutionException e) {
            throw failed(unwrap(e.getCause()), startTime);
        } catch (PixelationException e) {
            throw failed(e, startTime);
        } finally {
            // Executors are gone before anything propagates to the caller
            close();
        }
    }

    /**
     * Fails the call from outside: remaining stripes are skipped and
     * {@link #execute()} returns with {@code cause} after teardown.
     */
    public void abort(PixelationException cause) {
        if (call.abort(cause)) {
            log.warn("Pixelation aborted: pixelationId={}, errorType={}, reason={}",
                    call.id(), cause.getErrorType(), cause.getMessage());
        }
    }

    public String getPixelationId() {
        return call.id();
    }

    public int getExecutorCount() {
        return executorCount;
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    /**
     * Shuts the executors down. Runs once; later calls do nothing.
     */
    @Override
    public void close() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        if (!dispatched) {
            log.debug("StripeScheduler closed before dispatch: pixelationId={}", call.id());
            return;
        }

        try {
            disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Executors shut down: pixelationId={}", call.id());
        } catch (TimeoutException e) {
            log.warn("Executor shutdown timed out, halting: pixelationId={}", call.id());
            disruptor.halt();
        } finally {
            metricsRegistry.callFinished(executorCount);
        }
    }

    private void publishTasks(RingBuffer<StripeEvent> ringBuffer, GridLayout layout) {
        for (StripeTask task : layout.stripeTasks()) {
            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).initialize(task, sequence);
            } finally {
                ringBuffer.publish(sequence);
            }
        }
        log.debug("Stripe tasks queued: pixelationId={}, tasks={}", call.id(), layout.stripeCount());
    }

    private PixelationException failed(PixelationException cause, Instant startTime) {
        // Stop the remaining stripes before reporting
        call.abort(cause);
        PixelationException reported = call.getFailure() != null ? call.getFailure() : cause;
        Duration elapsed = Duration.between(startTime, Instant.now());
        metricsRegistry.recordCall(reported.getErrorType(), elapsed);
        log.error("Pixelation failed: pixelationId={}, errorType={}, error={}, latencyMs={}",
                call.id(), reported.getErrorType(), reported.getMessage(), elapsed.toMillis());
        return reported;
    }

    private static PixelationException unwrap(Throwable cause) {
        if (cause instanceof PixelationException pe) {
            return pe;
        }
        return new PixelationException(ErrorType.PROCESSING_FAILURE,
                "Pixelation failed: " + (cause != null ? cause.getMessage() : "unknown"), cause);
    }

    static int ringBufferSizeFor(int stripeCount) {
        int size = 1;
        while (size < stripeCount) {
            size <<= 1;
        }
        return size;
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for the executors and stage threads of one call.
     */
    static final class ExecutorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        ExecutorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor: anything escaping a handler fails the call.
     */
    private static final class StripeExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<StripeEvent> {

        private static final Logger log = LoggerFactory.getLogger(StripeExceptionHandler.class);

        private final PixelationCall call;

        StripeExceptionHandler(PixelationCall call) {
            this.call = call;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, StripeEvent event) {
            log.error("Exception in stripe handler: pixelationId={}, sequence={}, event={}",
                    call.id(), sequence, event, ex);
            call.abort(new PixelationException(ErrorType.PROCESSING_FAILURE,
                    "Unexpected error in stripe pipeline: " + ex.getMessage(), ex));
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during executor start: pixelationId={}", call.id(), ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during executor shutdown: pixelationId={}", call.id(), ex);
        }
    }

    /**
     * Builder for StripeScheduler.
     */
    public static final class Builder {
        private String pixelationId;
        private PixelSource source;
        private GridLayout layout;
        private boolean grayscale;
        private int concurrencyLimit = PixelatorConfig.ConcurrencyConfig.FALLBACK_EXECUTORS;
        private RasterCanvas destination;
        private ThreadFactory threadFactory;
        private String waitStrategy = "blocking";
        private long callTimeoutMs = 60_000;
        private long shutdownTimeoutMs = 5_000;
        private StripeProcessor stripeProcessor = new StripeProcessor();
        private MetricsRegistry metricsRegistry;

        public Builder pixelationId(String id) {
            this.pixelationId = id;
            return this;
        }

        public Builder source(PixelSource source) {
            this.source = source;
            return this;
        }

        public Builder layout(GridLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder grayscale(boolean grayscale) {
            this.grayscale = grayscale;
            return this;
        }

        public Builder concurrencyLimit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("Concurrency limit must be positive: " + limit);
            }
            this.concurrencyLimit = limit;
            return this;
        }

        public Builder destination(RasterCanvas destination) {
            this.destination = destination;
            return this;
        }

        public Builder threadFactory(ThreadFactory threadFactory) {
            this.threadFactory = threadFactory;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder callTimeoutMs(long timeoutMs) {
            this.callTimeoutMs = timeoutMs;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder stripeProcessor(StripeProcessor processor) {
            this.stripeProcessor = processor;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(PixelatorConfig config) {
            this.concurrencyLimit = config.getConcurrency().resolveDefaultExecutors();
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.callTimeoutMs = config.getTimeouts().getCallTimeoutMs();
            this.shutdownTimeoutMs = config.getTimeouts().getShutdownTimeoutMs();
            return this;
        }

        public StripeScheduler build() {
            if (source == null) {
                throw new IllegalStateException("PixelSource is required");
            }
            if (layout == null) {
                throw new IllegalStateException("GridLayout is required");
            }
            if (layout.width() != source.width() || layout.height() != source.height()) {
                throw new IllegalStateException("GridLayout " + layout + " does not match source "
                        + source.width() + "x" + source.height());
            }
            if (stripeProcessor == null) {
                throw new IllegalStateException("StripeProcessor is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (pixelationId == null) {
                pixelationId = UUID.randomUUID().toString().substring(0, 8);
            }
            return new StripeScheduler(this);
        }
    }
}
