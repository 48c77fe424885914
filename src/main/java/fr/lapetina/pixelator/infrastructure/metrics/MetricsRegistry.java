package fr.lapetina.pixelator.infrastructure.metrics;

import fr.lapetina.pixelator.domain.event.EventState;
import fr.lapetina.pixelator.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Call latency and outcome counters
 * - Per-stage stripe latency (queue, stripe, compositing)
 * - Stripe counters by final state, error counters by type (one per failed call)
 * - Active call and executor gauges
 * - Optional JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> stripeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final Timer callTimer;

    // Global gauges
    private final AtomicInteger activeCalls = new AtomicInteger(0);
    private final AtomicInteger activeExecutors = new AtomicInteger(0);

    private JvmGcMetrics gcMetrics;

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            gcMetrics = new JvmGcMetrics();
            gcMetrics.bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_active_calls", activeCalls, AtomicInteger::get)
                .description("Pixelation calls currently dispatched")
                .register(registry);

        Gauge.builder(prefix + "_active_executors", activeExecutors, AtomicInteger::get)
                .description("Executors currently owned by dispatched calls")
                .register(registry);

        this.callTimer = Timer.builder(prefix + "_call_latency")
                .description("Pixelation call latency, dispatch to last landed stripe")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("pixelator", false);
    }

    /**
     * Marks a call as dispatched with the given number of executors.
     */
    public void callStarted(int executors) {
        activeCalls.incrementAndGet();
        activeExecutors.addAndGet(executors);
    }

    /**
     * Marks a call's executors as released.
     */
    public void callFinished(int executors) {
        activeCalls.decrementAndGet();
        activeExecutors.addAndGet(-executors);
    }

    /**
     * Records a finished call.
     *
     * @param errorType null for a successful call
     */
    public void recordCall(ErrorType errorType, Duration latency) {
        String outcome = errorType == null ? "success" : "failure";
        callCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_calls_total")
                        .description("Total number of pixelation calls")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
        callTimer.record(latency);
        if (errorType != null) {
            incrementErrorCount(errorType);
        }
    }

    /**
     * Increments the stripe counter for a final event state.
     */
    public void incrementStripeCount(EventState state) {
        stripeCounters.computeIfAbsent(state.name(), k ->
                Counter.builder(prefix + "_stripes_total")
                        .description("Total number of stripes by final state")
                        .tag("state", state.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (queue, stripe, compositing).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType.name(), k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public int getActiveCalls() {
        return activeCalls.get();
    }

    public int getActiveExecutors() {
        return activeExecutors.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        if (gcMetrics != null) {
            gcMetrics.close();
        }
        registry.close();
    }
}
