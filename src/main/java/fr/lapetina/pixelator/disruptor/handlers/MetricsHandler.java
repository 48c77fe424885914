package fr.lapetina.pixelator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.pixelator.disruptor.PixelationCall;
import fr.lapetina.pixelator.domain.event.StripeEvent;
import fr.lapetina.pixelator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Final stage handler: records per-stripe metrics and clears the event.
 *
 * Records:
 * - Stripe count by final state
 * - Stripe processing latency (crop + average + paint)
 * - Stripe queue time (published until claimed)
 *
 * Errors are counted once per failed call by the scheduler; failed stripes
 * only show up here under the FAILED state.
 */
public final class MetricsHandler implements EventHandler<StripeEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final PixelationCall call;
    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(PixelationCall call, MetricsRegistry metricsRegistry) {
        this.call = call;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(StripeEvent event, long sequence, boolean endOfBatch) {
        MDC.put("pixelationId", call.id());
        MDC.put("eventState", event.getState() != null ? event.getState().name() : "UNKNOWN");
        try {
            recordMetrics(event);
        } finally {
            MDC.remove("pixelationId");
            MDC.remove("eventState");
            event.clear();
        }
    }

    private void recordMetrics(StripeEvent event) {
        if (event.getState() == null) {
            return;
        }

        metricsRegistry.incrementStripeCount(event.getState());

        if (event.getStartedAt() != null && event.getProcessedAt() != null) {
            metricsRegistry.recordStageLatency("stripe",
                    Duration.between(event.getStartedAt(), event.getProcessedAt()));
        }

        if (event.getQueuedAt() != null && event.getStartedAt() != null) {
            metricsRegistry.recordStageLatency("queue",
                    Duration.between(event.getQueuedAt(), event.getStartedAt()));
        }

        if (event.getProcessedAt() != null && event.getCompositedAt() != null) {
            metricsRegistry.recordStageLatency("compositing",
                    Duration.between(event.getProcessedAt(), event.getCompositedAt()));
        }

        if (event.getErrorType() != null) {
            log.warn("Stripe error recorded: pixelationId={}, stripe={}, errorType={}, message={}",
                    call.id(), event.getTask() != null ? event.getTask().index() : -1,
                    event.getErrorType(), event.getErrorMessage());
        }
    }
}
