package fr.lapetina.pixelator.domain.event;

import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.domain.model.StripeTask;

import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder for one stripe task. The executor that claims the slot fills
 * in the stripe raster (or the failure); the compositing stage then draws it.
 * Handlers see each other's writes through the Disruptor's sequence barriers.
 *
 * IMPORTANT: This class is intentionally mutable for Disruptor performance.
 * It should never be accessed outside the Disruptor pipeline handlers.
 */
public final class StripeEvent {

    private StripeTask task;

    private EventState state;
    private RasterCanvas result;
    private ErrorType errorType;
    private String errorMessage;
    private String executorName;

    // Timing
    private Instant queuedAt;
    private Instant startedAt;
    private Instant processedAt;
    private Instant compositedAt;

    // Sequence number (set by Disruptor)
    private long sequence = -1;

    /**
     * Clears the event once the last stage is done with it.
     */
    public void clear() {
        this.task = null;
        this.state = null;
        this.result = null;
        this.errorType = null;
        this.errorMessage = null;
        this.executorName = null;
        this.queuedAt = null;
        this.startedAt = null;
        this.processedAt = null;
        this.compositedAt = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a freshly published task.
     */
    public void initialize(StripeTask task, long sequence) {
        clear();
        this.task = task;
        this.sequence = sequence;
        this.state = EventState.QUEUED;
        this.queuedAt = Instant.now();
    }

    // Getters
    public StripeTask getTask() {
        return task;
    }

    public EventState getState() {
        return state;
    }

    public RasterCanvas getResult() {
        return result;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getExecutorName() {
        return executorName;
    }

    public Instant getQueuedAt() {
        return queuedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public Instant getCompositedAt() {
        return compositedAt;
    }

    public long getSequence() {
        return sequence;
    }

    // State transitions
    public void markCropping(String executorName) {
        this.state = EventState.CROPPING;
        this.executorName = executorName;
        this.startedAt = Instant.now();
    }

    public void markProcessing() {
        this.state = EventState.PROCESSING;
    }

    public void markProcessed(RasterCanvas result) {
        this.result = result;
        this.state = EventState.PROCESSED;
        this.processedAt = Instant.now();
    }

    public void markComposited() {
        this.state = EventState.COMPOSITED;
        this.compositedAt = Instant.now();
        // The destination holds the pixels now
        this.result = null;
    }

    public void markFailed(ErrorType errorType, String message) {
        this.state = EventState.FAILED;
        this.errorType = errorType;
        this.errorMessage = message;
        this.result = null;
        this.processedAt = Instant.now();
    }

    public void markSkipped() {
        this.state = EventState.SKIPPED;
        this.result = null;
    }

    /**
     * Checks whether the stripe never made it to the destination.
     */
    public boolean isAbandoned() {
        return state == EventState.FAILED || state == EventState.SKIPPED;
    }

    @Override
    public String toString() {
        return "StripeEvent{" +
                "stripe=" + (task != null ? task.index() : "null") +
                ", state=" + state +
                ", executor=" + executorName +
                ", seq=" + sequence +
                '}';
    }
}
