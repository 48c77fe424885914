package fr.lapetina.pixelator.domain.event;

/**
 * Lifecycle state of a stripe event in the Disruptor pipeline.
 */
public enum EventState {
    /** Task published, waiting for an executor */
    QUEUED,

    /** An executor is cropping the stripe from the source */
    CROPPING,

    /** An executor is averaging and painting the stripe's cells */
    PROCESSING,

    /** Stripe raster ready, waiting for the compositing stage */
    PROCESSED,

    /** Stripe drawn into the destination raster */
    COMPOSITED,

    /** Cropping or processing failed; the whole call fails */
    FAILED,

    /** Abandoned because the call was already aborted */
    SKIPPED
}
