package fr.lapetina.pixelator.domain.model;

/**
 * One outer-axis stripe to process: its index in the outer partition,
 * its pixel extent and its pixel offset along the outer axis.
 * Created once per call and consumed exactly once.
 */
public record StripeTask(int index, int outerSize, int outerOffset) {

    public StripeTask {
        if (index < 0) {
            throw new IllegalArgumentException("Stripe index must be non-negative: " + index);
        }
        if (outerSize <= 0) {
            throw new IllegalArgumentException("Stripe size must be positive: " + outerSize);
        }
        if (outerOffset < 0) {
            throw new IllegalArgumentException("Stripe offset must be non-negative: " + outerOffset);
        }
    }
}
