package fr.lapetina.pixelator.processing;

import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.domain.model.Region;
import fr.lapetina.pixelator.domain.model.StripeTask;

import java.util.BitSet;
import java.util.Objects;

/**
 * Draws finished stripes into the destination raster and counts them.
 *
 * Stripes are disjoint, so the order they land in does not change the final
 * raster. Not thread-safe: a single compositing thread owns an instance.
 */
public final class Compositor {

    private final RasterCanvas destination;
    private final GridLayout layout;
    private final BitSet landed;
    private int landedCount;

    public Compositor(RasterCanvas destination, GridLayout layout) {
        this.destination = Objects.requireNonNull(destination, "Destination is required");
        this.layout = Objects.requireNonNull(layout, "Layout is required");
        if (destination.width() != layout.width() || destination.height() != layout.height()) {
            throw new IllegalArgumentException("Destination " + destination + " does not match "
                    + layout.width() + "x" + layout.height());
        }
        this.landed = new BitSet(layout.stripeCount());
    }

    /**
     * Draws a stripe at its precomputed offset.
     *
     * @return true if this was the last missing stripe
     */
    public boolean land(StripeTask task, RasterCanvas stripe) {
        Region region = layout.stripeRegion(task);
        if (stripe.width() != region.width() || stripe.height() != region.height()) {
            throw new IllegalArgumentException("Stripe " + stripe + " does not match region " + region);
        }
        if (landed.get(task.index())) {
            throw new IllegalStateException("Stripe " + task.index() + " already landed");
        }
        destination.blit(stripe, region.x(), region.y());
        landed.set(task.index());
        landedCount++;
        return isComplete();
    }

    public boolean isComplete() {
        return landedCount == layout.stripeCount();
    }

    public int landedCount() {
        return landedCount;
    }

    public RasterCanvas destination() {
        return destination;
    }
}
