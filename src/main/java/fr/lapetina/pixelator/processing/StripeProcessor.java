package fr.lapetina.pixelator.processing;

import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.model.AveragedColor;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.Orientation;
import fr.lapetina.pixelator.domain.model.PartitionSequence;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.domain.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns one cropped stripe into a flat-colored stripe of the same size.
 *
 * <p>Cells are visited in partition order. Each one is cropped from the
 * stripe, averaged and painted into a canvas owned by this invocation, so
 * concurrent invocations share nothing but the read-only source pixels.
 */
public class StripeProcessor {

    private static final Logger log = LoggerFactory.getLogger(StripeProcessor.class);

    private final CellAverager averager;

    public StripeProcessor() {
        this(new CellAverager());
    }

    public StripeProcessor(CellAverager averager) {
        this.averager = Objects.requireNonNull(averager, "CellAverager is required");
    }

    /**
     * @param stripe      pixels of the stripe, already cropped from the source
     * @param inner       partition of the stripe's long side
     * @param orientation orientation of the call; decides which side {@code inner} splits
     * @param grayscale   collapse cell colors to luma
     * @return a canvas with the stripe's dimensions
     * @throws PixelationException {@code CROP_FAILURE} if a cell cannot be cropped,
     *                             {@code PROCESSING_FAILURE} if the partition does not fit the stripe
     */
    public RasterCanvas process(
            PixelBuffer stripe,
            PartitionSequence inner,
            Orientation orientation,
            boolean grayscale
    ) {
        int stripeSize = orientation == Orientation.COLUMNS ? stripe.width() : stripe.height();
        int innerExtent = orientation == Orientation.COLUMNS ? stripe.height() : stripe.width();
        if (inner.dimension() != innerExtent) {
            throw new PixelationException(ErrorType.PROCESSING_FAILURE,
                    "Inner partition covers " + inner.dimension() + " pixels, stripe has " + innerExtent);
        }

        RasterCanvas output = new RasterCanvas(stripe.width(), stripe.height());
        for (int i = 0; i < inner.size(); i++) {
            Region cell = orientation.cellRegion(inner.offset(i), inner.get(i), stripeSize);
            PixelBuffer cellPixels = cropCell(stripe, cell);
            AveragedColor color = averager.average(cellPixels, grayscale);
            output.fillRect(cell, color);
        }

        log.trace("Stripe {} painted with {} cells", stripe, inner.size());
        return output;
    }

    protected PixelBuffer cropCell(PixelBuffer stripe, Region cell) {
        try {
            return stripe.crop(cell);
        } catch (RuntimeException e) {
            throw new PixelationException(ErrorType.CROP_FAILURE,
                    "Cannot crop cell " + cell + " from " + stripe, e);
        }
    }
}
