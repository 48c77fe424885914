package fr.lapetina.pixelator.processing;

import fr.lapetina.pixelator.domain.model.AveragedColor;
import fr.lapetina.pixelator.domain.model.PixelBuffer;

/**
 * Reduces a cell to one color: the unweighted per-channel mean of its pixels,
 * floored to an integer. Cell boundaries are whole pixels, so no area
 * weighting is involved.
 *
 * Stateless and safe to share between executors.
 */
public final class CellAverager {

    /**
     * @param region    pixels of one cell, at least one pixel
     * @param grayscale replace R, G and B with the luma of the averaged color
     */
    public AveragedColor average(PixelBuffer region, boolean grayscale) {
        long[] sums = new long[4];
        for (int y = 0; y < region.height(); y++) {
            region.accumulateRow(y, sums);
        }
        long count = region.pixelCount();

        AveragedColor mean = new AveragedColor(
                (int) (sums[0] / count),
                (int) (sums[1] / count),
                (int) (sums[2] / count),
                (int) (sums[3] / count)
        );
        return grayscale ? mean.toLuma() : mean;
    }
}
