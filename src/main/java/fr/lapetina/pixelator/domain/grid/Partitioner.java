package fr.lapetina.pixelator.domain.grid;

import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.Orientation;
import fr.lapetina.pixelator.domain.model.PartitionSequence;

import java.util.Arrays;

/**
 * Splits an axis into cell extents that sum exactly to the axis dimension.
 *
 * <p>Every entry is {@code dimension / count} or one more. The {@code remainder}
 * larger entries are spread across the axis (the i-th goes to index
 * {@code i * count / remainder}) instead of piling up at one end, which would
 * show as a band of wider cells.
 */
public final class Partitioner {

    private Partitioner() {
    }

    /**
     * @throws PixelationException with {@code INVALID_DIMENSION} when {@code count <= 0},
     *                             {@code dimension <= 0} or {@code count > dimension}
     */
    public static PartitionSequence partition(int dimension, int count) {
        if (dimension <= 0) {
            throw PixelationException.invalidDimension("Dimension must be positive: " + dimension);
        }
        if (count <= 0) {
            throw PixelationException.invalidDimension("Cell count must be positive: " + count);
        }
        if (count > dimension) {
            throw PixelationException.invalidDimension(
                    "Cell count " + count + " exceeds dimension " + dimension);
        }

        int base = dimension / count;
        int remainder = dimension % count;

        int[] extents = new int[count];
        Arrays.fill(extents, base);
        for (int i = 0; i < remainder; i++) {
            extents[(int) ((long) i * count / remainder)]++;
        }
        return new PartitionSequence(extents);
    }

    /**
     * Validates the request against the image size and computes the frozen grid for one call.
     */
    public static GridLayout plan(int width, int height, int xCells, int yCells) {
        GridValidator.validate(width, height, xCells, yCells);
        return new GridLayout(
                width,
                height,
                partition(width, xCells),
                partition(height, yCells),
                Orientation.forGrid(xCells, yCells)
        );
    }
}
