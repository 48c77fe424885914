package fr.lapetina.pixelator.domain.grid;

import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.model.ErrorType;

import java.math.BigDecimal;

/**
 * Synchronous checks run before anything is dispatched.
 */
public final class GridValidator {

    private GridValidator() {
    }

    /**
     * @throws PixelationException {@code INVALID_DIMENSION} for non-positive cell counts,
     *                             {@code DIMENSION_EXCEEDS_SOURCE} when a count exceeds the image extent
     */
    public static void validate(int width, int height, int xCells, int yCells) {
        requirePositive(xCells, "x");
        requirePositive(yCells, "y");
        if (xCells > width || yCells > height) {
            throw new PixelationException(ErrorType.DIMENSION_EXCEEDS_SOURCE,
                    "Requested " + xCells + "x" + yCells + " cells exceed image dimensions "
                            + width + "x" + height);
        }
    }

    /**
     * Converts an untyped cell count to an int, rejecting fractions and non-numbers.
     */
    public static int toCellCount(Number value, String axis) {
        if (value == null) {
            throw PixelationException.invalidDimension("Cell count for " + axis + " is required");
        }
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            throw PixelationException.invalidDimension("Cell count for " + axis + " is not a number: " + value);
        }
        return toCellCount(decimal, axis);
    }

    public static int toCellCount(String value, String axis) {
        if (value == null || value.isBlank()) {
            throw PixelationException.invalidDimension("Cell count for " + axis + " is required");
        }
        try {
            return toCellCount(new BigDecimal(value.trim()), axis);
        } catch (NumberFormatException e) {
            throw PixelationException.invalidDimension("Cell count for " + axis + " is not a number: " + value);
        }
    }

    private static int toCellCount(BigDecimal decimal, String axis) {
        BigDecimal normalized = decimal.stripTrailingZeros();
        if (normalized.scale() > 0) {
            throw PixelationException.invalidDimension(
                    "Cell count for " + axis + " must be a whole number: " + decimal.toPlainString());
        }
        if (normalized.signum() <= 0) {
            throw PixelationException.invalidDimension(
                    "Cell count for " + axis + " must be positive: " + decimal.toPlainString());
        }
        try {
            return normalized.intValueExact();
        } catch (ArithmeticException e) {
            throw PixelationException.invalidDimension(
                    "Cell count for " + axis + " is too large: " + decimal.toPlainString());
        }
    }

    private static void requirePositive(int cells, String axis) {
        if (cells <= 0) {
            throw PixelationException.invalidDimension("Cell count for " + axis + " must be positive: " + cells);
        }
    }
}
