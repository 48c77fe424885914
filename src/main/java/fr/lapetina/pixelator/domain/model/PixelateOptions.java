package fr.lapetina.pixelator.domain.model;

import java.util.OptionalInt;

/**
 * Per-call options.
 *
 * @param grayscale        collapse every cell color to its luma
 * @param concurrencyLimit maximum number of executors, or {@code null} for the configured default
 */
public record PixelateOptions(boolean grayscale, Integer concurrencyLimit) {

    private static final PixelateOptions DEFAULTS = new PixelateOptions(false, null);

    public PixelateOptions {
        if (concurrencyLimit != null && concurrencyLimit <= 0) {
            throw new IllegalArgumentException("Concurrency limit must be positive: " + concurrencyLimit);
        }
    }

    public static PixelateOptions defaults() {
        return DEFAULTS;
    }

    public static PixelateOptions grayscaleOnly() {
        return new PixelateOptions(true, null);
    }

    public PixelateOptions withGrayscale(boolean value) {
        return new PixelateOptions(value, concurrencyLimit);
    }

    public PixelateOptions withConcurrencyLimit(int limit) {
        return new PixelateOptions(grayscale, limit);
    }

    public OptionalInt concurrencyLimitOverride() {
        return concurrencyLimit == null ? OptionalInt.empty() : OptionalInt.of(concurrencyLimit);
    }
}
