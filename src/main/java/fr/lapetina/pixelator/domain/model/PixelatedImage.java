package fr.lapetina.pixelator.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a completed pixelation call.
 *
 * @param pixels    immutable snapshot of the destination raster
 * @param layout    grid the image was pixelated with
 * @param grayscale whether cell colors were collapsed to luma
 * @param executors number of executors that served the call
 * @param elapsed   wall-clock time from dispatch to the last landed stripe
 */
public record PixelatedImage(
        PixelBuffer pixels,
        GridLayout layout,
        boolean grayscale,
        int executors,
        Duration elapsed
) {
    public PixelatedImage {
        Objects.requireNonNull(pixels, "Pixels are required");
        Objects.requireNonNull(layout, "Layout is required");
        Objects.requireNonNull(elapsed, "Elapsed time is required");
    }

    public int width() {
        return pixels.width();
    }

    public int height() {
        return pixels.height();
    }

    public int rgba(int x, int y) {
        return pixels.rgba(x, y);
    }
}
