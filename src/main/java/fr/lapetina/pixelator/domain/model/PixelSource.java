package fr.lapetina.pixelator.domain.model;

/**
 * Read-only access to a rectangular image, cropped on demand.
 *
 * Implementations must be safe to crop from several executor threads at once.
 */
public interface PixelSource {

    int width();

    int height();

    /**
     * Returns the pixels of the given region.
     *
     * @throws IllegalArgumentException if the region is empty or not fully inside the source
     */
    PixelBuffer crop(int x, int y, int width, int height);

    default PixelBuffer crop(Region region) {
        return crop(region.x(), region.y(), region.width(), region.height());
    }
}
