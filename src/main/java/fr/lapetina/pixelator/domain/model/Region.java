package fr.lapetina.pixelator.domain.model;

/**
 * Pixel-aligned rectangle, in the coordinates of whatever raster it refers to.
 */
public record Region(int x, int y, int width, int height) {

    public Region {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Region origin must be non-negative: " + x + "," + y);
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region must not be empty: " + width + "x" + height);
        }
    }

    public int area() {
        return width * height;
    }

    /**
     * Checks that this region lies inside a raster of the given size.
     */
    public boolean fitsWithin(int rasterWidth, int rasterHeight) {
        // Subtract instead of adding so huge extents cannot wrap around
        return width <= rasterWidth - x && height <= rasterHeight - y;
    }
}
