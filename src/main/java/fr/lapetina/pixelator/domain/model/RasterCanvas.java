package fr.lapetina.pixelator.domain.model;

import java.util.Arrays;

/**
 * Mutable RGBA raster with the two drawing primitives the pipeline needs:
 * filling a solid rectangle and blitting another raster at an offset.
 *
 * Not thread-safe. A stripe canvas belongs to the executor painting it; the
 * destination canvas is written by the compositing stage only.
 */
public final class RasterCanvas {

    private final int width;
    private final int height;
    private final byte[] data;

    public RasterCanvas(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive: " + width + "x" + height);
        }
        long size = (long) width * height * PixelBuffer.BYTES_PER_PIXEL;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Canvas " + width + "x" + height + " needs " + size
                    + " bytes, more than an array can hold");
        }
        this.width = width;
        this.height = height;
        this.data = new byte[(int) size];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public void fillRect(int x, int y, int rectWidth, int rectHeight, AveragedColor color) {
        checkBounds(new Region(x, y, rectWidth, rectHeight));
        int rowBytes = rectWidth * PixelBuffer.BYTES_PER_PIXEL;
        int stride = width * PixelBuffer.BYTES_PER_PIXEL;
        int first = (y * width + x) * PixelBuffer.BYTES_PER_PIXEL;

        // Paint the first row, then replicate it
        for (int i = first; i < first + rowBytes; i += PixelBuffer.BYTES_PER_PIXEL) {
            data[i] = (byte) color.r();
            data[i + 1] = (byte) color.g();
            data[i + 2] = (byte) color.b();
            data[i + 3] = (byte) color.a();
        }
        for (int row = 1; row < rectHeight; row++) {
            System.arraycopy(data, first, data, first + row * stride, rowBytes);
        }
    }

    public void fillRect(Region region, AveragedColor color) {
        fillRect(region.x(), region.y(), region.width(), region.height(), color);
    }

    public void blit(PixelBuffer source, int dx, int dy) {
        checkBounds(new Region(dx, dy, source.width(), source.height()));
        int stride = width * PixelBuffer.BYTES_PER_PIXEL;
        int first = (dy * width + dx) * PixelBuffer.BYTES_PER_PIXEL;
        for (int row = 0; row < source.height(); row++) {
            source.copyRow(row, data, first + row * stride);
        }
    }

    public void blit(RasterCanvas source, int dx, int dy) {
        blit(source.view(), dx, dy);
    }

    /**
     * Returns one pixel packed as {@code 0xRRGGBBAA}.
     */
    public int rgba(int x, int y) {
        return view().rgba(x, y);
    }

    /**
     * Copies the current contents into an immutable buffer.
     */
    public PixelBuffer snapshot() {
        return PixelBuffer.adopt(width, height, Arrays.copyOf(data, data.length));
    }

    /**
     * Live read-only view; only valid while nobody paints the canvas.
     */
    PixelBuffer view() {
        return PixelBuffer.adopt(width, height, data);
    }

    private void checkBounds(Region region) {
        if (!region.fitsWithin(width, height)) {
            throw new IllegalArgumentException("Region " + region + " exceeds canvas " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return "RasterCanvas{" + width + "x" + height + '}';
    }
}
