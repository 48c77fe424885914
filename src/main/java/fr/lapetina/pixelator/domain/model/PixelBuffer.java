package fr.lapetina.pixelator.domain.model;

import java.util.Objects;

/**
 * Read-only RGBA pixel region, row-major, 4 bytes per pixel.
 *
 * Crops are views sharing the backing array, so handing a crop to another
 * thread copies nothing. The backing array is never written after
 * construction, which makes a buffer safe to share across executors.
 */
public final class PixelBuffer implements PixelSource {

    public static final int BYTES_PER_PIXEL = 4;

    private final byte[] data;
    private final int offset;
    private final int scanlineStride;
    private final int width;
    private final int height;

    private PixelBuffer(byte[] data, int offset, int scanlineStride, int width, int height) {
        this.data = data;
        this.offset = offset;
        this.scanlineStride = scanlineStride;
        this.width = width;
        this.height = height;
    }

    /**
     * Creates a buffer from a copy of the given RGBA bytes.
     */
    public static PixelBuffer of(int width, int height, byte[] rgba) {
        Objects.requireNonNull(rgba, "Pixel data is required");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + width + "x" + height);
        }
        long expected = (long) width * height * BYTES_PER_PIXEL;
        if (rgba.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " bytes for " + width + "x" + height + ", got " + rgba.length);
        }
        return new PixelBuffer(rgba.clone(), 0, width * BYTES_PER_PIXEL, width, height);
    }

    /**
     * Wraps an array the caller gives up ownership of.
     */
    static PixelBuffer adopt(int width, int height, byte[] rgba) {
        return new PixelBuffer(rgba, 0, width * BYTES_PER_PIXEL, width, height);
    }

    /**
     * Creates a buffer where every pixel has the same color.
     */
    public static PixelBuffer filled(int width, int height, AveragedColor color) {
        RasterCanvas canvas = new RasterCanvas(width, height);
        canvas.fillRect(0, 0, width, height, color);
        return canvas.snapshot();
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    /**
     * Returns one channel (0=R, 1=G, 2=B, 3=A) of a pixel as an unsigned value.
     */
    public int channel(int x, int y, int channel) {
        checkPixel(x, y);
        return data[indexOf(x, y) + channel] & 0xFF;
    }

    /**
     * Returns a pixel packed as {@code 0xRRGGBBAA}.
     */
    public int rgba(int x, int y) {
        checkPixel(x, y);
        int i = indexOf(x, y);
        return (data[i] & 0xFF) << 24
                | (data[i + 1] & 0xFF) << 16
                | (data[i + 2] & 0xFF) << 8
                | (data[i + 3] & 0xFF);
    }

    /**
     * Adds the channels of one row into {@code sums} (R, G, B, A).
     * Kept here so averaging can walk the backing array without per-pixel bounds checks.
     */
    public void accumulateRow(int y, long[] sums) {
        if (y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Row " + y + " outside 0.." + (height - 1));
        }
        int i = offset + y * scanlineStride;
        int end = i + width * BYTES_PER_PIXEL;
        long r = 0, g = 0, b = 0, a = 0;
        while (i < end) {
            r += data[i] & 0xFF;
            g += data[i + 1] & 0xFF;
            b += data[i + 2] & 0xFF;
            a += data[i + 3] & 0xFF;
            i += BYTES_PER_PIXEL;
        }
        sums[0] += r;
        sums[1] += g;
        sums[2] += b;
        sums[3] += a;
    }

    @Override
    public PixelBuffer crop(int x, int y, int cropWidth, int cropHeight) {
        Region region = new Region(x, y, cropWidth, cropHeight);
        if (!region.fitsWithin(width, height)) {
            throw new IllegalArgumentException("Crop " + region + " exceeds buffer " + width + "x" + height);
        }
        return new PixelBuffer(data, indexOf(x, y), scanlineStride, cropWidth, cropHeight);
    }

    /**
     * Copies row {@code y} into {@code dest} starting at {@code destPos}.
     */
    void copyRow(int y, byte[] dest, int destPos) {
        System.arraycopy(data, offset + y * scanlineStride, dest, destPos, width * BYTES_PER_PIXEL);
    }

    /**
     * Returns a compact copy of the pixels, row-major RGBA.
     */
    public byte[] toByteArray() {
        int rowBytes = width * BYTES_PER_PIXEL;
        byte[] out = new byte[rowBytes * height];
        for (int y = 0; y < height; y++) {
            copyRow(y, out, y * rowBytes);
        }
        return out;
    }

    private int indexOf(int x, int y) {
        return offset + y * scanlineStride + x * BYTES_PER_PIXEL;
    }

    private void checkPixel(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("Pixel " + x + "," + y + " outside " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + width + "x" + height + '}';
    }
}
