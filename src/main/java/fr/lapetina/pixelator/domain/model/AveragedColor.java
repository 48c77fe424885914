package fr.lapetina.pixelator.domain.model;

/**
 * Flat color of one cell, each channel in [0, 255].
 * Alpha uses the same 0-255 scale as the source pixels.
 */
public record AveragedColor(int r, int g, int b, int a) {

    public AveragedColor {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
        checkChannel("a", a);
    }

    public static AveragedColor opaque(int r, int g, int b) {
        return new AveragedColor(r, g, b, 255);
    }

    /**
     * Collapses R, G and B to their luma, keeping alpha.
     */
    public AveragedColor toLuma() {
        // floor(0.299r + 0.587g + 0.114b), exact in thousandths
        int luma = (299 * r + 587 * g + 114 * b) / 1000;
        return new AveragedColor(luma, luma, luma, a);
    }

    public boolean isGray() {
        return r == g && g == b;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Channel " + name + " out of range: " + value);
        }
    }
}
