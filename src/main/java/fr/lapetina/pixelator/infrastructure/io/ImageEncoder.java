package fr.lapetina.pixelator.infrastructure.io;

import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.PixelBuffer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Base64;

/**
 * Encodes RGBA pixel buffers for callers outside the pipeline.
 */
public final class ImageEncoder {

    public static final String PNG_DATA_URL_PREFIX = "data:image/png;base64,";

    private ImageEncoder() {
    }

    public static BufferedImage toBufferedImage(PixelBuffer pixels) {
        int width = pixels.width();
        int height = pixels.height();
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] argb = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgba = pixels.rgba(x, y);
                argb[y * width + x] = (rgba >>> 8) | (rgba << 24);
            }
        }
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    public static byte[] toPng(PixelBuffer pixels) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writePng(pixels, out);
        return out.toByteArray();
    }

    public static void writePng(PixelBuffer pixels, OutputStream out) {
        try {
            if (!ImageIO.write(toBufferedImage(pixels), "png", out)) {
                throw new PixelationException(ErrorType.ENCODING_FAILURE, "No PNG writer available");
            }
        } catch (IOException e) {
            throw new PixelationException(ErrorType.ENCODING_FAILURE, "Failed to encode PNG: " + e.getMessage(), e);
        }
    }

    public static String toDataUrl(PixelBuffer pixels) {
        return PNG_DATA_URL_PREFIX + Base64.getEncoder().encodeToString(toPng(pixels));
    }
}
