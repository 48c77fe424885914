package fr.lapetina.pixelator.infrastructure.io;

import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Objects;

/**
 * Decodes images from the usual places into RGBA {@link PixelBuffer}s.
 *
 * Every failure to obtain or decode pixels surfaces as
 * {@link ErrorType#SOURCE_UNAVAILABLE}.
 */
public final class ImageSources {

    private static final Logger log = LoggerFactory.getLogger(ImageSources.class);

    private static final String DATA_URL_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    private ImageSources() {
    }

    public static PixelBuffer fromPath(Path path) {
        Objects.requireNonNull(path, "Path is required");
        if (!Files.isReadable(path)) {
            throw unavailable("Image file not readable: " + path, null);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return decode(in, path.toString());
        } catch (IOException e) {
            throw unavailable("Failed to read image file " + path + ": " + e.getMessage(), e);
        }
    }

    public static PixelBuffer fromUri(URI uri) {
        Objects.requireNonNull(uri, "URI is required");
        if ("data".equalsIgnoreCase(uri.getScheme())) {
            return fromDataUrl(uri.toString());
        }
        try (InputStream in = uri.toURL().openStream()) {
            return decode(in, uri.toString());
        } catch (IOException | IllegalArgumentException e) {
            throw unavailable("Failed to fetch image " + uri + ": " + e.getMessage(), e);
        }
    }

    public static PixelBuffer fromBytes(byte[] encoded) {
        Objects.requireNonNull(encoded, "Image bytes are required");
        try (InputStream in = new ByteArrayInputStream(encoded)) {
            return decode(in, encoded.length + " bytes");
        } catch (IOException e) {
            throw unavailable("Failed to decode image bytes: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a base64 {@code data:} URL such as {@code data:image/png;base64,iVBOR...}.
     */
    public static PixelBuffer fromDataUrl(String dataUrl) {
        Objects.requireNonNull(dataUrl, "Data URL is required");
        if (!dataUrl.regionMatches(true, 0, DATA_URL_PREFIX, 0, DATA_URL_PREFIX.length())) {
            throw unavailable("Not a data URL", null);
        }
        int marker = dataUrl.indexOf(BASE64_MARKER);
        if (marker < 0) {
            throw unavailable("Only base64 data URLs are supported", null);
        }
        byte[] encoded;
        try {
            encoded = Base64.getDecoder().decode(dataUrl.substring(marker + BASE64_MARKER.length()));
        } catch (IllegalArgumentException e) {
            throw unavailable("Malformed base64 payload in data URL", e);
        }
        return fromBytes(encoded);
    }

    /**
     * Converts an already decoded image to straight (non-premultiplied) RGBA.
     */
    public static PixelBuffer fromBufferedImage(BufferedImage image) {
        Objects.requireNonNull(image, "Image is required");
        int width = image.getWidth();
        int height = image.getHeight();
        if (width <= 0 || height <= 0) {
            throw unavailable("Image has no pixels: " + width + "x" + height, null);
        }

        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] rgba = new byte[argb.length * PixelBuffer.BYTES_PER_PIXEL];
        for (int i = 0, j = 0; i < argb.length; i++, j += PixelBuffer.BYTES_PER_PIXEL) {
            int p = argb[i];
            rgba[j] = (byte) (p >> 16);
            rgba[j + 1] = (byte) (p >> 8);
            rgba[j + 2] = (byte) p;
            rgba[j + 3] = (byte) (p >>> 24);
        }
        return PixelBuffer.of(width, height, rgba);
    }

    private static PixelBuffer decode(InputStream in, String origin) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw unavailable("No image decoder recognized " + origin, null);
        }
        log.debug("Decoded image: origin={}, size={}x{}", origin, image.getWidth(), image.getHeight());
        return fromBufferedImage(image);
    }

    private static PixelationException unavailable(String message, Throwable cause) {
        return new PixelationException(ErrorType.SOURCE_UNAVAILABLE, message, cause);
    }
}
