package fr.lapetina.pixelator.infrastructure.io;

import fr.lapetina.pixelator.TestImages;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class ImageEncoderTest {

    @Test
    @DisplayName("should map RGBA to ARGB without premultiplying")
    void shouldBuildBufferedImage() {
        PixelBuffer pixels = TestImages.solid(2, 2, 0x11, 0x22, 0x33, 0x44);

        BufferedImage image = ImageEncoder.toBufferedImage(pixels);

        assertThat(image.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
        assertThat(image.getRGB(1, 1)).isEqualTo(0x44112233);
    }

    @Test
    @DisplayName("should produce PNG bytes")
    void shouldProducePng() {
        byte[] png = ImageEncoder.toPng(TestImages.gradient(3, 3));

        // PNG signature
        assertThat(png).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
    }

    @Test
    @DisplayName("should produce a PNG data URL")
    void shouldProduceDataUrl() {
        assertThat(ImageEncoder.toDataUrl(TestImages.gradient(2, 2)))
                .startsWith("data:image/png;base64,iVBOR");
    }
}
