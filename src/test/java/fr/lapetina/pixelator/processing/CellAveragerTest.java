package fr.lapetina.pixelator.processing;

import fr.lapetina.pixelator.TestImages;
import fr.lapetina.pixelator.domain.model.AveragedColor;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CellAveragerTest {

    private CellAverager averager;

    @BeforeEach
    void setUp() {
        averager = new CellAverager();
    }

    @Test
    @DisplayName("should return the color of a uniform region")
    void shouldReturnUniformColor() {
        PixelBuffer region = TestImages.solid(4, 3, 12, 34, 56, 78);

        assertThat(averager.average(region, false)).isEqualTo(new AveragedColor(12, 34, 56, 78));
    }

    @Test
    @DisplayName("should floor per-channel means")
    void shouldFloorMeans() {
        // Two pixels: (0,0,0,0) and (255,1,3,254)
        PixelBuffer region = PixelBuffer.of(2, 1, new byte[]{
                0, 0, 0, 0,
                (byte) 255, 1, 3, (byte) 254
        });

        assertThat(averager.average(region, false)).isEqualTo(new AveragedColor(127, 0, 1, 127));
    }

    @Test
    @DisplayName("should average alpha like any other channel")
    void shouldAverageAlpha() {
        PixelBuffer region = PixelBuffer.of(1, 2, new byte[]{
                100, 100, 100, (byte) 255,
                100, 100, 100, 0
        });

        assertThat(averager.average(region, false).a()).isEqualTo(127);
    }

    @Test
    @DisplayName("should collapse to luma in grayscale mode and keep alpha")
    void shouldCollapseToLuma() {
        PixelBuffer red = TestImages.solid(2, 2, 255, 0, 0, 200);

        AveragedColor gray = averager.average(red, true);

        // floor(0.299 * 255) = 76
        assertThat(gray).isEqualTo(new AveragedColor(76, 76, 76, 200));
        assertThat(gray.isGray()).isTrue();
    }

    @Test
    @DisplayName("should leave gray cells unchanged in grayscale mode")
    void shouldKeepGrayLevels() {
        assertThat(averager.average(TestImages.solid(2, 2, 128, 128, 128, 255), true))
                .isEqualTo(AveragedColor.opaque(128, 128, 128));

        for (int level = 0; level <= 255; level++) {
            AveragedColor gray = averager.average(TestImages.solid(1, 1, level, level, level, 255), true);
            assertThat(gray.r()).as("gray level %d", level).isEqualTo(level);
        }
    }

    @Test
    @DisplayName("should compute luma from the averaged color")
    void shouldComputeLumaAfterAveraging() {
        PixelBuffer region = PixelBuffer.of(2, 1, new byte[]{
                0, 0, (byte) 200, (byte) 255,
                0, (byte) 100, 0, (byte) 255
        });

        // mean (0, 50, 100) -> floor(0.587 * 50 + 0.114 * 100) = floor(40.75) = 40
        assertThat(averager.average(region, true)).isEqualTo(new AveragedColor(40, 40, 40, 255));
    }

    @Test
    @DisplayName("should average a cropped view without reading outside it")
    void shouldAverageCroppedView() {
        PixelBuffer image = TestImages.solid(6, 6, 0, 0, 0, 255);
        PixelBuffer patch = TestImages.solid(2, 2, 90, 90, 90, 255);
        RasterCanvas canvas = new RasterCanvas(6, 6);
        canvas.blit(image, 0, 0);
        canvas.blit(patch, 2, 2);

        PixelBuffer cell = canvas.snapshot().crop(2, 2, 2, 2);

        assertThat(averager.average(cell, false)).isEqualTo(AveragedColor.opaque(90, 90, 90));
    }
}
