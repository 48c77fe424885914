package fr.lapetina.pixelator;

import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.Orientation;
import fr.lapetina.pixelator.domain.model.PartitionSequence;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import fr.lapetina.pixelator.domain.model.PixelateOptions;
import fr.lapetina.pixelator.domain.model.PixelatedImage;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.infrastructure.config.ConfigLoader;
import fr.lapetina.pixelator.infrastructure.config.PixelatorConfig;
import fr.lapetina.pixelator.processing.StripeProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PixelatorTest {

    private Pixelator pixelator;

    @AfterEach
    void tearDown() {
        if (pixelator != null) {
            pixelator.close();
        }
    }

    private static ErrorType errorTypeOf(Throwable t) {
        return ((PixelationException) t).getErrorType();
    }

    @Nested
    @DisplayName("pixelate")
    class PixelateTests {

        @Test
        @DisplayName("should split a 10x10 red image into four 5x5 red cells")
        void shouldPixelateSolidImage() throws Exception {
            pixelator = Pixelator.fromImage(TestImages.solid(10, 10, 255, 0, 0, 255));

            PixelatedImage image = pixelator.pixelate(2, 2).get(10, TimeUnit.SECONDS);

            assertThat(image.width()).isEqualTo(10);
            assertThat(image.height()).isEqualTo(10);
            assertThat(image.layout().columns().toArray()).containsExactly(5, 5);
            assertThat(image.layout().rows().toArray()).containsExactly(5, 5);
            for (int y = 0; y < 10; y++) {
                for (int x = 0; x < 10; x++) {
                    assertThat(image.rgba(x, y)).isEqualTo(TestImages.pack(255, 0, 0, 255));
                }
            }
        }

        @Test
        @DisplayName("should always read the original source, not the previous result")
        void shouldNotBeCumulative() {
            PixelBuffer source = TestImages.gradient(12, 9);
            pixelator = Pixelator.fromImage(source);

            PixelatedImage coarse = pixelator.pixelateSync(3, 3);
            PixelatedImage fine = pixelator.pixelateSync(12, 9);

            assertThat(coarse.pixels().toByteArray()).isNotEqualTo(source.toByteArray());
            // One-pixel cells average to themselves
            assertThat(fine.pixels().toByteArray()).isEqualTo(source.toByteArray());
        }

        @Test
        @DisplayName("should give identical results for identical calls")
        void shouldBeIdempotent() {
            pixelator = Pixelator.fromImage(TestImages.gradient(25, 14));

            PixelatedImage first = pixelator.pixelateSync(4, 3);
            PixelatedImage second = pixelator.pixelateSync(4, 3);

            assertThat(second.pixels().toByteArray()).isEqualTo(first.pixels().toByteArray());
        }

        @Test
        @DisplayName("should not depend on the concurrency limit")
        void shouldMatchAcrossConcurrencyLimits() {
            pixelator = Pixelator.fromImage(TestImages.gradient(40, 21));

            PixelatedImage serial = pixelator.pixelateSync(8, 3, PixelateOptions.defaults().withConcurrencyLimit(1));
            PixelatedImage parallel = pixelator.pixelateSync(8, 3, PixelateOptions.defaults().withConcurrencyLimit(8));

            assertThat(serial.executors()).isEqualTo(1);
            assertThat(parallel.executors()).isEqualTo(8);
            assertThat(parallel.pixels().toByteArray()).isEqualTo(serial.pixels().toByteArray());
        }

        @Test
        @DisplayName("should paint gray cells in grayscale mode")
        void shouldPaintGrayCells() {
            pixelator = Pixelator.fromImage(TestImages.gradient(15, 15));

            PixelatedImage image = pixelator.pixelateSync(5, 3, PixelateOptions.grayscaleOnly());

            assertThat(image.grayscale()).isTrue();
            for (int y = 0; y < 15; y++) {
                for (int x = 0; x < 15; x++) {
                    int rgba = image.rgba(x, y);
                    int r = rgba >>> 24;
                    int g = (rgba >>> 16) & 0xFF;
                    int b = (rgba >>> 8) & 0xFF;
                    assertThat(g).isEqualTo(r);
                    assertThat(b).isEqualTo(r);
                }
            }
        }

        @Test
        @DisplayName("should cover every pixel when cells are staggered")
        void shouldCoverStaggeredGrid() {
            pixelator = Pixelator.fromImage(TestImages.solid(11, 7, 1, 2, 3, 4));

            PixelatedImage image = pixelator.pixelateSync(3, 2);

            assertThat(image.layout().orientation()).isEqualTo(Orientation.COLUMNS);
            PartitionSequence columns = image.layout().columns();
            assertThat(columns.toArray()).containsExactly(4, 4, 3);
            assertThat(image.pixels().toByteArray())
                    .isEqualTo(TestImages.solid(11, 7, 1, 2, 3, 4).toByteArray());
        }

        @Test
        @DisplayName("should validate before dispatching anything")
        void shouldValidateSynchronously() {
            pixelator = Pixelator.fromImage(TestImages.gradient(10, 10));

            assertThatThrownBy(() -> pixelator.pixelate(11, 2))
                    .satisfies(e -> assertThat(errorTypeOf(e)).isEqualTo(ErrorType.DIMENSION_EXCEEDS_SOURCE));
            assertThatThrownBy(() -> pixelator.pixelate(0, 2))
                    .satisfies(e -> assertThat(errorTypeOf(e)).isEqualTo(ErrorType.INVALID_DIMENSION));
            assertThatThrownBy(() -> PixelateOptions.defaults().withConcurrencyLimit(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should surface stripe failures through the future")
        void shouldFailFuture() {
            StripeProcessor failing = new StripeProcessor() {
                @Override
                public RasterCanvas process(PixelBuffer stripe, PartitionSequence inner,
                                            Orientation orientation, boolean grayscale) {
                    throw new IllegalStateException("broken stripe");
                }
            };
            pixelator = Pixelator.builder()
                    .source(TestImages.gradient(8, 8))
                    .stripeProcessor(failing)
                    .build();

            CompletableFuture<PixelatedImage> future = pixelator.pixelate(4, 4);

            assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOf(PixelationException.class)
                    .satisfies(e -> assertThat(errorTypeOf(e)).isEqualTo(ErrorType.PROCESSING_FAILURE));
            assertThatThrownBy(() -> pixelator.pixelateSync(4, 4))
                    .satisfies(e -> assertThat(errorTypeOf(e)).isEqualTo(ErrorType.PROCESSING_FAILURE));
        }
    }

    @Nested
    @DisplayName("results")
    class ResultTests {

        @Test
        @DisplayName("should refuse conversions before the first result")
        void shouldRefuseConversionsBeforeResult() {
            pixelator = Pixelator.fromImage(TestImages.gradient(4, 4));

            assertThatThrownBy(() -> pixelator.toPng())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("No pixelation result available");
        }

        @Test
        @DisplayName("should convert the latest result")
        void shouldConvertLatestResult() {
            pixelator = Pixelator.fromImage(TestImages.gradient(6, 6));
            pixelator.pixelateSync(2, 2);
            PixelatedImage latest = pixelator.pixelateSync(3, 3);

            RasterCanvas canvas = pixelator.toCanvas();
            BufferedImage image = pixelator.toBufferedImage();

            assertThat(canvas.snapshot().toByteArray()).isEqualTo(latest.pixels().toByteArray());
            assertThat(image.getWidth()).isEqualTo(6);
            assertThat(pixelator.toDataUrl()).startsWith("data:image/png;base64,");
            assertThat(pixelator.latestResult()).isSameAs(latest);
        }

        @Test
        @DisplayName("should paint results into an attached target canvas")
        void shouldPaintTarget() {
            RasterCanvas target = new RasterCanvas(4, 4);
            pixelator = Pixelator.builder().source(TestImages.solid(4, 4, 9, 8, 7, 255)).target(target).build();

            pixelator.pixelateSync(2, 2);

            assertThat(target.rgba(3, 3)).isEqualTo(TestImages.pack(9, 8, 7, 255));
            assertThat(pixelator.toCanvas()).isSameAs(target);
        }

        @Test
        @DisplayName("should reject a target canvas of another size")
        void shouldRejectMismatchedTarget() {
            assertThatThrownBy(() -> Pixelator.builder()
                    .source(TestImages.gradient(4, 4))
                    .target(new RasterCanvas(5, 4))
                    .build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should use the configured grayscale default")
        void shouldUseConfiguredGrayscale() {
            PixelatorConfig config = ConfigLoader.createDefault();
            config.getOutput().setGrayscale(true);
            pixelator = Pixelator.builder().source(TestImages.gradient(6, 6)).config(config).build();

            assertThat(pixelator.pixelateSync(2, 2).grayscale()).isTrue();
        }
    }

    @Nested
    @DisplayName("dispose")
    class DisposeTests {

        @Test
        @DisplayName("should fail every call made after dispose")
        void shouldFailAfterDispose() {
            pixelator = Pixelator.fromImage(TestImages.gradient(4, 4));
            pixelator.pixelateSync(2, 2);

            pixelator.close();

            assertThat(pixelator.isDisposed()).isTrue();
            assertThatThrownBy(() -> pixelator.pixelate(2, 2))
                    .isInstanceOf(PixelationException.class)
                    .hasMessageContaining("disposed")
                    .satisfies(e -> assertThat(errorTypeOf(e)).isEqualTo(ErrorType.DISPOSED));
            assertThatThrownBy(() -> pixelator.toPng()).hasMessageContaining("disposed");
            assertThatThrownBy(() -> pixelator.width()).hasMessageContaining("disposed");
            assertThatCode(() -> pixelator.close()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should abort running and queued calls")
        void shouldAbortInFlightCalls() throws Exception {
            CountDownLatch running = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            StripeProcessor stuck = new StripeProcessor() {
                @Override
                public RasterCanvas process(PixelBuffer stripe, PartitionSequence inner,
                                            Orientation orientation, boolean grayscale) {
                    running.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return super.process(stripe, inner, orientation, grayscale);
                }
            };
            PixelatorConfig config = ConfigLoader.createDefault();
            config.getTimeouts().setShutdownTimeoutMs(200);
            pixelator = Pixelator.builder()
                    .source(TestImages.gradient(8, 8))
                    .config(config)
                    .stripeProcessor(stuck)
                    .build();

            CompletableFuture<PixelatedImage> inFlight = pixelator.pixelate(2, 2);
            CompletableFuture<PixelatedImage> queued = pixelator.pixelate(4, 4);
            assertThat(running.await(10, TimeUnit.SECONDS)).isTrue();

            try {
                pixelator.close();
            } finally {
                release.countDown();
            }

            for (CompletableFuture<PixelatedImage> future : List.of(inFlight, queued)) {
                assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                        .isInstanceOf(ExecutionException.class)
                        .cause()
                        .satisfies(e -> assertThat(errorTypeOf(e)).isEqualTo(ErrorType.DISPOSED))
                        .hasMessageContaining("disposed");
            }
        }
    }
}
