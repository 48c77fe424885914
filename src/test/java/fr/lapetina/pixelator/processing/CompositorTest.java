package fr.lapetina.pixelator.processing;

import fr.lapetina.pixelator.TestImages;
import fr.lapetina.pixelator.domain.grid.Partitioner;
import fr.lapetina.pixelator.domain.model.AveragedColor;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.domain.model.StripeTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompositorTest {

    private GridLayout layout;
    private Compositor compositor;

    @BeforeEach
    void setUp() {
        // 11x4, 3 columns [4, 4, 3], 1 row
        layout = Partitioner.plan(11, 4, 3, 1);
        compositor = new Compositor(new RasterCanvas(11, 4), layout);
    }

    private static RasterCanvas stripe(StripeTask task, int height, int shade) {
        RasterCanvas canvas = new RasterCanvas(task.outerSize(), height);
        canvas.fillRect(0, 0, task.outerSize(), height, AveragedColor.opaque(shade, shade, shade));
        return canvas;
    }

    @Test
    @DisplayName("should complete only when every stripe has landed, in any order")
    void shouldCompleteAfterAllStripes() {
        List<StripeTask> tasks = layout.stripeTasks();

        assertThat(compositor.land(tasks.get(2), stripe(tasks.get(2), 4, 30))).isFalse();
        assertThat(compositor.land(tasks.get(0), stripe(tasks.get(0), 4, 10))).isFalse();
        assertThat(compositor.landedCount()).isEqualTo(2);
        assertThat(compositor.land(tasks.get(1), stripe(tasks.get(1), 4, 20))).isTrue();

        RasterCanvas destination = compositor.destination();
        assertThat(destination.rgba(3, 0)).isEqualTo(TestImages.pack(10, 10, 10, 255));
        assertThat(destination.rgba(4, 3)).isEqualTo(TestImages.pack(20, 20, 20, 255));
        assertThat(destination.rgba(10, 3)).isEqualTo(TestImages.pack(30, 30, 30, 255));
    }

    @Test
    @DisplayName("should refuse a stripe that landed already")
    void shouldRefuseDuplicateStripe() {
        StripeTask task = layout.stripeTasks().get(0);
        compositor.land(task, stripe(task, 4, 1));

        assertThatThrownBy(() -> compositor.land(task, stripe(task, 4, 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already landed");
    }

    @Test
    @DisplayName("should refuse a stripe of the wrong size")
    void shouldRefuseWrongSize() {
        StripeTask task = layout.stripeTasks().get(2);

        assertThatThrownBy(() -> compositor.land(task, new RasterCanvas(4, 4)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(compositor.landedCount()).isZero();
    }

    @Test
    @DisplayName("should refuse a destination of the wrong size")
    void shouldRefuseWrongDestination() {
        assertThatThrownBy(() -> new Compositor(new RasterCanvas(10, 4), layout))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
