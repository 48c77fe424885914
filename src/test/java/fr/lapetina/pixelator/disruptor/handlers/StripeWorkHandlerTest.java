package fr.lapetina.pixelator.disruptor.handlers;

import fr.lapetina.pixelator.TestImages;
import fr.lapetina.pixelator.disruptor.PixelationCall;
import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.event.EventState;
import fr.lapetina.pixelator.domain.event.StripeEvent;
import fr.lapetina.pixelator.domain.grid.Partitioner;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import fr.lapetina.pixelator.domain.model.PixelSource;
import fr.lapetina.pixelator.processing.StripeProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StripeWorkHandlerTest {

    private GridLayout layout;
    private StripeEvent event;

    @BeforeEach
    void setUp() {
        layout = Partitioner.plan(9, 6, 3, 2);
        event = new StripeEvent();
        event.initialize(layout.stripeTasks().get(1), 1);
    }

    @Test
    @DisplayName("should crop, paint and leave the stripe on the event")
    void shouldProcessStripe() {
        PixelationCall call = new PixelationCall("call-1", TestImages.gradient(9, 6), layout, false);
        StripeWorkHandler handler = new StripeWorkHandler(call, new StripeProcessor());

        handler.onEvent(event);

        assertThat(event.getState()).isEqualTo(EventState.PROCESSED);
        assertThat(event.getResult()).isNotNull();
        assertThat(event.getResult().width()).isEqualTo(3);
        assertThat(event.getResult().height()).isEqualTo(6);
        assertThat(event.getExecutorName()).isEqualTo(Thread.currentThread().getName());
        assertThat(call.isAborted()).isFalse();
    }

    @Test
    @DisplayName("should skip stripes of an aborted call")
    void shouldSkipAbortedCall() {
        PixelationCall call = new PixelationCall("call-2", TestImages.gradient(9, 6), layout, false);
        call.abort(PixelationException.disposed());
        StripeWorkHandler handler = new StripeWorkHandler(call, new StripeProcessor());

        handler.onEvent(event);

        assertThat(event.getState()).isEqualTo(EventState.SKIPPED);
        assertThat(event.getStartedAt()).isNull();
    }

    @Test
    @DisplayName("should mark the event failed and abort the call on crop errors")
    void shouldAbortOnCropError() {
        PixelSource source = new PixelSource() {
            @Override
            public int width() {
                return 9;
            }

            @Override
            public int height() {
                return 6;
            }

            @Override
            public PixelBuffer crop(int x, int y, int width, int height) {
                throw new IllegalArgumentException("no pixels");
            }
        };
        PixelationCall call = new PixelationCall("call-3", source, layout, false);
        StripeWorkHandler handler = new StripeWorkHandler(call, new StripeProcessor());

        handler.onEvent(event);

        assertThat(event.getState()).isEqualTo(EventState.FAILED);
        assertThat(event.getErrorType()).isEqualTo(ErrorType.CROP_FAILURE);
        assertThat(call.getFailure().getErrorType()).isEqualTo(ErrorType.CROP_FAILURE);
        assertThat(call.completion()).isCompletedExceptionally();
    }
}
