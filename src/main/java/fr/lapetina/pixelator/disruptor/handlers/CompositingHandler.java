package fr.lapetina.pixelator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.pixelator.disruptor.PixelationCall;
import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.event.EventState;
import fr.lapetina.pixelator.domain.event.StripeEvent;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.processing.Compositor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second stage: draws processed stripes into the destination raster.
 *
 * Runs on a single thread, which makes it the only writer of the destination.
 * Resolves the call once the last stripe has landed.
 */
public final class CompositingHandler implements EventHandler<StripeEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompositingHandler.class);

    private final PixelationCall call;
    private final Compositor compositor;

    public CompositingHandler(PixelationCall call, Compositor compositor) {
        this.call = call;
        this.compositor = compositor;
    }

    @Override
    public void onEvent(StripeEvent event, long sequence, boolean endOfBatch) {
        if (event.isAbandoned()) {
            // Failure was already reported by the executor
            return;
        }

        if (event.getState() != EventState.PROCESSED) {
            call.abort(new PixelationException(ErrorType.PROCESSING_FAILURE,
                    "Invalid state for compositing: " + event));
            return;
        }

        if (call.isAborted()) {
            log.debug("Dropping stripe of aborted call: pixelationId={}, stripe={}",
                    call.id(), event.getTask().index());
            event.markSkipped();
            return;
        }

        try {
            boolean complete = compositor.land(event.getTask(), event.getResult());
            event.markComposited();

            log.debug("Stripe composited: pixelationId={}, stripe={}, landed={}/{}",
                    call.id(), event.getTask().index(),
                    compositor.landedCount(), call.layout().stripeCount());

            if (complete) {
                call.complete(compositor.destination());
            }
        } catch (RuntimeException e) {
            event.markFailed(ErrorType.PROCESSING_FAILURE, e.getMessage());
            call.abort(new PixelationException(ErrorType.PROCESSING_FAILURE,
                    "Cannot composite stripe " + event.getTask().index() + ": " + e.getMessage(), e));
        }
    }
}
