package fr.lapetina.pixelator.disruptor.handlers;

import com.lmax.disruptor.WorkHandler;
import fr.lapetina.pixelator.disruptor.PixelationCall;
import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.event.StripeEvent;
import fr.lapetina.pixelator.domain.model.ErrorType;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.PixelBuffer;
import fr.lapetina.pixelator.domain.model.RasterCanvas;
import fr.lapetina.pixelator.domain.model.Region;
import fr.lapetina.pixelator.domain.model.StripeTask;
import fr.lapetina.pixelator.processing.StripeProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * First stage: one executor of the worker pool.
 *
 * Each instance runs on its own thread and claims the next unclaimed stripe
 * as soon as it is done with the previous one, so executors are reused for
 * the whole call. A stripe is cropped from the source and handed to the
 * {@link StripeProcessor}; the painted stripe is left on the event for the
 * compositing stage. Executors never touch the destination raster.
 *
 * The first failure aborts the call right away; stripes claimed after that
 * are skipped without being cropped.
 */
public final class StripeWorkHandler implements WorkHandler<StripeEvent> {

    private static final Logger log = LoggerFactory.getLogger(StripeWorkHandler.class);

    private final PixelationCall call;
    private final StripeProcessor processor;

    public StripeWorkHandler(PixelationCall call, StripeProcessor processor) {
        this.call = call;
        this.processor = processor;
    }

    @Override
    public void onEvent(StripeEvent event) {
        StripeTask task = event.getTask();

        if (call.isAborted()) {
            event.markSkipped();
            log.debug("Skipping stripe of aborted call: pixelationId={}, stripe={}", call.id(), task.index());
            return;
        }

        MDC.put("pixelationId", call.id());
        MDC.put("stripeOffset", String.valueOf(task.outerOffset()));
        try {
            event.markCropping(Thread.currentThread().getName());
            PixelBuffer stripe = crop(call.layout(), task);

            event.markProcessing();
            RasterCanvas painted = processor.process(
                    stripe,
                    call.layout().inner(),
                    call.layout().orientation(),
                    call.grayscale()
            );
            event.markProcessed(painted);

            log.debug("Stripe processed: pixelationId={}, stripe={}, size={}, offset={}",
                    call.id(), task.index(), task.outerSize(), task.outerOffset());

        } catch (PixelationException e) {
            fail(event, e);
        } catch (RuntimeException e) {
            fail(event, new PixelationException(ErrorType.PROCESSING_FAILURE,
                    "Stripe " + task.index() + " failed: " + e.getMessage(), e));
        } finally {
            MDC.remove("pixelationId");
            MDC.remove("stripeOffset");
        }
    }

    private PixelBuffer crop(GridLayout layout, StripeTask task) {
        Region region = layout.stripeRegion(task);
        try {
            return call.source().crop(region);
        } catch (RuntimeException e) {
            throw new PixelationException(ErrorType.CROP_FAILURE,
                    "Cannot crop stripe " + task.index() + " at " + region + ": " + e.getMessage(), e);
        }
    }

    private void fail(StripeEvent event, PixelationException e) {
        event.markFailed(e.getErrorType(), e.getMessage());
        if (call.abort(e)) {
            log.error("Stripe failed, aborting call: pixelationId={}, stripe={}, errorType={}",
                    call.id(), event.getTask().index(), e.getErrorType(), e);
        } else {
            log.warn("Stripe failed after call was aborted: pixelationId={}, stripe={}, error={}",
                    call.id(), event.getTask().index(), e.getMessage());
        }
    }
}
