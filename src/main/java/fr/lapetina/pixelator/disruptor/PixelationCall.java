package fr.lapetina.pixelator.disruptor;

import fr.lapetina.pixelator.disruptor.exception.PixelationException;
import fr.lapetina.pixelator.domain.model.GridLayout;
import fr.lapetina.pixelator.domain.model.PixelSource;
import fr.lapetina.pixelator.domain.model.RasterCanvas;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State shared by every handler of one pixelation call.
 *
 * <p>The source is read-only, the layout frozen. The only cross-thread
 * signals are the completion future and the first failure, both of which
 * are set at most once.
 */
public final class PixelationCall {

    private final String id;
    private final PixelSource source;
    private final GridLayout layout;
    private final boolean grayscale;
    private final CompletableFuture<RasterCanvas> completion = new CompletableFuture<>();
    private final AtomicReference<PixelationException> failure = new AtomicReference<>();

    public PixelationCall(String id, PixelSource source, GridLayout layout, boolean grayscale) {
        this.id = Objects.requireNonNull(id, "Call id is required");
        this.source = Objects.requireNonNull(source, "Source is required");
        this.layout = Objects.requireNonNull(layout, "Layout is required");
        this.grayscale = grayscale;
    }

    public String id() {
        return id;
    }

    public PixelSource source() {
        return source;
    }

    public GridLayout layout() {
        return layout;
    }

    public boolean grayscale() {
        return grayscale;
    }

    public CompletableFuture<RasterCanvas> completion() {
        return completion;
    }

    /**
     * Records the first failure and fails the call. Later failures are ignored.
     *
     * @return true if this was the first failure
     */
    public boolean abort(PixelationException cause) {
        if (failure.compareAndSet(null, cause)) {
            completion.completeExceptionally(cause);
            return true;
        }
        return false;
    }

    public boolean isAborted() {
        return failure.get() != null;
    }

    public PixelationException getFailure() {
        return failure.get();
    }

    /**
     * Resolves the call with the fully composited destination.
     */
    public void complete(RasterCanvas destination) {
        completion.complete(destination);
    }

    @Override
    public String toString() {
        return "PixelationCall{id=" + id + ", " + layout + ", grayscale=" + grayscale + '}';
    }
}
