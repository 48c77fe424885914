package fr.lapetina.pixelator.disruptor.exception;

import fr.lapetina.pixelator.domain.model.ErrorType;

/**
 * Terminal failure of a pixelation call.
 *
 * Validation failures ({@link ErrorType#INVALID_DIMENSION},
 * {@link ErrorType#DIMENSION_EXCEEDS_SOURCE}) are thrown before any executor
 * is started. Failures inside a stripe ({@link ErrorType#CROP_FAILURE},
 * {@link ErrorType#PROCESSING_FAILURE}) abort the whole call and are surfaced
 * only after the executors of that call have been torn down.
 */
public final class PixelationException extends RuntimeException {

    private final ErrorType errorType;

    public PixelationException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public PixelationException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static PixelationException invalidDimension(String message) {
        return new PixelationException(ErrorType.INVALID_DIMENSION, message);
    }

    public static PixelationException disposed() {
        return new PixelationException(ErrorType.DISPOSED, "Pixelator instance has been disposed");
    }

    @Override
    public String toString() {
        return "PixelationException{" + errorType + ": " + getMessage() + '}';
    }
}
