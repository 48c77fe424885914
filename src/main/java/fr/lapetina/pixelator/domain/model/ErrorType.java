package fr.lapetina.pixelator.domain.model;

/**
 * Error taxonomy for pixelation calls.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Cell count is zero, negative or not a whole number */
    INVALID_DIMENSION,

    /** Cell count is larger than the source extent on that axis */
    DIMENSION_EXCEEDS_SOURCE,

    /** A pixel buffer could not be obtained for a stripe or cell region */
    CROP_FAILURE,

    /** An executor failed while averaging or painting a stripe */
    PROCESSING_FAILURE,

    /** The source image could not be read or decoded */
    SOURCE_UNAVAILABLE,

    /** The result could not be encoded to the requested output format */
    ENCODING_FAILURE,

    /** The call did not complete within the configured timeout */
    TIMEOUT,

    /** The calling thread was interrupted while waiting for the call */
    CANCELLED,

    /** The owning pixelator instance has been disposed */
    DISPOSED
}
