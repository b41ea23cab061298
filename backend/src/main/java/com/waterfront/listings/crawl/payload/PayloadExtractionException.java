package com.waterfront.listings.crawl.payload;

/**
 * A fetched page lacked the embedded structure the pipeline reads. Never fatal to a run.
 */
public abstract class PayloadExtractionException extends RuntimeException {

    protected PayloadExtractionException(String message) {
        super(message);
    }

    protected PayloadExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reasonCode();
}
