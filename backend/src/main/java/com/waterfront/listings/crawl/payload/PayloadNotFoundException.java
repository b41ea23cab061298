package com.waterfront.listings.crawl.payload;

public class PayloadNotFoundException extends PayloadExtractionException {

    public PayloadNotFoundException(String message) {
        super(message);
    }

    public PayloadNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "payload_not_found";
    }
}
