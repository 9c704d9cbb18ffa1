package com.adsagent.patterns.service;

/**
 * The model answered but not with a usable pattern object. Retrying the same image is not expected to help.
 */
public class ExtractionMalformedException extends RuntimeException {

    private final String responseExcerpt;

    public ExtractionMalformedException(String message, String responseExcerpt) {
        super(message);
        this.responseExcerpt = responseExcerpt;
    }

    public ExtractionMalformedException(String message, String responseExcerpt, Throwable cause) {
        super(message, cause);
        this.responseExcerpt = responseExcerpt;
    }

    public String getResponseExcerpt() {
        return responseExcerpt;
    }
}
