package com.adsagent.patterns.service;

/**
 * The vision model could not be reached or refused the call, after any retries were spent.
 */
public class ModelTransportException extends RuntimeException {

    private final boolean retriesExhausted;

    public ModelTransportException(String m, Throwable c, boolean retriesExhausted) {
        super(m, c);
        this.retriesExhausted = retriesExhausted;
    }

    /**
     * True when the failure was transient but kept recurring; false for errors that were never retryable.
     */
    public boolean isRetriesExhausted() {
        return retriesExhausted;
    }
}
