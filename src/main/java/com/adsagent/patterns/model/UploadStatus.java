package com.adsagent.patterns.model;

/**
 * Lifecycle of one ingestion attempt. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum UploadStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
