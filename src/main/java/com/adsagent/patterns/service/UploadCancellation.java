package com.adsagent.patterns.service;

/**
 * Cooperative cancellation flag for one upload. Checked between steps; an external call that
 * is already in flight is allowed to finish, but nothing is persisted afterwards.
 */
public class UploadCancellation {

    private volatile boolean cancelled;

    public static UploadCancellation none() {
        return new UploadCancellation();
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
