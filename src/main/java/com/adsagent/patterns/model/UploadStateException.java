package com.adsagent.patterns.model;

/**
 * Raised when code attempts a lifecycle transition the upload state machine does not allow.
 */
public class UploadStateException extends RuntimeException {
    public UploadStateException(String message) { super(message); }
}
