package com.adsagent.patterns.repository;

/**
 * The owner already has a pattern for this content fingerprint. Callers resolve it by refetching.
 */
public class DuplicatePatternException extends RuntimeException {

    private final String ownerId;
    private final String sourceHash;

    public DuplicatePatternException(String ownerId, String sourceHash, Throwable cause) {
        super("Pattern already exists for owner " + ownerId + " and source hash " + sourceHash, cause);
        this.ownerId = ownerId;
        this.sourceHash = sourceHash;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getSourceHash() {
        return sourceHash;
    }
}
