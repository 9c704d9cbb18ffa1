package com.adsagent.patterns.repository;

public class RepositoryUnavailableException extends RuntimeException {
    public RepositoryUnavailableException(String m, Throwable c) { super(m, c); }
}
