package com.example.tamperdetector.service;

import java.time.Duration;

/**
 * A whole-image analysis did not complete within the caller's time limit and was cancelled.
 */
public class AnalysisTimeoutException extends RuntimeException {

    private final Duration timeout;

    public AnalysisTimeoutException(Duration timeout, Throwable cause) {
        super("Image analysis did not complete within " + timeout, cause);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
