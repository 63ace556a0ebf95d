package com.example.tamperdetector.service.detector;

/**
 * Raised inside a detector when its computation cannot proceed on the given input, for
 * example a degenerate image size or an unreadable encoded stream.
 */
public class DetectorException extends Exception {

    public DetectorException(String message) {
        super(message);
    }

    public DetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
