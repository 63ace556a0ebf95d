package com.example.tamperdetector.service.loading;

/**
 * The input image could not be decoded. This is the only failure that aborts an analysis.
 */
public class ImageLoadException extends RuntimeException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
