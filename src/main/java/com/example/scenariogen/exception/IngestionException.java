package com.example.scenariogen.exception;

/**
 * Raised when requirements cannot be obtained from a document, an issue export or raw text.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
