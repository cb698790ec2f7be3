package com.example.scenariogen.exception;

/**
 * Raised when the generative model could not produce a completion.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
