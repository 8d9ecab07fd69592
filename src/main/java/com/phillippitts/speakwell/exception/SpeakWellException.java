package com.phillippitts.speakwell.exception;

/**
 * Base exception for all SpeakWell application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeakWellException extends RuntimeException {

    public SpeakWellException(String message) {
        super(message);
    }

    public SpeakWellException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakWellException(Throwable cause) {
        super(cause);
    }
}
