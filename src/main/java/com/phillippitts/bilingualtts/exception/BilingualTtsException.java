package com.phillippitts.bilingualtts.exception;

/**
 * Base exception for all bilingualTts application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class BilingualTtsException extends RuntimeException {

    public BilingualTtsException(String message) {
        super(message);
    }

    public BilingualTtsException(String message, Throwable cause) {
        super(message, cause);
    }

    public BilingualTtsException(Throwable cause) {
        super(cause);
    }
}
