package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when request input is unusable: missing or blank text, an unknown voice gender,
 * or an empty segment reaching the synthesizer. Surfaced directly to the caller, never retried.
 */
public class InvalidInputException extends BilingualTtsException {

    private final String reason;

    public InvalidInputException(String reason) {
        super("Invalid input: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
