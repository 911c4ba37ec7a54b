package com.phillippitts.bilingualtts.exception;

/**
 * Thrown when segment artifacts cannot be concatenated into the final audio,
 * including the case where no artifacts reached the assembler.
 */
public class AssemblyException extends BilingualTtsException {

    public AssemblyException(String message) {
        super(message);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
