package org.ticketrouter.engine.exception;

/**
 * Reference data (facilities, staff, geo tables) could not be read or is malformed.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
