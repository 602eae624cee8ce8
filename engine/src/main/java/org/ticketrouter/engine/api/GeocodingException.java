package org.ticketrouter.engine.api;

/**
 * The geocoding provider failed: timeout, transport error, non-2xx status or unreadable payload.
 */
public class GeocodingException extends Exception {

    public GeocodingException(String message) {
        super(message);
    }

    public GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
