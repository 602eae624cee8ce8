package org.ticketrouter.engine.api;

import org.ticketrouter.engine.domain.model.GeoPoint;

import java.util.Optional;

/**
 * Client for an external free-text geocoder.
 */
public interface GeocodingProvider {

    /**
     * Geocode a free-text query.
     *
     * @param query address text, e.g. "Актау, Мангистауская, Казахстан"
     * @return coordinates of the best hit, or empty when the provider found nothing
     * @throws GeocodingException when the provider could not be queried
     */
    Optional<GeoPoint> query(String query) throws GeocodingException;

    /**
     * Provider used when no API key is configured. Never finds anything.
     */
    static GeocodingProvider disabled() {
        return query -> Optional.empty();
    }
}
