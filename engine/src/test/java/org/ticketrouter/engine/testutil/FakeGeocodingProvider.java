package org.ticketrouter.engine.testutil;

import org.ticketrouter.engine.api.GeocodingException;
import org.ticketrouter.engine.api.GeocodingProvider;
import org.ticketrouter.engine.domain.model.GeoPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scripted geocoder: answers from a map of query text to point and records every query.
 */
public final class FakeGeocodingProvider implements GeocodingProvider {

    private final Map<String, GeoPoint> answers = new HashMap<>();
    private final List<String> queries = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean failing;

    public FakeGeocodingProvider answer(String query, double lat, double lon) {
        answers.put(query, new GeoPoint(lat, lon));
        return this;
    }

    /**
     * Every subsequent query throws, as a timed-out provider would.
     */
    public FakeGeocodingProvider failing() {
        this.failing = true;
        return this;
    }

    public List<String> getQueries() {
        return queries;
    }

    @Override
    public Optional<GeoPoint> query(String query) throws GeocodingException {
        queries.add(query);
        if (failing) {
            throw new GeocodingException("simulated timeout for '" + query + "'");
        }
        return Optional.ofNullable(answers.get(query));
    }
}
