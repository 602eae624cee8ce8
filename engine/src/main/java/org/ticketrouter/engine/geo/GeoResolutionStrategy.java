package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.domain.model.ResolvedLocation;

import java.util.Optional;

/**
 * One tier of the geo resolution chain.
 */
public interface GeoResolutionStrategy {

    /**
     * Tier produced by this strategy on success.
     */
    ResolvedLocation.Tier tier();

    /**
     * Whether an attempt may call an external service.
     */
    default boolean isRemote() {
        return false;
    }

    /**
     * Try to resolve the query. Must not throw for lookup failures.
     *
     * @return resolved location, or empty to let the next tier try
     */
    Optional<ResolvedLocation> attempt(LocationQuery query);
}
