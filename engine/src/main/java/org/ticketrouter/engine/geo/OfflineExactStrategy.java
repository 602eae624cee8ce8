package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.domain.model.GeoPoint;
import org.ticketrouter.engine.domain.model.ResolvedLocation;

import java.util.Objects;
import java.util.Optional;

/**
 * Region name looked up verbatim in the offline coordinate table.
 */
public final class OfflineExactStrategy implements GeoResolutionStrategy {

    private final GeoReferenceTables tables;

    public OfflineExactStrategy(GeoReferenceTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    @Override
    public ResolvedLocation.Tier tier() {
        return ResolvedLocation.Tier.OFFLINE_EXACT;
    }

    @Override
    public Optional<ResolvedLocation> attempt(LocationQuery query) {
        if (!query.hasRegion()) {
            return Optional.empty();
        }
        GeoPoint point = tables.getCoordinates().get(query.getRegion());
        return point == null ? Optional.empty() : Optional.of(ResolvedLocation.resolved(point, tier()));
    }
}
