package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.domain.model.GeoPoint;
import org.ticketrouter.engine.domain.model.ResolvedLocation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Last resort: the first table key that contains the region or is contained in it.
 */
public final class OfflinePartialStrategy implements GeoResolutionStrategy {

    private final GeoReferenceTables tables;

    public OfflinePartialStrategy(GeoReferenceTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    @Override
    public ResolvedLocation.Tier tier() {
        return ResolvedLocation.Tier.OFFLINE_PARTIAL;
    }

    @Override
    public Optional<ResolvedLocation> attempt(LocationQuery query) {
        if (!query.hasRegion()) {
            return Optional.empty();
        }
        String region = NameSimilarity.normalize(query.getRegion());
        for (Map.Entry<String, GeoPoint> entry : tables.getCoordinates().entrySet()) {
            String key = NameSimilarity.normalize(entry.getKey());
            if (key.isEmpty()) {
                continue;
            }
            if (region.contains(key) || key.contains(region)) {
                return Optional.of(ResolvedLocation.resolved(entry.getValue(), tier()));
            }
        }
        return Optional.empty();
    }
}
