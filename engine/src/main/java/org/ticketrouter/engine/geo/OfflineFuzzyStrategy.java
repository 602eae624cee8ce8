package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.domain.model.ResolvedLocation;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Region name matched against the offline table with a similarity threshold.
 * Catches one or two mistyped characters.
 */
public final class OfflineFuzzyStrategy implements GeoResolutionStrategy {

    private static final Logger LOG = Logger.getLogger(OfflineFuzzyStrategy.class.getName());

    private final GeoReferenceTables tables;
    private final double threshold;

    public OfflineFuzzyStrategy(GeoReferenceTables tables, double threshold) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.threshold = threshold;
    }

    @Override
    public ResolvedLocation.Tier tier() {
        return ResolvedLocation.Tier.OFFLINE_FUZZY;
    }

    @Override
    public Optional<ResolvedLocation> attempt(LocationQuery query) {
        if (!query.hasRegion()) {
            return Optional.empty();
        }
        String region = query.getRegion();
        return NameSimilarity.bestMatch(region, tables.getCoordinates().keySet(), threshold)
                .map(match -> {
                    LOG.fine(() -> "[Geo] Fuzzy matched '" + region + "' -> '" + match + "'");
                    return ResolvedLocation.resolved(tables.getCoordinates().get(match), tier());
                });
    }
}
