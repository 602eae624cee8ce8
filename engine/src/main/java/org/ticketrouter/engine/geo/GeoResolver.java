package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.api.GeocodingProvider;
import org.ticketrouter.engine.domain.model.ResolvedLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns free-text location fields into coordinates by walking an ordered list of strategies
 * until one succeeds. Never throws for lookup failures: exhaustion yields {@code Unresolved}.
 */
public final class GeoResolver {

    private static final Logger LOG = Logger.getLogger(GeoResolver.class.getName());

    private final GeoReferenceTables tables;
    private final List<GeoResolutionStrategy> strategies;

    public GeoResolver(GeoReferenceTables tables, List<GeoResolutionStrategy> strategies) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        Objects.requireNonNull(strategies, "strategies must not be null");
        for (GeoResolutionStrategy strategy : strategies) {
            Objects.requireNonNull(strategy, "strategies must not contain null");
        }
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
    }

    /**
     * Standard five-tier chain: provider city, provider region, offline exact, offline fuzzy, offline partial.
     */
    public static GeoResolver standard(GeoReferenceTables tables, GeocodingProvider provider,
                                       BoundingBox serviceArea, String countryQualifier, double fuzzyThreshold) {
        return new GeoResolver(tables, Arrays.asList(
                new ProviderGeocodeStrategy(provider, ProviderGeocodeStrategy.Scope.CITY, serviceArea, countryQualifier),
                new ProviderGeocodeStrategy(provider, ProviderGeocodeStrategy.Scope.REGION, serviceArea, countryQualifier),
                new OfflineExactStrategy(tables),
                new OfflineFuzzyStrategy(tables, fuzzyThreshold),
                new OfflinePartialStrategy(tables)));
    }

    public List<GeoResolutionStrategy> getStrategies() {
        return strategies;
    }

    /**
     * Resolve a location.
     *
     * @return coordinates tagged with the producing tier, {@code Unresolved(UNKNOWN_COUNTRY)} for a blank
     *         country, {@code Unresolved(FOREIGN_COUNTRY)} for a foreign one, or {@code Unresolved(NOT_FOUND)}
     *         when every tier failed
     */
    public ResolvedLocation resolve(String country, String region, String city, String street) {
        return resolve(country, region, city, street, true);
    }

    /**
     * Same as {@link #resolve} but only the local tiers run; the provider is never called.
     */
    public ResolvedLocation resolveOffline(String country, String region, String city, String street) {
        return resolve(country, region, city, street, false);
    }

    private ResolvedLocation resolve(String country, String region, String city, String street,
                                     boolean remoteAllowed) {
        if (country == null || country.trim().isEmpty()) {
            LOG.fine("[Geo] No country given, skipping lookup");
            return ResolvedLocation.unresolved(ResolvedLocation.UnresolvedReason.UNKNOWN_COUNTRY);
        }
        if (!tables.isDomestic(country)) {
            LOG.fine(() -> "[Geo] Foreign country '" + country + "', skipping lookup");
            return ResolvedLocation.unresolved(ResolvedLocation.UnresolvedReason.FOREIGN_COUNTRY);
        }

        LocationQuery query = new LocationQuery(
                country, tables.canonicalName(region), tables.canonicalName(city), street);

        for (GeoResolutionStrategy strategy : strategies) {
            if (strategy.isRemote() && !remoteAllowed) {
                continue;
            }
            Optional<ResolvedLocation> outcome;
            try {
                outcome = strategy.attempt(query);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, e, () -> "[Geo] Strategy " + strategy.tier() + " failed for " + query);
                continue;
            }
            if (outcome.isPresent()) {
                ResolvedLocation location = outcome.get();
                LOG.fine(() -> "[Geo] " + query + " -> " + location);
                return location;
            }
        }

        LOG.info(() -> "[Geo] Could not resolve " + query);
        return ResolvedLocation.unresolved(ResolvedLocation.UnresolvedReason.NOT_FOUND);
    }
}
