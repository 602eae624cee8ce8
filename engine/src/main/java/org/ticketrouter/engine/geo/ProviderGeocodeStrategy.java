package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.api.GeocodingException;
import org.ticketrouter.engine.api.GeocodingProvider;
import org.ticketrouter.engine.domain.model.GeoPoint;
import org.ticketrouter.engine.domain.model.ResolvedLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queries the external provider and keeps the hit only if it lies inside the service area.
 * Provider errors are logged and treated as a miss.
 */
public final class ProviderGeocodeStrategy implements GeoResolutionStrategy {

    private static final Logger LOG = Logger.getLogger(ProviderGeocodeStrategy.class.getName());

    /**
     * Which fields go into the query text.
     */
    public enum Scope {
        /** city, region, country qualifier; skipped without a city */
        CITY,
        /** region, country qualifier; skipped without a region */
        REGION
    }

    private final GeocodingProvider provider;
    private final Scope scope;
    private final BoundingBox serviceArea;
    private final String countryQualifier;

    public ProviderGeocodeStrategy(GeocodingProvider provider, Scope scope,
                                   BoundingBox serviceArea, String countryQualifier) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.serviceArea = Objects.requireNonNull(serviceArea, "serviceArea must not be null");
        this.countryQualifier = Objects.requireNonNull(countryQualifier, "countryQualifier must not be null");
    }

    @Override
    public ResolvedLocation.Tier tier() {
        return scope == Scope.CITY ? ResolvedLocation.Tier.PROVIDER_CITY : ResolvedLocation.Tier.PROVIDER_REGION;
    }

    @Override
    public boolean isRemote() {
        return true;
    }

    @Override
    public Optional<ResolvedLocation> attempt(LocationQuery query) {
        String text = buildQueryText(query);
        if (text == null) {
            return Optional.empty();
        }

        Optional<GeoPoint> hit;
        try {
            hit = provider.query(text);
        } catch (GeocodingException e) {
            LOG.log(Level.WARNING, e, () -> "[Geo] Provider failed for '" + text + "', falling through");
            return Optional.empty();
        }

        if (!hit.isPresent()) {
            return Optional.empty();
        }
        GeoPoint point = hit.get();
        if (!serviceArea.contains(point)) {
            LOG.info(() -> String.format("[Geo] Provider hit %s for '%s' is outside service area, skipping", point, text));
            return Optional.empty();
        }
        return Optional.of(ResolvedLocation.resolved(point, tier()));
    }

    private String buildQueryText(LocationQuery query) {
        List<String> parts = new ArrayList<>();
        if (scope == Scope.CITY) {
            if (!query.hasCity()) {
                return null;
            }
            parts.add(query.getCity());
            if (query.hasRegion()) {
                parts.add(query.getRegion());
            }
        } else {
            if (!query.hasRegion()) {
                return null;
            }
            parts.add(query.getRegion());
        }
        if (!countryQualifier.isEmpty()) {
            parts.add(countryQualifier);
        }
        return String.join(", ", parts);
    }
}
