package org.ticketrouter.engine.locator;

import org.ticketrouter.engine.domain.model.Facility;
import org.ticketrouter.engine.domain.model.FacilitySelection;
import org.ticketrouter.engine.domain.model.GeoPoint;
import org.ticketrouter.engine.domain.model.ResolvedLocation;
import org.ticketrouter.engine.geo.GeoMath;
import org.ticketrouter.engine.geo.GeoReferenceTables;
import org.ticketrouter.engine.geo.NameSimilarity;
import org.ticketrouter.engine.roster.StaffRoster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Ranks facilities for a ticket.
 *
 * Order of rules:
 * 1. Foreign or unknown country: the two fallback hubs, alternating which comes first.
 * 2. No street given and the city maps to exactly one office: that office alone, without
 *    distance computation. This can differ from pure distance ranking on purpose.
 * 3. Unresolved location: the alternating fallback hubs.
 * 4. Haversine ranking, with a load-based tie-break when the two nearest offices are
 *    within the configured radius of each other.
 */
public final class FacilityLocator {

    private static final Logger LOG = Logger.getLogger(FacilityLocator.class.getName());

    private final StaffRoster roster;
    private final GeoReferenceTables tables;
    private final List<Facility> fallbackHubs;
    private final double equidistantRadiusKm;
    private final double fuzzyThreshold;
    private final AlternatingSelector hubSelector = new AlternatingSelector();
    private final Map<String, List<Facility>> facilitiesByCity;

    public FacilityLocator(StaffRoster roster, GeoReferenceTables tables, List<String> fallbackHubNames,
                           double equidistantRadiusKm, double fuzzyThreshold) {
        this.roster = Objects.requireNonNull(roster, "roster must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        Objects.requireNonNull(fallbackHubNames, "fallbackHubNames must not be null");
        if (fallbackHubNames.size() != 2) {
            throw new IllegalArgumentException("exactly two fallback hubs are required, got " + fallbackHubNames);
        }
        List<Facility> hubs = new ArrayList<>();
        for (String hubName : fallbackHubNames) {
            hubs.add(roster.getFacility(hubName).orElseThrow(() ->
                    new IllegalArgumentException("fallback hub is not a known facility: " + hubName)));
        }
        this.fallbackHubs = Collections.unmodifiableList(hubs);
        this.equidistantRadiusKm = equidistantRadiusKm;
        this.fuzzyThreshold = fuzzyThreshold;

        Map<String, List<Facility>> byCity = new LinkedHashMap<>();
        for (Facility facility : roster.getFacilities()) {
            byCity.computeIfAbsent(NameSimilarity.normalize(facility.getCity()), k -> new ArrayList<>()).add(facility);
        }
        this.facilitiesByCity = Collections.unmodifiableMap(byCity);
    }

    /**
     * Designated fallback hubs in escalation order.
     */
    public List<Facility> getFallbackHubs() {
        return fallbackHubs;
    }

    public RankedFacilities locate(ResolvedLocation location, String cityName, String street) {
        Objects.requireNonNull(location, "location must not be null");

        if (location.isForeignOrUnknown()) {
            return fallbackPool();
        }

        Optional<Facility> single = shortcutFor(cityName, street);
        if (single.isPresent()) {
            LOG.fine(() -> "[Locator] City '" + cityName + "' maps to single office " + single.get().getName());
            return new RankedFacilities(
                    Collections.singletonList(new RankedFacilities.Candidate(single.get(), Double.NaN)),
                    FacilitySelection.SINGLE_OFFICE_SHORTCUT);
        }

        if (!location.isResolved()) {
            return fallbackPool();
        }

        return rankByDistance(location.getPoint());
    }

    /**
     * The office a ticket goes to without distance ranking, if any. A street address asks for
     * precise geocoding, so it disables the shortcut.
     */
    public Optional<Facility> shortcutFor(String cityName, String street) {
        if (street != null && !street.trim().isEmpty()) {
            return Optional.empty();
        }
        return singleOfficeFor(cityName);
    }

    /**
     * The facility a city name unambiguously maps to, by exact normalized name or fuzzy match.
     */
    public Optional<Facility> singleOfficeFor(String cityName) {
        if (cityName == null || cityName.trim().isEmpty()) {
            return Optional.empty();
        }
        String canonical = tables.canonicalName(cityName);
        String key = NameSimilarity.normalize(canonical);

        List<Facility> exact = facilitiesByCity.get(key);
        if (exact != null) {
            return exact.size() == 1 ? Optional.of(exact.get(0)) : Optional.empty();
        }

        Optional<String> fuzzy = NameSimilarity.bestMatch(canonical, facilitiesByCity.keySet(), fuzzyThreshold);
        if (fuzzy.isPresent()) {
            List<Facility> matched = facilitiesByCity.get(fuzzy.get());
            if (matched.size() == 1) {
                LOG.fine(() -> "[Locator] Fuzzy office match '" + cityName + "' -> '" + matched.get(0).getName() + "'");
                return Optional.of(matched.get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Clears the hub alternation state.
     */
    public void reset() {
        hubSelector.reset();
    }

    private RankedFacilities fallbackPool() {
        int first = hubSelector.next();
        Facility a = fallbackHubs.get(first);
        Facility b = fallbackHubs.get(1 - first);
        LOG.fine(() -> "[Locator] Unresolved location, fallback hub " + a.getName());
        return new RankedFacilities(Arrays.asList(
                new RankedFacilities.Candidate(a, Double.NaN),
                new RankedFacilities.Candidate(b, Double.NaN)),
                FacilitySelection.FALLBACK_HUB);
    }

    private RankedFacilities rankByDistance(GeoPoint point) {
        List<RankedFacilities.Candidate> ranked = new ArrayList<>();
        for (Facility facility : roster.getFacilities()) {
            ranked.add(new RankedFacilities.Candidate(facility, GeoMath.distanceKm(point, facility.getLocation())));
        }
        ranked.sort(Comparator.comparingDouble(RankedFacilities.Candidate::getDistanceKm)
                .thenComparing(c -> c.getFacility().getName()));

        if (ranked.size() >= 2) {
            RankedFacilities.Candidate nearest = ranked.get(0);
            RankedFacilities.Candidate second = ranked.get(1);
            if (second.getDistanceKm() - nearest.getDistanceKm() <= equidistantRadiusKm) {
                int nearestLoad = roster.getAggregateLoad(nearest.getFacility().getName());
                int secondLoad = roster.getAggregateLoad(second.getFacility().getName());
                if (secondLoad < nearestLoad) {
                    ranked.set(0, second);
                    ranked.set(1, nearest);
                }
                LOG.fine(() -> String.format("[Locator] Tie-break %s(load=%d) vs %s(load=%d)",
                        nearest.getFacility().getName(), nearestLoad, second.getFacility().getName(), secondLoad));
                return new RankedFacilities(ranked, FacilitySelection.LOAD_TIE_BREAK);
            }
        }
        return new RankedFacilities(ranked, FacilitySelection.NEAREST);
    }
}
