package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.domain.model.GeoPoint;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Offline lookup tables used by the geo resolver and the facility locator.
 * Loaded once from reference data and never modified afterwards.
 */
public final class GeoReferenceTables {

    private final Map<String, GeoPoint> coordinates;
    private final Map<String, String> aliases;
    private final Set<String> domesticCountries;

    /**
     * @param coordinates place name to coordinates; iteration order is the lookup precedence
     * @param aliases transliterated spelling to native-script canonical name
     * @param domesticCountries spellings of the serviced country
     */
    public GeoReferenceTables(Map<String, GeoPoint> coordinates,
                              Map<String, String> aliases,
                              Set<String> domesticCountries) {
        Objects.requireNonNull(coordinates, "coordinates must not be null");
        Objects.requireNonNull(aliases, "aliases must not be null");
        Objects.requireNonNull(domesticCountries, "domesticCountries must not be null");

        this.coordinates = Collections.unmodifiableMap(new LinkedHashMap<>(coordinates));

        Map<String, String> normalizedAliases = new HashMap<>();
        aliases.forEach((alias, canonical) -> normalizedAliases.put(NameSimilarity.normalize(alias), canonical));
        this.aliases = Collections.unmodifiableMap(normalizedAliases);

        Set<String> normalizedCountries = new HashSet<>();
        domesticCountries.forEach(c -> normalizedCountries.add(NameSimilarity.normalize(c)));
        this.domesticCountries = Collections.unmodifiableSet(normalizedCountries);
    }

    /**
     * Ordered, read-only coordinate table.
     */
    public Map<String, GeoPoint> getCoordinates() {
        return coordinates;
    }

    /**
     * Maps a transliterated name to its canonical spelling; unmapped names come back unchanged.
     * Null stays null.
     */
    public String canonicalName(String name) {
        if (name == null) {
            return null;
        }
        String canonical = aliases.get(NameSimilarity.normalize(name));
        return canonical != null ? canonical : name;
    }

    /**
     * A blank country is not domestic; callers treat it as an unknown client.
     */
    public boolean isDomestic(String country) {
        if (country == null || country.trim().isEmpty()) {
            return false;
        }
        return domesticCountries.contains(NameSimilarity.normalize(country));
    }
}
