package org.ticketrouter.engine.geo;

/**
 * Location fields of one ticket after alias normalization. Blank fields are stored as null.
 */
public final class LocationQuery {

    private final String country;
    private final String region;
    private final String city;
    private final String street;

    public LocationQuery(String country, String region, String city, String street) {
        this.country = blankToNull(country);
        this.region = blankToNull(region);
        this.city = blankToNull(city);
        this.street = blankToNull(street);
    }

    public String getCountry() {
        return country;
    }

    public String getRegion() {
        return region;
    }

    public String getCity() {
        return city;
    }

    public String getStreet() {
        return street;
    }

    public boolean hasRegion() {
        return region != null;
    }

    public boolean hasCity() {
        return city != null;
    }

    private static String blankToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return "LocationQuery{country='" + country + "', region='" + region + "', city='" + city + "'}";
    }
}
