package org.ticketrouter.engine.domain.model;

import java.util.Objects;

/**
 * A physical service office. Read-only reference data.
 * The city defaults to the office name, which is how offices are named in the roster.
 */
public final class Facility {

    private final String name;
    private final String city;
    private final String address;
    private final GeoPoint location;

    public Facility(String name, String address, double latitude, double longitude) {
        this(name, name, address, latitude, longitude);
    }

    public Facility(String name, String city, String address, double latitude, double longitude) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.city = city == null || city.trim().isEmpty() ? name : city.trim();
        this.address = address;
        this.location = new GeoPoint(latitude, longitude);
    }

    public String getName() {
        return name;
    }

    public String getCity() {
        return city;
    }

    public String getAddress() {
        return address;
    }

    public GeoPoint getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Facility)) {
            return false;
        }
        return name.equals(((Facility) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Facility{" + name + " " + location + "}";
    }
}
