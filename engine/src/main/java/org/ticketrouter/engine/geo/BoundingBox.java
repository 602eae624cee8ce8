package org.ticketrouter.engine.geo;

import org.ticketrouter.engine.domain.model.GeoPoint;

/**
 * Rectangular latitude/longitude area of the serviced country. Provider hits outside it are rejected.
 */
public final class BoundingBox {

    private final double latMin;
    private final double latMax;
    private final double lonMin;
    private final double lonMax;

    public BoundingBox(double latMin, double latMax, double lonMin, double lonMax) {
        if (latMin > latMax || lonMin > lonMax) {
            throw new IllegalArgumentException(String.format(
                    "invalid bounding box lat[%s..%s] lon[%s..%s]", latMin, latMax, lonMin, lonMax));
        }
        this.latMin = latMin;
        this.latMax = latMax;
        this.lonMin = lonMin;
        this.lonMax = lonMax;
    }

    /**
     * Parses {@code "latMin,latMax,lonMin,lonMax"}.
     */
    public static BoundingBox parse(String value) {
        String[] parts = value.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("bounding box needs 4 comma-separated numbers: " + value);
        }
        return new BoundingBox(
                Double.parseDouble(parts[0].trim()),
                Double.parseDouble(parts[1].trim()),
                Double.parseDouble(parts[2].trim()),
                Double.parseDouble(parts[3].trim()));
    }

    public boolean contains(GeoPoint point) {
        return point.getLatitude() >= latMin && point.getLatitude() <= latMax
                && point.getLongitude() >= lonMin && point.getLongitude() <= lonMax;
    }

    @Override
    public String toString() {
        return latMin + "," + latMax + "," + lonMin + "," + lonMax;
    }
}
