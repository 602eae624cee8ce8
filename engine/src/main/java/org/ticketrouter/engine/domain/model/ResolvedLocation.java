package org.ticketrouter.engine.domain.model;

import java.util.Objects;

/**
 * Outcome of geo resolution: coordinates tagged with the tier that produced them,
 * or an explicit unresolved marker. Unresolved is a normal outcome, not an error.
 */
public final class ResolvedLocation {

    /**
     * Which lookup tier produced the coordinates. Used for logging and reporting only.
     */
    public enum Tier {
        PROVIDER_CITY,
        PROVIDER_REGION,
        OFFLINE_EXACT,
        OFFLINE_FUZZY,
        OFFLINE_PARTIAL
    }

    /**
     * Why no coordinates were produced.
     */
    public enum UnresolvedReason {
        FOREIGN_COUNTRY,
        UNKNOWN_COUNTRY,
        NOT_FOUND
    }

    private final GeoPoint point;
    private final Tier tier;
    private final UnresolvedReason unresolvedReason;

    private ResolvedLocation(GeoPoint point, Tier tier, UnresolvedReason unresolvedReason) {
        this.point = point;
        this.tier = tier;
        this.unresolvedReason = unresolvedReason;
    }

    public static ResolvedLocation resolved(GeoPoint point, Tier tier) {
        return new ResolvedLocation(
                Objects.requireNonNull(point, "point must not be null"),
                Objects.requireNonNull(tier, "tier must not be null"),
                null);
    }

    public static ResolvedLocation unresolved(UnresolvedReason reason) {
        return new ResolvedLocation(null, null, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean isResolved() {
        return point != null;
    }

    public boolean isForeign() {
        return unresolvedReason == UnresolvedReason.FOREIGN_COUNTRY;
    }

    /**
     * Country is foreign or missing; such tickets go straight to the fallback hubs.
     */
    public boolean isForeignOrUnknown() {
        return isForeign() || unresolvedReason == UnresolvedReason.UNKNOWN_COUNTRY;
    }

    /**
     * @return coordinates, or null when unresolved
     */
    public GeoPoint getPoint() {
        return point;
    }

    /**
     * @return producing tier, or null when unresolved
     */
    public Tier getTier() {
        return tier;
    }

    /**
     * @return reason, or null when resolved
     */
    public UnresolvedReason getUnresolvedReason() {
        return unresolvedReason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedLocation)) {
            return false;
        }
        ResolvedLocation other = (ResolvedLocation) o;
        return Objects.equals(point, other.point)
                && tier == other.tier
                && unresolvedReason == other.unresolvedReason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(point, tier, unresolvedReason);
    }

    @Override
    public String toString() {
        if (isResolved()) {
            return "Resolved" + point + "[" + tier + "]";
        }
        return "Unresolved[" + unresolvedReason + "]";
    }
}
