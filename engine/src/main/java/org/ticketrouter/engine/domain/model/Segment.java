package org.ticketrouter.engine.domain.model;

import java.util.Locale;

/**
 * Client segment of a ticket.
 */
public enum Segment {
    VIP,
    PRIORITY,
    MASS;

    /**
     * VIP and Priority clients are served only by staff holding the VIP skill.
     */
    public boolean requiresVipSkill() {
        return this == VIP || this == PRIORITY;
    }

    /**
     * Parses a segment label, case-insensitive. Unknown or blank labels map to MASS.
     */
    public static Segment fromLabel(String label) {
        if (label == null || label.trim().isEmpty()) {
            return MASS;
        }
        switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "VIP":
                return VIP;
            case "PRIORITY":
                return PRIORITY;
            default:
                return MASS;
        }
    }
}
