package org.ticketrouter.engine.domain.model;

import java.util.Locale;

/**
 * Staff position, ordered from junior to most senior.
 */
public enum Position {
    SPECIALIST("Специалист"),
    SENIOR_SPECIALIST("Ведущий специалист"),
    CHIEF_SPECIALIST("Главный специалист");

    private final String label;

    Position(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSenior() {
        return this == SENIOR_SPECIALIST || this == CHIEF_SPECIALIST;
    }

    /**
     * Matches the enum name or the Russian title. Titles are matched by containment because
     * roster exports sometimes prefix them (e.g. "Старший Главный специалист").
     */
    public static Position fromLabel(String value) {
        if (value == null || value.trim().isEmpty()) {
            return SPECIALIST;
        }
        String trimmed = value.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT).replace(' ', '_');
        for (Position position : values()) {
            if (position.name().equals(upper)) {
                return position;
            }
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.contains(CHIEF_SPECIALIST.label.toLowerCase(Locale.ROOT))) {
            return CHIEF_SPECIALIST;
        }
        if (lower.contains(SENIOR_SPECIALIST.label.toLowerCase(Locale.ROOT))) {
            return SENIOR_SPECIALIST;
        }
        return SPECIALIST;
    }
}
