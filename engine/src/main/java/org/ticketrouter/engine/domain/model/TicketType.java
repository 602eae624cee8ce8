package org.ticketrouter.engine.domain.model;

import java.util.Locale;

/**
 * Ticket category produced by the classification step.
 */
public enum TicketType {
    COMPLAINT("Жалоба"),
    DATA_CHANGE("Смена данных"),
    CONSULTATION("Консультация"),
    CLAIM("Претензия"),
    APP_MALFUNCTION("Неработоспособность приложения"),
    FRAUDULENT_ACTIVITY("Мошеннические действия"),
    SPAM("Спам");

    private final String label;

    TicketType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the enum name or the Russian label. Unknown values map to CONSULTATION,
     * the category the classifier falls back to.
     */
    public static TicketType fromLabel(String value) {
        if (value == null || value.trim().isEmpty()) {
            return CONSULTATION;
        }
        String trimmed = value.trim();
        for (TicketType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed)
                    || type.name().equals(trimmed.toUpperCase(Locale.ROOT).replace(' ', '_'))) {
                return type;
            }
        }
        return CONSULTATION;
    }
}
