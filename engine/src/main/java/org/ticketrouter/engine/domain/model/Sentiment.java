package org.ticketrouter.engine.domain.model;

import java.util.Locale;

/**
 * Tone of the ticket text.
 */
public enum Sentiment {
    POSITIVE("Позитивный"),
    NEUTRAL("Нейтральный"),
    NEGATIVE("Негативный");

    private final String label;

    Sentiment(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Sentiment fromLabel(String value) {
        if (value == null || value.trim().isEmpty()) {
            return NEUTRAL;
        }
        String trimmed = value.trim();
        for (Sentiment sentiment : values()) {
            if (sentiment.label.equalsIgnoreCase(trimmed)
                    || sentiment.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return sentiment;
            }
        }
        return NEUTRAL;
    }
}
