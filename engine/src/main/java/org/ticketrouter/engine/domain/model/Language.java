package org.ticketrouter.engine.domain.model;

import java.util.Locale;

/**
 * Language of the ticket. RU is the default and needs no extra skill.
 */
public enum Language {
    RU(null),
    KZ(Skill.KZ),
    ENG(Skill.ENG);

    private final Skill requiredSkill;

    Language(Skill requiredSkill) {
        this.requiredSkill = requiredSkill;
    }

    /**
     * @return the skill a staff member needs for this language, or null when none is needed
     */
    public Skill getRequiredSkill() {
        return requiredSkill;
    }

    public static Language fromLabel(String value) {
        if (value == null) {
            return RU;
        }
        switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "KZ":
            case "KAZ":
                return KZ;
            case "ENG":
            case "EN":
                return ENG;
            default:
                return RU;
        }
    }
}
