package org.ticketrouter.engine.allocation;

import org.ticketrouter.engine.domain.model.Language;
import org.ticketrouter.engine.eligibility.EligibilityProfile;

import java.util.Objects;

/**
 * Round-robin key: target facility plus the eligibility flags of the ticket.
 *
 * Raw ticket fields (id, text, city) are deliberately absent, so every ticket that lands in the
 * same eligible sub-pool advances one shared alternation sequence.
 */
public final class Fingerprint {

    private final String facilityName;
    private final EligibilityProfile profile;

    public Fingerprint(String facilityName, EligibilityProfile profile) {
        this.facilityName = Objects.requireNonNull(facilityName, "facilityName must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
    }

    public String getFacilityName() {
        return facilityName;
    }

    public EligibilityProfile getProfile() {
        return profile;
    }

    /**
     * Stable textual form, e.g. {@code Астана|vip=true|data=false|lang=ENG|senior=false}.
     */
    public String key() {
        Language language = profile.getLanguage();
        return facilityName + "|vip=" + profile.isVip() + "|data=" + profile.isDataChange()
                + "|lang=" + language.name() + "|senior=" + profile.isNeedsSenior();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fingerprint)) {
            return false;
        }
        Fingerprint other = (Fingerprint) o;
        return facilityName.equals(other.facilityName) && profile.equals(other.profile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(facilityName, profile);
    }

    @Override
    public String toString() {
        return key();
    }
}
