package org.ticketrouter.engine.eligibility;

import org.ticketrouter.engine.domain.model.Language;
import org.ticketrouter.engine.domain.model.Sentiment;
import org.ticketrouter.engine.domain.model.TicketAttributes;
import org.ticketrouter.engine.domain.model.TicketType;

import java.util.Objects;

/**
 * The ticket attributes that constrain who may take a ticket, reduced to flags.
 * Two tickets with equal profiles compete for the same staff at any facility.
 */
public final class EligibilityProfile {

    private final boolean vip;
    private final boolean dataChange;
    private final Language language;
    private final boolean needsSenior;

    public EligibilityProfile(boolean vip, boolean dataChange, Language language, boolean needsSenior) {
        this.vip = vip;
        this.dataChange = dataChange;
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.needsSenior = needsSenior;
    }

    public static EligibilityProfile of(TicketAttributes ticket) {
        return new EligibilityProfile(
                ticket.getSegment().requiresVipSkill(),
                ticket.getTicketType() == TicketType.DATA_CHANGE,
                ticket.getLanguage(),
                ticket.getSentiment() == Sentiment.NEGATIVE);
    }

    /** Segment VIP or Priority: VIP skill required. */
    public boolean isVip() {
        return vip;
    }

    /** Data change request: chief specialist required. */
    public boolean isDataChange() {
        return dataChange;
    }

    public Language getLanguage() {
        return language;
    }

    /** Negative sentiment: senior staff preferred. */
    public boolean isNeedsSenior() {
        return needsSenior;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EligibilityProfile)) {
            return false;
        }
        EligibilityProfile other = (EligibilityProfile) o;
        return vip == other.vip && dataChange == other.dataChange
                && language == other.language && needsSenior == other.needsSenior;
    }

    @Override
    public int hashCode() {
        return Objects.hash(vip, dataChange, language, needsSenior);
    }

    @Override
    public String toString() {
        return "vip=" + vip + "|data=" + dataChange + "|lang=" + language + "|senior=" + needsSenior;
    }
}
