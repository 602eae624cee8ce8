package org.ticketrouter.engine.eligibility;

import org.ticketrouter.engine.domain.model.Position;
import org.ticketrouter.engine.domain.model.Skill;
import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.domain.model.TicketAttributes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a facility's staff to those allowed to take a ticket.
 *
 * Hard rules (all must hold): VIP/Priority segment needs the VIP skill, a data change needs a
 * chief specialist, KZ and ENG tickets need the matching language skill.
 * Soft rule: negative tickets go to senior staff when the hard-filtered pool has any.
 * An empty result is a normal outcome.
 */
public final class EligibilityFilter {

    public List<StaffMember> filter(List<StaffMember> staffAtFacility, TicketAttributes ticket) {
        Objects.requireNonNull(ticket, "ticket must not be null");
        return filter(staffAtFacility, EligibilityProfile.of(ticket));
    }

    public List<StaffMember> filter(List<StaffMember> staffAtFacility, EligibilityProfile profile) {
        Objects.requireNonNull(staffAtFacility, "staffAtFacility must not be null");
        Objects.requireNonNull(profile, "profile must not be null");

        Skill languageSkill = profile.getLanguage().getRequiredSkill();
        List<StaffMember> eligible = new ArrayList<>();
        for (StaffMember member : staffAtFacility) {
            if (profile.isDataChange() && member.getPosition() != Position.CHIEF_SPECIALIST) {
                continue;
            }
            if (profile.isVip() && !member.hasSkill(Skill.VIP)) {
                continue;
            }
            if (languageSkill != null && !member.hasSkill(languageSkill)) {
                continue;
            }
            eligible.add(member);
        }

        if (profile.isNeedsSenior() && !eligible.isEmpty()) {
            List<StaffMember> seniors = new ArrayList<>();
            for (StaffMember member : eligible) {
                if (member.getPosition().isSenior()) {
                    seniors.add(member);
                }
            }
            if (!seniors.isEmpty()) {
                return seniors;
            }
        }
        return eligible;
    }
}
