package org.ticketrouter.engine.allocation;

import org.ticketrouter.engine.domain.model.StaffMember;

import java.util.Objects;

/**
 * Staff member chosen by the allocator and the round-robin slot (0 or 1) it came from.
 */
public final class Allocation {

    private final StaffMember staffMember;
    private final int roundRobinIndex;

    public Allocation(StaffMember staffMember, int roundRobinIndex) {
        this.staffMember = Objects.requireNonNull(staffMember, "staffMember must not be null");
        this.roundRobinIndex = roundRobinIndex;
    }

    public StaffMember getStaffMember() {
        return staffMember;
    }

    public int getRoundRobinIndex() {
        return roundRobinIndex;
    }

    @Override
    public String toString() {
        return "Allocation{" + staffMember.getId() + ", rr=" + roundRobinIndex + "}";
    }
}
