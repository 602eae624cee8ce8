package org.ticketrouter.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of how one ticket was routed.
 */
public final class AssignmentResult {

    /**
     * Terminal state of a processed ticket.
     */
    public enum Outcome {
        ASSIGNED,
        UNASSIGNED
    }

    private final String ticketId;
    private final Outcome outcome;
    private final String facilityName;
    private final String staffId;
    private final String staffName;
    private final ResolvedLocation location;
    private final FacilitySelection selection;
    private final boolean fallbackUsed;
    private final int roundRobinIndex;
    private final UnassignedReason unassignedReason;
    private final Instant assignedAt;

    private AssignmentResult(Builder builder) {
        this.ticketId = Objects.requireNonNull(builder.ticketId, "ticketId must not be null");
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome must not be null");
        this.facilityName = builder.facilityName;
        this.staffId = builder.staffId;
        this.staffName = builder.staffName;
        this.location = builder.location;
        this.selection = builder.selection;
        this.fallbackUsed = builder.fallbackUsed;
        this.roundRobinIndex = builder.roundRobinIndex;
        this.unassignedReason = builder.unassignedReason;
        this.assignedAt = builder.assignedAt != null ? builder.assignedAt : Instant.now();

        if (outcome == Outcome.ASSIGNED && (staffId == null || facilityName == null)) {
            throw new IllegalArgumentException("assigned result needs staff and facility");
        }
        if (outcome == Outcome.UNASSIGNED && unassignedReason == null) {
            throw new IllegalArgumentException("unassigned result needs a reason");
        }
    }

    public String getTicketId() {
        return ticketId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isAssigned() {
        return outcome == Outcome.ASSIGNED;
    }

    /**
     * @return facility that served the ticket; for unassigned tickets the primary facility, or null for spam
     */
    public String getFacilityName() {
        return facilityName;
    }

    public String getStaffId() {
        return staffId;
    }

    public String getStaffName() {
        return staffName;
    }

    public ResolvedLocation getLocation() {
        return location;
    }

    public FacilitySelection getSelection() {
        return selection;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public int getRoundRobinIndex() {
        return roundRobinIndex;
    }

    public UnassignedReason getUnassignedReason() {
        return unassignedReason;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    @Override
    public String toString() {
        if (isAssigned()) {
            return String.format("AssignmentResult{ticket='%s', facility='%s', staff='%s', selection=%s, fallback=%s, rr=%d}",
                    ticketId, facilityName, staffId, selection, fallbackUsed, roundRobinIndex);
        }
        return String.format("AssignmentResult{ticket='%s', UNASSIGNED, reason=%s, lastFacility='%s'}",
                ticketId, unassignedReason, facilityName);
    }

    /**
     * Builder for AssignmentResult.
     */
    public static final class Builder {
        private String ticketId;
        private Outcome outcome;
        private String facilityName;
        private String staffId;
        private String staffName;
        private ResolvedLocation location;
        private FacilitySelection selection;
        private boolean fallbackUsed;
        private int roundRobinIndex;
        private UnassignedReason unassignedReason;
        private Instant assignedAt;

        public Builder ticketId(String ticketId) {
            this.ticketId = ticketId;
            return this;
        }

        public Builder assigned(String facilityName, StaffMember staff) {
            this.outcome = Outcome.ASSIGNED;
            this.facilityName = facilityName;
            this.staffId = staff.getId();
            this.staffName = staff.getFullName();
            this.unassignedReason = null;
            return this;
        }

        public Builder unassigned(UnassignedReason reason) {
            this.outcome = Outcome.UNASSIGNED;
            this.unassignedReason = reason;
            this.staffId = null;
            this.staffName = null;
            return this;
        }

        public Builder facilityName(String facilityName) {
            this.facilityName = facilityName;
            return this;
        }

        public Builder location(ResolvedLocation location) {
            this.location = location;
            return this;
        }

        public Builder selection(FacilitySelection selection) {
            this.selection = selection;
            return this;
        }

        public Builder fallbackUsed(boolean fallbackUsed) {
            this.fallbackUsed = fallbackUsed;
            return this;
        }

        public Builder roundRobinIndex(int roundRobinIndex) {
            this.roundRobinIndex = roundRobinIndex;
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public AssignmentResult build() {
            return new AssignmentResult(this);
        }
    }
}
