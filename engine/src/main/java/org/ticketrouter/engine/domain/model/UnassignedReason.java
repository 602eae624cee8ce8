package org.ticketrouter.engine.domain.model;

/**
 * Reason codes for tickets that end without a staff member. Both require manual triage.
 */
public enum UnassignedReason {
    NO_ELIGIBLE_STAFF,
    SPAM_NOT_ROUTED
}
