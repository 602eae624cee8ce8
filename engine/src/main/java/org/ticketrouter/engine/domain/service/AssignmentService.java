package org.ticketrouter.engine.domain.service;

import org.ticketrouter.engine.domain.model.AssignmentResult;
import org.ticketrouter.engine.domain.model.TicketAttributes;

import java.util.List;
import java.util.Optional;

/**
 * Service for assigning tickets to staff.
 */
public interface AssignmentService {

    /**
     * Route one ticket. Safe to call repeatedly: a ticket that already has a result gets that
     * result back and no load changes.
     *
     * @param ticket classified ticket
     * @return assigned or unassigned result; never null
     * @throws org.ticketrouter.engine.exception.InconsistentStateException if roster data is corrupt
     */
    AssignmentResult process(TicketAttributes ticket);

    /**
     * Clear in-memory round-robin counters and fallback-hub alternation.
     */
    void resetAllocatorState();

    /**
     * Drop the stored result of a ticket so it can be processed again. If the ticket was
     * assigned, the staff member's load is reduced by one. The result is only dropped once the
     * load has been given back.
     *
     * @return the removed result, or empty if there was none
     * @throws org.ticketrouter.engine.exception.InconsistentStateException if the assigned member
     *         is missing from the roster or has no load to give back; the result is kept
     */
    Optional<AssignmentResult> release(String ticketId);

    Optional<AssignmentResult> result(String ticketId);

    /**
     * All stored results in processing order.
     */
    List<AssignmentResult> results();
}
