package org.ticketrouter.engine.domain.service;

import org.ticketrouter.engine.domain.model.AssignmentResult;

import java.util.List;
import java.util.Optional;

/**
 * Holds one result per ticket id. Results are never modified, only added or removed.
 */
public interface AssignmentResultStore {

    Optional<AssignmentResult> find(String ticketId);

    /**
     * Store a result.
     *
     * @throws IllegalStateException if the ticket already has a result
     */
    void save(AssignmentResult result);

    Optional<AssignmentResult> remove(String ticketId);

    List<AssignmentResult> findAll();
}
