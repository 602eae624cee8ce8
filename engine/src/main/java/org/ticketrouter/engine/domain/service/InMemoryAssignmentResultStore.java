package org.ticketrouter.engine.domain.service;

import org.ticketrouter.engine.domain.model.AssignmentResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory result store that keeps insertion order.
 */
public final class InMemoryAssignmentResultStore implements AssignmentResultStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AssignmentResult> results = new LinkedHashMap<>();

    @Override
    public Optional<AssignmentResult> find(String ticketId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(results.get(ticketId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save(AssignmentResult result) {
        Objects.requireNonNull(result, "result must not be null");
        lock.writeLock().lock();
        try {
            if (results.containsKey(result.getTicketId())) {
                throw new IllegalStateException("result already stored for ticket " + result.getTicketId());
            }
            results.put(result.getTicketId(), result);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<AssignmentResult> remove(String ticketId) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(results.remove(ticketId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AssignmentResult> findAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(results.values());
        } finally {
            lock.readLock().unlock();
        }
    }
}
