package org.ticketrouter.engine.allocation;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-fingerprint alternation counters, each with its own lock. Process-lifetime only.
 */
public final class RoundRobinCounters {

    /**
     * Counter for one fingerprint. {@link #value} may only be touched while {@link #lock} is held.
     */
    static final class Counter {
        final ReentrantLock lock = new ReentrantLock();
        int value;
    }

    private final ConcurrentMap<Fingerprint, Counter> counters = new ConcurrentHashMap<>();

    Counter counterFor(Fingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        return counters.computeIfAbsent(fingerprint, k -> new Counter());
    }

    /**
     * Current value, 0 for fingerprints never used.
     */
    public int valueOf(Fingerprint fingerprint) {
        Counter counter = counters.get(fingerprint);
        if (counter == null) {
            return 0;
        }
        counter.lock.lock();
        try {
            return counter.value;
        } finally {
            counter.lock.unlock();
        }
    }

    public int size() {
        return counters.size();
    }

    public void clear() {
        counters.clear();
    }
}
