package org.ticketrouter.engine.locator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic 50/50 split: returns 0, 1, 0, 1, ... across calls.
 */
public final class AlternatingSelector {

    private final AtomicLong calls = new AtomicLong();

    /**
     * @return 0 or 1, alternating
     */
    public int next() {
        return (int) (calls.getAndIncrement() % 2);
    }

    public void reset() {
        calls.set(0);
    }
}
