package org.ticketrouter.engine.allocation;

import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.exception.InconsistentStateException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Least-loaded-then-alternate allocation.
 *
 * The two lowest-load members (ties by id) form a pair kept in id order. When one of them carries
 * strictly less load it is taken; when their loads are equal the fingerprint's counter picks
 * slot {@code counter % 2}. The counter moves on every pick, so two equal-load candidates strictly
 * alternate, and the least-loaded member of a larger pool is always reached. The reported
 * round-robin index is the slot of the chosen member. A single candidate is taken directly
 * without touching the counter.
 *
 * Locking: the fingerprint's counter lock is taken first, then the load lock of every pool
 * member in id order. Loads are read, the pick is made and both the counter and the chosen
 * member's load move before any lock is released. Staff locks are always acquired in id order
 * and never before a counter lock, so concurrent allocations cannot deadlock.
 */
public final class FairnessAllocator {

    private static final Logger LOG = Logger.getLogger(FairnessAllocator.class.getName());

    private static final Comparator<StaffMember> BY_ID = Comparator.comparing(StaffMember::getId);

    private final RoundRobinCounters counters;

    public FairnessAllocator() {
        this(new RoundRobinCounters());
    }

    public FairnessAllocator(RoundRobinCounters counters) {
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
    }

    public RoundRobinCounters getCounters() {
        return counters;
    }

    /**
     * Pick one member of a non-empty pool and add one ticket to their load.
     *
     * @throws IllegalArgumentException if the pool is empty
     * @throws InconsistentStateException if a pool member has a negative load
     */
    public Allocation allocate(List<StaffMember> eligiblePool, Fingerprint fingerprint) {
        Objects.requireNonNull(eligiblePool, "eligiblePool must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        if (eligiblePool.isEmpty()) {
            throw new IllegalArgumentException("eligible pool is empty for " + fingerprint);
        }

        if (eligiblePool.size() == 1) {
            StaffMember only = eligiblePool.get(0);
            only.loadLock().lock();
            try {
                requireNonNegative(only, fingerprint);
                int load = only.incrementLoad();
                LOG.fine(() -> String.format("[Allocator] %s -> %s (only candidate, load=%d)",
                        fingerprint, only.getId(), load));
            } finally {
                only.loadLock().unlock();
            }
            return new Allocation(only, 0);
        }

        List<StaffMember> lockOrder = new ArrayList<>(eligiblePool);
        lockOrder.sort(BY_ID);

        RoundRobinCounters.Counter counter = counters.counterFor(fingerprint);
        counter.lock.lock();
        int locked = 0;
        try {
            for (StaffMember member : lockOrder) {
                member.loadLock().lock();
                locked++;
            }

            List<int[]> loads = new ArrayList<>(lockOrder.size());
            for (int i = 0; i < lockOrder.size(); i++) {
                StaffMember member = lockOrder.get(i);
                requireNonNegative(member, fingerprint);
                loads.add(new int[]{member.getCurrentLoad(), i});
            }
            // stable: equal loads keep id order
            loads.sort(Comparator.comparingInt(entry -> entry[0]));

            // loads pick the pair, id order fixes the slots
            int first = Math.min(loads.get(0)[1], loads.get(1)[1]);
            int second = Math.max(loads.get(0)[1], loads.get(1)[1]);

            int firstLoad = lockOrder.get(first).getCurrentLoad();
            int secondLoad = lockOrder.get(second).getCurrentLoad();
            // the lighter member wins outright; only a tie consults the counter
            int index = firstLoad == secondLoad
                    ? counter.value % 2
                    : (firstLoad < secondLoad ? 0 : 1);
            counter.value++;
            StaffMember chosen = lockOrder.get(index == 0 ? first : second);
            StaffMember other = lockOrder.get(index == 0 ? second : first);
            int load = chosen.incrementLoad();

            LOG.fine(() -> String.format("[Allocator] %s -> %s (rr=%d, load=%d, other=%s)",
                    fingerprint, chosen.getId(), index, load, other.getId()));
            return new Allocation(chosen, index);
        } finally {
            for (int i = locked - 1; i >= 0; i--) {
                lockOrder.get(i).loadLock().unlock();
            }
            counter.lock.unlock();
        }
    }

    /**
     * Take one ticket off a member's load, e.g. when a stored result is released.
     *
     * @param ticketId ticket being released, for error reporting; may be null
     * @throws InconsistentStateException if the member has no load left to release
     */
    public void release(StaffMember member, String ticketId) {
        Objects.requireNonNull(member, "member must not be null");
        member.loadLock().lock();
        try {
            if (member.getCurrentLoad() <= 0) {
                throw new InconsistentStateException(InconsistentStateException.Kind.NEGATIVE_LOAD, ticketId,
                        member.getId(), "release would take load below zero, current load is "
                        + member.getCurrentLoad());
            }
            int load = member.decrementLoad();
            LOG.fine(() -> "[Allocator] Released one ticket from " + member.getId() + ", load=" + load);
        } finally {
            member.loadLock().unlock();
        }
    }

    /**
     * Forget all alternation state.
     */
    public void reset() {
        counters.clear();
        LOG.info("[Allocator] Round-robin counters cleared");
    }

    private static void requireNonNegative(StaffMember member, Fingerprint fingerprint) {
        if (member.getCurrentLoad() < 0) {
            throw new InconsistentStateException(InconsistentStateException.Kind.NEGATIVE_LOAD, null,
                    member.getId(), "current load is " + member.getCurrentLoad() + " in pool " + fingerprint);
        }
    }
}
