package org.ticketrouter.engine.allocation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.ticketrouter.engine.domain.model.Language;
import org.ticketrouter.engine.domain.model.Position;
import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.eligibility.EligibilityProfile;
import org.ticketrouter.engine.exception.InconsistentStateException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.ticketrouter.engine.testutil.EngineFixtures.staff;

@DisplayName("FairnessAllocator Tests")
class FairnessAllocatorTest {

    private static final EligibilityProfile PLAIN = new EligibilityProfile(false, false, Language.RU, false);
    private static final EligibilityProfile VIP = new EligibilityProfile(true, false, Language.RU, false);

    private static Fingerprint fingerprint(EligibilityProfile profile) {
        return new Fingerprint("Астана", profile);
    }

    private static List<String> pick(FairnessAllocator allocator, List<StaffMember> pool,
                                     EligibilityProfile profile, int times) {
        List<String> picks = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            picks.add(allocator.allocate(pool, fingerprint(profile)).getStaffMember().getId());
        }
        return picks;
    }

    @Test
    @DisplayName("Two equal-load candidates strictly alternate A,B,A,B")
    void testStrictAlternation() {
        StaffMember a = staff("A", "Астана", Position.SPECIALIST, 0);
        StaffMember b = staff("B", "Астана", Position.SPECIALIST, 0);
        FairnessAllocator allocator = new FairnessAllocator();

        assertEquals(Arrays.asList("A", "B", "A", "B"), pick(allocator, Arrays.asList(a, b), PLAIN, 4));
        assertEquals(2, a.getCurrentLoad());
        assertEquals(2, b.getCurrentLoad());
    }

    @Test
    @DisplayName("Round-robin index is the slot of the chosen member")
    void testRoundRobinIndex() {
        List<StaffMember> pool = Arrays.asList(
                staff("A", "Астана", Position.SPECIALIST, 0),
                staff("B", "Астана", Position.SPECIALIST, 0));
        FairnessAllocator allocator = new FairnessAllocator();

        assertEquals(0, allocator.allocate(pool, fingerprint(PLAIN)).getRoundRobinIndex());
        assertEquals(1, allocator.allocate(pool, fingerprint(PLAIN)).getRoundRobinIndex());
        assertEquals(2, allocator.getCounters().valueOf(fingerprint(PLAIN)));
    }

    @Test
    @DisplayName("Only the two least-loaded members compete")
    void testLeastLoadedPair() {
        StaffMember busy = staff("A", "Астана", Position.SPECIALIST, 9);
        StaffMember b = staff("B", "Астана", Position.SPECIALIST, 1);
        StaffMember c = staff("C", "Астана", Position.SPECIALIST, 2);
        FairnessAllocator allocator = new FairnessAllocator();

        assertEquals(Arrays.asList("B", "C"), pick(allocator, Arrays.asList(busy, c, b), PLAIN, 2));
        assertEquals(9, busy.getCurrentLoad());
    }

    @Test
    @DisplayName("Three equal-load candidates all receive work and stay within one ticket")
    void testLargerPoolReachesEveryMember() {
        StaffMember a = staff("A", "Астана", Position.SPECIALIST, 0);
        StaffMember b = staff("B", "Астана", Position.SPECIALIST, 0);
        StaffMember c = staff("C", "Астана", Position.SPECIALIST, 0);
        List<StaffMember> pool = Arrays.asList(a, b, c);
        FairnessAllocator allocator = new FairnessAllocator();

        assertEquals(Arrays.asList("A", "C", "B", "B", "A", "C"), pick(allocator, pool, PLAIN, 6));

        for (int i = 0; i < 24; i++) {
            allocator.allocate(pool, fingerprint(PLAIN));
            int max = Math.max(a.getCurrentLoad(), Math.max(b.getCurrentLoad(), c.getCurrentLoad()));
            int min = Math.min(a.getCurrentLoad(), Math.min(b.getCurrentLoad(), c.getCurrentLoad()));
            assertTrue(max - min <= 1, "load spread " + min + ".." + max);
        }
        assertEquals(10, a.getCurrentLoad());
        assertEquals(10, b.getCurrentLoad());
        assertEquals(10, c.getCurrentLoad());
    }

    @Test
    @DisplayName("A strictly lighter member of the pair is taken regardless of the counter")
    void testLighterMemberWins() {
        StaffMember a = staff("A", "Астана", Position.SPECIALIST, 3);
        StaffMember b = staff("B", "Астана", Position.SPECIALIST, 0);
        FairnessAllocator allocator = new FairnessAllocator();

        assertEquals(Arrays.asList("B", "B", "B", "B", "A", "B"),
                pick(allocator, Arrays.asList(a, b), PLAIN, 6));
    }

    @Test
    @DisplayName("Single candidate is taken directly without touching the counter")
    void testSingleCandidate() {
        StaffMember only = staff("A", "Астана", Position.CHIEF_SPECIALIST, 4);
        FairnessAllocator allocator = new FairnessAllocator();

        Allocation allocation = allocator.allocate(Collections.singletonList(only), fingerprint(PLAIN));

        assertEquals(only, allocation.getStaffMember());
        assertEquals(0, allocation.getRoundRobinIndex());
        assertEquals(5, only.getCurrentLoad());
        assertEquals(0, allocator.getCounters().size());
    }

    @Test
    @DisplayName("Different fingerprints keep separate alternation sequences")
    void testFingerprintsIndependent() {
        List<StaffMember> pool = Arrays.asList(
                staff("A", "Астана", Position.SPECIALIST, 0),
                staff("B", "Астана", Position.SPECIALIST, 0));
        FairnessAllocator allocator = new FairnessAllocator();

        allocator.allocate(pool, fingerprint(PLAIN));
        Allocation vip = allocator.allocate(pool, fingerprint(VIP));

        assertEquals(0, vip.getRoundRobinIndex());
        assertEquals(1, allocator.getCounters().valueOf(fingerprint(PLAIN)));
        assertEquals(1, allocator.getCounters().valueOf(fingerprint(VIP)));
    }

    @Test
    @DisplayName("Reset clears counters")
    void testReset() {
        List<StaffMember> pool = Arrays.asList(
                staff("A", "Астана", Position.SPECIALIST, 0),
                staff("B", "Астана", Position.SPECIALIST, 0));
        FairnessAllocator allocator = new FairnessAllocator();
        allocator.allocate(pool, fingerprint(PLAIN));

        allocator.reset();

        assertEquals(0, allocator.getCounters().size());
        assertEquals(0, allocator.allocate(pool, fingerprint(PLAIN)).getRoundRobinIndex());
    }

    @Test
    @DisplayName("Empty pool is a caller error")
    void testEmptyPool() {
        assertThrows(IllegalArgumentException.class,
                () -> new FairnessAllocator().allocate(Collections.emptyList(), fingerprint(PLAIN)));
    }

    @Test
    @DisplayName("Negative load aborts without any mutation")
    void testNegativeLoad() {
        StaffMember broken = staff("A", "Астана", Position.SPECIALIST, -1);
        StaffMember fine = staff("B", "Астана", Position.SPECIALIST, 0);
        FairnessAllocator allocator = new FairnessAllocator();

        InconsistentStateException e = assertThrows(InconsistentStateException.class,
                () -> allocator.allocate(Arrays.asList(broken, fine), fingerprint(PLAIN)));

        assertEquals(InconsistentStateException.Kind.NEGATIVE_LOAD, e.getKind());
        assertEquals("A", e.getStaffId());
        assertEquals(0, fine.getCurrentLoad());
        assertEquals(0, allocator.getCounters().valueOf(fingerprint(PLAIN)));
    }

    @Test
    @DisplayName("Release takes one ticket off the load")
    void testRelease() {
        StaffMember member = staff("A", "Астана", Position.SPECIALIST, 1);
        FairnessAllocator allocator = new FairnessAllocator();

        allocator.release(member, "T-1");

        assertEquals(0, member.getCurrentLoad());
        InconsistentStateException e = assertThrows(InconsistentStateException.class,
                () -> allocator.release(member, "T-2"));
        assertEquals(InconsistentStateException.Kind.NEGATIVE_LOAD, e.getKind());
        assertEquals("T-2", e.getTicketId());
        assertEquals(0, member.getCurrentLoad());
    }

    @Test
    @Timeout(10)
    @DisplayName("Concurrent allocations never lose a load increment")
    void testConcurrentAllocationsConserveLoad() throws Exception {
        List<StaffMember> pool = Arrays.asList(
                staff("A", "Астана", Position.SPECIALIST, 0),
                staff("B", "Астана", Position.SPECIALIST, 0),
                staff("C", "Астана", Position.SPECIALIST, 0));
        List<StaffMember> reversed = new ArrayList<>(pool);
        Collections.reverse(reversed);
        FairnessAllocator allocator = new FairnessAllocator();

        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            // half the workers see the pool in reverse order and with another fingerprint
            List<StaffMember> view = t % 2 == 0 ? pool : reversed;
            EligibilityProfile profile = t % 2 == 0 ? PLAIN : VIP;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    allocator.allocate(view, fingerprint(profile));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        int total = pool.stream().mapToInt(StaffMember::getCurrentLoad).sum();
        assertEquals(threads * perThread, total);
        assertEquals(threads * perThread / 2, allocator.getCounters().valueOf(fingerprint(PLAIN)));
        assertEquals(threads * perThread / 2, allocator.getCounters().valueOf(fingerprint(VIP)));
    }
}
