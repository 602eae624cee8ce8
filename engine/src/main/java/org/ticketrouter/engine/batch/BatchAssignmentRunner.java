package org.ticketrouter.engine.batch;

import org.ticketrouter.engine.domain.model.AssignmentResult;
import org.ticketrouter.engine.domain.model.TicketAttributes;
import org.ticketrouter.engine.domain.service.AssignmentService;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Feeds a list of tickets through the assignment service.
 *
 * With one worker tickets are processed on the calling thread in input order. With more, they
 * are submitted to a fixed pool in input order; the greedy outcome then depends on scheduling.
 * Each run starts from fresh round-robin counters and hub alternation.
 */
public final class BatchAssignmentRunner {

    private static final Logger LOG = Logger.getLogger(BatchAssignmentRunner.class.getName());

    private final AssignmentService assignmentService;
    private final int workerCount;

    public BatchAssignmentRunner(AssignmentService assignmentService, int workerCount) {
        this.assignmentService = Objects.requireNonNull(assignmentService, "assignmentService must not be null");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.workerCount = workerCount;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Process every non-spam ticket.
     *
     * @throws org.ticketrouter.engine.exception.InconsistentStateException if the roster is corrupt;
     *         tickets already processed keep their results in the service
     */
    public BatchReport run(List<TicketAttributes> tickets) {
        Objects.requireNonNull(tickets, "tickets must not be null");

        List<TicketAttributes> routable = new ArrayList<>(tickets.size());
        int spam = 0;
        for (TicketAttributes ticket : tickets) {
            if (ticket.isSpam()) {
                spam++;
            } else {
                routable.add(ticket);
            }
        }
        int spamSkipped = spam;
        LOG.info(() -> String.format("[Batch] Routing %d tickets with %d worker(s), %d spam skipped",
                routable.size(), workerCount, spamSkipped));

        assignmentService.resetAllocatorState();

        List<AssignmentResult> results = workerCount == 1
                ? runSequential(routable)
                : runParallel(routable);

        BatchReport report = new BatchReport(results, spamSkipped);
        LOG.info(() -> "[Batch] " + report);
        return report;
    }

    private List<AssignmentResult> runSequential(List<TicketAttributes> tickets) {
        List<AssignmentResult> results = new ArrayList<>(tickets.size());
        for (TicketAttributes ticket : tickets) {
            results.add(assignmentService.process(ticket));
        }
        return results;
    }

    private List<AssignmentResult> runParallel(List<TicketAttributes> tickets) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "assignment-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<AssignmentResult>> futures = new ArrayList<>(tickets.size());
            for (TicketAttributes ticket : tickets) {
                futures.add(executor.submit(() -> assignmentService.process(ticket)));
            }
            List<AssignmentResult> results = new ArrayList<>(tickets.size());
            for (Future<AssignmentResult> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static AssignmentResult await(Future<AssignmentResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for assignment", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Assignment failed", cause);
        }
    }
}
