package org.ticketrouter.engine.batch;

import org.ticketrouter.engine.domain.model.AssignmentResult;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one batch run. Results are in input order with spam tickets left out.
 */
public final class BatchReport {

    private final List<AssignmentResult> results;
    private final int spamSkipped;

    public BatchReport(List<AssignmentResult> results, int spamSkipped) {
        this.results = Collections.unmodifiableList(results);
        this.spamSkipped = spamSkipped;
    }

    public List<AssignmentResult> getResults() {
        return results;
    }

    public int getSpamSkipped() {
        return spamSkipped;
    }

    public long getAssignedCount() {
        return results.stream().filter(AssignmentResult::isAssigned).count();
    }

    public long getUnassignedCount() {
        return results.size() - getAssignedCount();
    }

    public long getFallbackCount() {
        return results.stream().filter(AssignmentResult::isFallbackUsed).count();
    }

    @Override
    public String toString() {
        return String.format("BatchReport{processed=%d, assigned=%d, unassigned=%d, fallback=%d, spamSkipped=%d}",
                results.size(), getAssignedCount(), getUnassignedCount(), getFallbackCount(), spamSkipped);
    }
}
