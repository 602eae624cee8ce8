package org.ticketrouter.engine.locator;

import org.ticketrouter.engine.domain.model.Facility;
import org.ticketrouter.engine.domain.model.FacilitySelection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Candidate facilities for a ticket, best first.
 */
public final class RankedFacilities {

    /**
     * One candidate with its great-circle distance; distance is NaN when none was computed.
     */
    public static final class Candidate {
        private final Facility facility;
        private final double distanceKm;

        public Candidate(Facility facility, double distanceKm) {
            this.facility = Objects.requireNonNull(facility, "facility must not be null");
            this.distanceKm = distanceKm;
        }

        public Facility getFacility() {
            return facility;
        }

        public double getDistanceKm() {
            return distanceKm;
        }

        @Override
        public String toString() {
            return Double.isNaN(distanceKm)
                    ? facility.getName()
                    : String.format("%s(%.1fkm)", facility.getName(), distanceKm);
        }
    }

    private final List<Candidate> candidates;
    private final FacilitySelection selection;

    public RankedFacilities(List<Candidate> candidates, FacilitySelection selection) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate facility is required");
        }
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.selection = Objects.requireNonNull(selection, "selection must not be null");
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public Facility primary() {
        return candidates.get(0).getFacility();
    }

    public FacilitySelection getSelection() {
        return selection;
    }

    @Override
    public String toString() {
        return "RankedFacilities{" + selection + " " + candidates + "}";
    }
}
