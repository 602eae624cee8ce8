package org.ticketrouter.engine.domain.service;

import org.ticketrouter.engine.allocation.Allocation;
import org.ticketrouter.engine.allocation.FairnessAllocator;
import org.ticketrouter.engine.allocation.Fingerprint;
import org.ticketrouter.engine.domain.model.AssignmentResult;
import org.ticketrouter.engine.domain.model.Facility;
import org.ticketrouter.engine.domain.model.ResolvedLocation;
import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.domain.model.TicketAttributes;
import org.ticketrouter.engine.domain.model.UnassignedReason;
import org.ticketrouter.engine.eligibility.EligibilityFilter;
import org.ticketrouter.engine.eligibility.EligibilityProfile;
import org.ticketrouter.engine.exception.InconsistentStateException;
import org.ticketrouter.engine.geo.GeoResolver;
import org.ticketrouter.engine.locator.FacilityLocator;
import org.ticketrouter.engine.locator.RankedFacilities;
import org.ticketrouter.engine.roster.StaffRoster;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of AssignmentService.
 *
 * Per ticket: geo resolution, facility ranking, eligibility filtering and allocation, escalating
 * to the two fallback hubs when the primary facility has nobody eligible. Calls for the same
 * ticket id are serialized; calls for different tickets only contend on the staff and counter
 * locks taken by the allocator.
 */
public final class AssignmentServiceImpl implements AssignmentService {

    private static final Logger LOG = Logger.getLogger(AssignmentServiceImpl.class.getName());

    private final GeoResolver geoResolver;
    private final FacilityLocator facilityLocator;
    private final EligibilityFilter eligibilityFilter;
    private final FairnessAllocator allocator;
    private final StaffRoster roster;
    private final AssignmentResultStore store;
    private final ConcurrentMap<String, ReentrantLock> ticketLocks = new ConcurrentHashMap<>();

    public AssignmentServiceImpl(GeoResolver geoResolver,
                                 FacilityLocator facilityLocator,
                                 EligibilityFilter eligibilityFilter,
                                 FairnessAllocator allocator,
                                 StaffRoster roster,
                                 AssignmentResultStore store) {
        this.geoResolver = Objects.requireNonNull(geoResolver, "geoResolver must not be null");
        this.facilityLocator = Objects.requireNonNull(facilityLocator, "facilityLocator must not be null");
        this.eligibilityFilter = Objects.requireNonNull(eligibilityFilter, "eligibilityFilter must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.roster = Objects.requireNonNull(roster, "roster must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public AssignmentResult process(TicketAttributes ticket) {
        Objects.requireNonNull(ticket, "ticket must not be null");
        String ticketId = ticket.getTicketId();

        ReentrantLock ticketLock = ticketLocks.computeIfAbsent(ticketId, k -> new ReentrantLock());
        ticketLock.lock();
        try {
            Optional<AssignmentResult> existing = store.find(ticketId);
            if (existing.isPresent()) {
                LOG.fine(() -> "[Assign] Ticket " + ticketId + " already processed, reusing result");
                return existing.get();
            }

            AssignmentResult result = route(ticket);
            store.save(result);
            LOG.info(() -> "[Assign] " + result);
            return result;
        } catch (InconsistentStateException e) {
            LOG.log(Level.SEVERE, e, () -> "[Assign] Aborted ticket " + ticketId + ": inconsistent roster");
            throw e;
        } finally {
            ticketLock.unlock();
        }
    }

    private AssignmentResult route(TicketAttributes ticket) {
        String ticketId = ticket.getTicketId();

        if (ticket.isSpam()) {
            LOG.warning(() -> "[Assign] Spam ticket " + ticketId + " reached the engine, not routing");
            return new AssignmentResult.Builder()
                    .ticketId(ticketId)
                    .unassigned(UnassignedReason.SPAM_NOT_ROUTED)
                    .build();
        }

        // Nothing below may run on a corrupt roster: hub alternation and loads are mutated.
        roster.verify(ticketId);

        String country = ticket.getCountry();
        String city = ticket.getCity();
        String street = ticket.getStreet();
        // shortcut offices need no provider lookup; local tiers still fill in coordinates
        boolean shortcut = facilityLocator.shortcutFor(city, street).isPresent();
        ResolvedLocation location = shortcut
                ? geoResolver.resolveOffline(country, ticket.getRegion(), city, street)
                : geoResolver.resolve(country, ticket.getRegion(), city, street);
        RankedFacilities ranked = facilityLocator.locate(location, city, street);
        Facility primary = ranked.primary();
        EligibilityProfile profile = EligibilityProfile.of(ticket);

        LOG.fine(() -> String.format("[Assign] Ticket %s: %s, %s, profile %s",
                ticketId, location, ranked, profile));

        List<Facility> attempts = new ArrayList<>();
        attempts.add(primary);
        for (Facility hub : facilityLocator.getFallbackHubs()) {
            if (!attempts.contains(hub)) {
                attempts.add(hub);
            }
        }

        for (Facility facility : attempts) {
            List<StaffMember> pool = eligibilityFilter.filter(roster.getStaffAt(facility.getName()), profile);
            if (pool.isEmpty()) {
                LOG.fine(() -> "[Assign] No eligible staff at " + facility.getName() + " for ticket " + ticketId);
                continue;
            }

            Allocation allocation = allocator.allocate(pool, new Fingerprint(facility.getName(), profile));
            boolean fallbackUsed = !facility.equals(primary);
            if (fallbackUsed) {
                LOG.info(() -> String.format("[Assign] Ticket %s escalated from %s to %s",
                        ticketId, primary.getName(), facility.getName()));
            }
            return new AssignmentResult.Builder()
                    .ticketId(ticketId)
                    .assigned(facility.getName(), allocation.getStaffMember())
                    .location(location)
                    .selection(ranked.getSelection())
                    .fallbackUsed(fallbackUsed)
                    .roundRobinIndex(allocation.getRoundRobinIndex())
                    .build();
        }

        LOG.warning(() -> "[Assign] Ticket " + ticketId + " has no eligible staff at "
                + primary.getName() + " or any fallback hub; needs manual triage");
        return new AssignmentResult.Builder()
                .ticketId(ticketId)
                .unassigned(UnassignedReason.NO_ELIGIBLE_STAFF)
                .facilityName(primary.getName())
                .location(location)
                .selection(ranked.getSelection())
                .fallbackUsed(attempts.size() > 1)
                .build();
    }

    @Override
    public void resetAllocatorState() {
        allocator.reset();
        facilityLocator.reset();
        LOG.info("[Assign] Allocator state reset");
    }

    @Override
    public Optional<AssignmentResult> release(String ticketId) {
        Objects.requireNonNull(ticketId, "ticketId must not be null");
        ReentrantLock ticketLock = ticketLocks.computeIfAbsent(ticketId, k -> new ReentrantLock());
        ticketLock.lock();
        try {
            Optional<AssignmentResult> stored = store.find(ticketId);
            stored.filter(AssignmentResult::isAssigned).ifPresent(result -> {
                StaffMember member = roster.getStaffMember(result.getStaffId()).orElseThrow(() ->
                        new InconsistentStateException(InconsistentStateException.Kind.ORPHAN_STAFF, ticketId,
                                result.getStaffId(), "assigned staff member is not in the roster"));
                allocator.release(member, ticketId);
            });
            // the load is back, only now forget the result
            Optional<AssignmentResult> removed = store.remove(ticketId);
            removed.ifPresent(result -> LOG.info(() -> "[Assign] Released ticket " + ticketId));
            return removed;
        } finally {
            ticketLock.unlock();
        }
    }

    @Override
    public Optional<AssignmentResult> result(String ticketId) {
        return store.find(ticketId);
    }

    @Override
    public List<AssignmentResult> results() {
        return store.findAll();
    }
}
