package org.ticketrouter.engine.roster;

import org.ticketrouter.engine.domain.model.Facility;
import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.exception.InconsistentStateException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Facility set plus the staff affiliated with each facility.
 * Membership is fixed for the lifetime of the roster; only staff loads change.
 */
public final class StaffRoster {

    private static final Logger LOG = Logger.getLogger(StaffRoster.class.getName());

    private final Map<String, Facility> facilities;
    private final Map<String, List<StaffMember>> staffByFacility;
    private final Map<String, StaffMember> staffById;
    private final List<StaffMember> orphans;

    public StaffRoster(List<Facility> facilities, List<StaffMember> staff) {
        Objects.requireNonNull(facilities, "facilities must not be null");
        Objects.requireNonNull(staff, "staff must not be null");

        Map<String, Facility> facilityMap = new LinkedHashMap<>();
        for (Facility facility : facilities) {
            if (facilityMap.put(facility.getName(), facility) != null) {
                throw new IllegalArgumentException("duplicate facility name: " + facility.getName());
            }
        }

        Map<String, List<StaffMember>> grouped = new LinkedHashMap<>();
        Map<String, StaffMember> byId = new LinkedHashMap<>();
        List<StaffMember> orphanList = new ArrayList<>();
        for (StaffMember member : staff) {
            if (byId.put(member.getId(), member) != null) {
                throw new IllegalArgumentException("duplicate staff id: " + member.getId());
            }
            if (!facilityMap.containsKey(member.getFacilityName())) {
                orphanList.add(member);
                continue;
            }
            grouped.computeIfAbsent(member.getFacilityName(), k -> new ArrayList<>()).add(member);
        }
        grouped.values().forEach(list -> list.sort(Comparator.comparing(StaffMember::getId)));

        Map<String, List<StaffMember>> frozen = new LinkedHashMap<>();
        grouped.forEach((name, list) -> frozen.put(name, Collections.unmodifiableList(list)));

        this.facilities = Collections.unmodifiableMap(facilityMap);
        this.staffByFacility = Collections.unmodifiableMap(frozen);
        this.staffById = Collections.unmodifiableMap(byId);
        this.orphans = Collections.unmodifiableList(orphanList);

        if (!orphans.isEmpty()) {
            LOG.warning(() -> "Roster has " + orphans.size() + " staff member(s) with unknown facility");
        }
        LOG.info(() -> String.format("Roster: %d facilities, %d staff", facilityMap.size(), byId.size()));
    }

    /**
     * Facilities in reference-data order.
     */
    public List<Facility> getFacilities() {
        return new ArrayList<>(facilities.values());
    }

    public Optional<Facility> getFacility(String name) {
        return Optional.ofNullable(facilities.get(name));
    }

    /**
     * Staff of one facility, ordered by id. Empty for unknown facilities.
     */
    public List<StaffMember> getStaffAt(String facilityName) {
        return staffByFacility.getOrDefault(facilityName, Collections.emptyList());
    }

    public Optional<StaffMember> getStaffMember(String id) {
        return Optional.ofNullable(staffById.get(id));
    }

    public List<StaffMember> getAllStaff() {
        return new ArrayList<>(staffById.values());
    }

    /**
     * Sum of current loads of a facility's staff. Lock-free snapshot used for tie-breaking.
     */
    public int getAggregateLoad(String facilityName) {
        int total = 0;
        for (StaffMember member : getStaffAt(facilityName)) {
            total += member.getCurrentLoad();
        }
        return total;
    }

    /**
     * Sum of all staff loads.
     */
    public int getTotalLoad() {
        int total = 0;
        for (StaffMember member : staffById.values()) {
            total += member.getCurrentLoad();
        }
        return total;
    }

    /**
     * Fails when the roster shows signs of upstream corruption.
     *
     * @param ticketId ticket being processed, for the error tag
     * @throws InconsistentStateException on a staff member with an unknown facility or a negative load
     */
    public void verify(String ticketId) {
        if (!orphans.isEmpty()) {
            StaffMember orphan = orphans.get(0);
            throw new InconsistentStateException(InconsistentStateException.Kind.ORPHAN_STAFF, ticketId,
                    orphan.getId(), "facility '" + orphan.getFacilityName() + "' does not exist");
        }
        for (StaffMember member : staffById.values()) {
            int load = member.getCurrentLoad();
            if (load < 0) {
                throw new InconsistentStateException(InconsistentStateException.Kind.NEGATIVE_LOAD, ticketId,
                        member.getId(), "current load is " + load);
            }
        }
    }
}
