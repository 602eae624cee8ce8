package org.ticketrouter.engine.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A staff member who can take tickets.
 *
 * All fields except the current load are immutable. The load may only be changed while the
 * caller holds {@link #loadLock()}; reads are always safe.
 */
public final class StaffMember {

    private final String id;
    private final String fullName;
    private final String facilityName;
    private final Position position;
    private final Set<Skill> skills;
    private final ReentrantLock loadLock = new ReentrantLock();

    private volatile int currentLoad;

    private StaffMember(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.fullName = Objects.requireNonNull(builder.fullName, "fullName must not be null");
        this.facilityName = Objects.requireNonNull(builder.facilityName, "facilityName must not be null");
        this.position = Objects.requireNonNull(builder.position, "position must not be null");
        this.skills = builder.skills.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.skills));
        this.currentLoad = builder.currentLoad;
    }

    public String getId() {
        return id;
    }

    public String getFullName() {
        return fullName;
    }

    public String getFacilityName() {
        return facilityName;
    }

    public Position getPosition() {
        return position;
    }

    public Set<Skill> getSkills() {
        return skills;
    }

    public boolean hasSkill(Skill skill) {
        return skills.contains(skill);
    }

    public int getCurrentLoad() {
        return currentLoad;
    }

    /**
     * Lock guarding the load counter of this member.
     */
    public ReentrantLock loadLock() {
        return loadLock;
    }

    /**
     * Adds one ticket to the load. Caller must hold {@link #loadLock()}.
     */
    public int incrementLoad() {
        requireLockHeld();
        currentLoad = currentLoad + 1;
        return currentLoad;
    }

    /**
     * Removes one ticket from the load. Caller must hold {@link #loadLock()}.
     */
    public int decrementLoad() {
        requireLockHeld();
        if (currentLoad <= 0) {
            throw new IllegalStateException("load of " + id + " is already " + currentLoad);
        }
        currentLoad = currentLoad - 1;
        return currentLoad;
    }

    private void requireLockHeld() {
        if (!loadLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("load lock of " + id + " not held by current thread");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StaffMember)) {
            return false;
        }
        return id.equals(((StaffMember) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("StaffMember{id='%s', name='%s', facility='%s', position=%s, skills=%s, load=%d}",
                id, fullName, facilityName, position, skills, currentLoad);
    }

    /**
     * Builder for StaffMember.
     */
    public static final class Builder {
        private String id;
        private String fullName;
        private String facilityName;
        private Position position = Position.SPECIALIST;
        private final Set<Skill> skills = EnumSet.noneOf(Skill.class);
        private int currentLoad;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder fullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        public Builder facilityName(String facilityName) {
            this.facilityName = facilityName;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder skill(Skill skill) {
            this.skills.add(Objects.requireNonNull(skill, "skill must not be null"));
            return this;
        }

        public Builder skills(Set<Skill> skills) {
            this.skills.clear();
            if (skills != null) {
                this.skills.addAll(skills);
            }
            return this;
        }

        /**
         * Initial load as reloaded from the roster source. Negative values are accepted here
         * and reported as corrupt data when a ticket touches the roster.
         */
        public Builder currentLoad(int currentLoad) {
            this.currentLoad = currentLoad;
            return this;
        }

        public StaffMember build() {
            return new StaffMember(this);
        }
    }
}
