package org.ticketrouter.engine.exception;

/**
 * Raised when roster data is corrupt in a way the engine must not paper over.
 * Processing of the affected ticket is abandoned before any mutation.
 */
public class InconsistentStateException extends RuntimeException {

    /**
     * Kind of corruption detected.
     */
    public enum Kind {
        /** Staff member affiliated with a facility that is not in the facility set. */
        ORPHAN_STAFF,
        /** Staff member with a negative current load. */
        NEGATIVE_LOAD
    }

    private final Kind kind;
    private final String ticketId;
    private final String staffId;

    public InconsistentStateException(Kind kind, String ticketId, String staffId, String message) {
        super("[" + kind + "] ticket=" + ticketId + " staff=" + staffId + ": " + message);
        this.kind = kind;
        this.ticketId = ticketId;
        this.staffId = staffId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getTicketId() {
        return ticketId;
    }

    public String getStaffId() {
        return staffId;
    }
}
