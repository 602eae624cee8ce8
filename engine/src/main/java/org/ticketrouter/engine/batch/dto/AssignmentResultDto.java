package org.ticketrouter.engine.batch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.ticketrouter.engine.domain.model.AssignmentResult;
import org.ticketrouter.engine.domain.model.ResolvedLocation;

import java.time.Instant;

/**
 * Assignment result as written to the host's output file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AssignmentResultDto {

    @JsonProperty("ticket_id")
    private String ticketId;

    @JsonProperty("outcome")
    private String outcome;

    @JsonProperty("office")
    private String office;

    @JsonProperty("manager_id")
    private String managerId;

    @JsonProperty("manager_name")
    private String managerName;

    @JsonProperty("client_lat")
    private Double clientLat;

    @JsonProperty("client_lon")
    private Double clientLon;

    @JsonProperty("geo_tier")
    private String geoTier;

    @JsonProperty("unresolved_reason")
    private String unresolvedReason;

    @JsonProperty("selection")
    private String selection;

    @JsonProperty("fallback_used")
    private boolean fallbackUsed;

    @JsonProperty("round_robin_index")
    private int roundRobinIndex;

    @JsonProperty("unassigned_reason")
    private String unassignedReason;

    @JsonProperty("assigned_at")
    private Instant assignedAt;

    public static AssignmentResultDto from(AssignmentResult result) {
        AssignmentResultDto dto = new AssignmentResultDto();
        dto.ticketId = result.getTicketId();
        dto.outcome = result.getOutcome().name();
        dto.office = result.getFacilityName();
        dto.managerId = result.getStaffId();
        dto.managerName = result.getStaffName();
        ResolvedLocation location = result.getLocation();
        if (location != null) {
            if (location.isResolved()) {
                dto.clientLat = location.getPoint().getLatitude();
                dto.clientLon = location.getPoint().getLongitude();
                dto.geoTier = location.getTier().name();
            } else {
                dto.unresolvedReason = location.getUnresolvedReason().name();
            }
        }
        dto.selection = result.getSelection() != null ? result.getSelection().name() : null;
        dto.fallbackUsed = result.isFallbackUsed();
        dto.roundRobinIndex = result.getRoundRobinIndex();
        dto.unassignedReason = result.getUnassignedReason() != null ? result.getUnassignedReason().name() : null;
        dto.assignedAt = result.getAssignedAt();
        return dto;
    }

    public String getTicketId() {
        return ticketId;
    }

    public String getOutcome() {
        return outcome;
    }

    public String getOffice() {
        return office;
    }

    public String getManagerId() {
        return managerId;
    }

    public String getManagerName() {
        return managerName;
    }

    public Double getClientLat() {
        return clientLat;
    }

    public Double getClientLon() {
        return clientLon;
    }

    public String getGeoTier() {
        return geoTier;
    }

    public String getUnresolvedReason() {
        return unresolvedReason;
    }

    public String getSelection() {
        return selection;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public int getRoundRobinIndex() {
        return roundRobinIndex;
    }

    public String getUnassignedReason() {
        return unassignedReason;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }
}
