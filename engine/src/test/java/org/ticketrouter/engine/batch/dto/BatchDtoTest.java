package org.ticketrouter.engine.batch.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ticketrouter.engine.domain.model.AssignmentResult;
import org.ticketrouter.engine.domain.model.FacilitySelection;
import org.ticketrouter.engine.domain.model.GeoPoint;
import org.ticketrouter.engine.domain.model.Language;
import org.ticketrouter.engine.domain.model.Position;
import org.ticketrouter.engine.domain.model.ResolvedLocation;
import org.ticketrouter.engine.domain.model.Segment;
import org.ticketrouter.engine.domain.model.Sentiment;
import org.ticketrouter.engine.domain.model.TicketAttributes;
import org.ticketrouter.engine.domain.model.TicketType;
import org.ticketrouter.engine.domain.model.UnassignedReason;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.ticketrouter.engine.testutil.EngineFixtures.AKTAU;
import static org.ticketrouter.engine.testutil.EngineFixtures.staff;

@DisplayName("Batch DTO Tests")
class BatchDtoTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    // ===== Input =====

    @Test
    @DisplayName("Russian labels map to ticket attributes")
    void testTicketFromRussianLabels() throws Exception {
        String json = "{\"ticket_id\":\"T-1\",\"segment\":\"VIP\",\"ticket_type\":\"Смена данных\","
                + "\"sentiment\":\"Негативный\",\"language\":\"ENG\",\"country\":\"Казахстан\","
                + "\"region\":\"Мангистауская\",\"city\":\"Актау\",\"street\":\"мкр 14\",\"house\":\"5\","
                + "\"summary\":\"ignored\"}";

        TicketAttributes ticket = mapper.readValue(json, TicketDto.class).toAttributes();

        assertEquals("T-1", ticket.getTicketId());
        assertEquals(Segment.VIP, ticket.getSegment());
        assertEquals(TicketType.DATA_CHANGE, ticket.getTicketType());
        assertEquals(Sentiment.NEGATIVE, ticket.getSentiment());
        assertEquals(Language.ENG, ticket.getLanguage());
        assertEquals("Актау", ticket.getCity());
        assertEquals("мкр 14", ticket.getStreet());
    }

    @Test
    @DisplayName("Missing or unknown labels fall back to defaults")
    void testTicketDefaults() throws Exception {
        TicketAttributes ticket = mapper.readValue("{\"ticket_id\":\"T-2\",\"ticket_type\":\"???\"}",
                TicketDto.class).toAttributes();

        assertEquals(Segment.MASS, ticket.getSegment());
        assertEquals(TicketType.CONSULTATION, ticket.getTicketType());
        assertEquals(Sentiment.NEUTRAL, ticket.getSentiment());
        assertEquals(Language.RU, ticket.getLanguage());
        assertFalse(ticket.isSpam());
    }

    @Test
    @DisplayName("Spam label is recognised")
    void testSpamLabel() throws Exception {
        TicketAttributes ticket = mapper.readValue("{\"ticket_id\":\"T-3\",\"ticket_type\":\"Спам\"}",
                TicketDto.class).toAttributes();

        assertTrue(ticket.isSpam());
    }

    // ===== Output =====

    @Test
    @DisplayName("Assigned result serialises with coordinates and staff")
    void testAssignedResultJson() {
        AssignmentResult result = new AssignmentResult.Builder()
                .ticketId("T-1")
                .assigned(AKTAU, staff("AK1", AKTAU, Position.SPECIALIST, 1))
                .location(ResolvedLocation.resolved(new GeoPoint(43.64, 51.17), ResolvedLocation.Tier.OFFLINE_EXACT))
                .selection(FacilitySelection.SINGLE_OFFICE_SHORTCUT)
                .roundRobinIndex(1)
                .assignedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        JsonNode json = mapper.valueToTree(AssignmentResultDto.from(result));

        assertEquals("T-1", json.get("ticket_id").asText());
        assertEquals("ASSIGNED", json.get("outcome").asText());
        assertEquals(AKTAU, json.get("office").asText());
        assertEquals("AK1", json.get("manager_id").asText());
        assertEquals(43.64, json.get("client_lat").asDouble(), 1e-9);
        assertEquals("OFFLINE_EXACT", json.get("geo_tier").asText());
        assertEquals("SINGLE_OFFICE_SHORTCUT", json.get("selection").asText());
        assertEquals(1, json.get("round_robin_index").asInt());
        assertEquals("2024-05-01T10:00:00Z", json.get("assigned_at").asText());
        assertFalse(json.has("unassigned_reason"));
    }

    @Test
    @DisplayName("Unassigned result omits staff fields")
    void testUnassignedResultJson() {
        AssignmentResult result = new AssignmentResult.Builder()
                .ticketId("T-9")
                .unassigned(UnassignedReason.NO_ELIGIBLE_STAFF)
                .facilityName(AKTAU)
                .fallbackUsed(true)
                .build();

        JsonNode json = mapper.valueToTree(AssignmentResultDto.from(result));

        assertEquals("UNASSIGNED", json.get("outcome").asText());
        assertEquals("NO_ELIGIBLE_STAFF", json.get("unassigned_reason").asText());
        assertTrue(json.get("fallback_used").asBoolean());
        assertFalse(json.has("manager_id"));
        assertFalse(json.has("client_lat"));
    }
}
