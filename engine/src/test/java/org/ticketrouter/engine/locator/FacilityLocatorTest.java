package org.ticketrouter.engine.locator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ticketrouter.engine.domain.model.FacilitySelection;
import org.ticketrouter.engine.domain.model.GeoPoint;
import org.ticketrouter.engine.domain.model.Position;
import org.ticketrouter.engine.domain.model.ResolvedLocation;
import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.roster.StaffRoster;
import org.ticketrouter.engine.testutil.EngineFixtures;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.ticketrouter.engine.testutil.EngineFixtures.AKTAU;
import static org.ticketrouter.engine.testutil.EngineFixtures.ALMATY;
import static org.ticketrouter.engine.testutil.EngineFixtures.ASTANA;
import static org.ticketrouter.engine.testutil.EngineFixtures.ATYRAU;
import static org.ticketrouter.engine.testutil.EngineFixtures.KARAGANDA;

@DisplayName("FacilityLocator Tests")
class FacilityLocatorTest {

    private static final ResolvedLocation NOT_FOUND =
            ResolvedLocation.unresolved(ResolvedLocation.UnresolvedReason.NOT_FOUND);
    private static final ResolvedLocation FOREIGN =
            ResolvedLocation.unresolved(ResolvedLocation.UnresolvedReason.FOREIGN_COUNTRY);
    private static final ResolvedLocation UNKNOWN_COUNTRY =
            ResolvedLocation.unresolved(ResolvedLocation.UnresolvedReason.UNKNOWN_COUNTRY);

    private static FacilityLocator locator(List<StaffMember> staff) {
        StaffRoster roster = new StaffRoster(EngineFixtures.facilities(), staff);
        return new FacilityLocator(roster, EngineFixtures.geoTables(), EngineFixtures.HUBS,
                EngineFixtures.EQUIDISTANT_RADIUS_KM, EngineFixtures.FUZZY_THRESHOLD);
    }

    private static ResolvedLocation at(double lat, double lon) {
        return ResolvedLocation.resolved(new GeoPoint(lat, lon), ResolvedLocation.Tier.OFFLINE_EXACT);
    }

    // ========== Single office shortcut ==========

    @Test
    @DisplayName("City with exactly one office short-circuits distance ranking")
    void testSingleOfficeShortcut() {
        FacilityLocator locator = locator(Collections.emptyList());

        RankedFacilities ranked = locator.locate(at(43.2220, 76.8512), "Aktau", null);

        assertEquals(AKTAU, ranked.primary().getName());
        assertEquals(FacilitySelection.SINGLE_OFFICE_SHORTCUT, ranked.getSelection());
        assertEquals(1, ranked.getCandidates().size());
        assertTrue(Double.isNaN(ranked.getCandidates().get(0).getDistanceKm()));
    }

    @Test
    @DisplayName("Shortcut also applies when coordinates could not be resolved")
    void testShortcutWithUnresolvedLocation() {
        FacilityLocator locator = locator(Collections.emptyList());

        RankedFacilities ranked = locator.locate(NOT_FOUND, "Караганда", null);

        assertEquals(KARAGANDA, ranked.primary().getName());
        assertEquals(FacilitySelection.SINGLE_OFFICE_SHORTCUT, ranked.getSelection());
    }

    @Test
    @DisplayName("Misspelled office city is matched fuzzily")
    void testFuzzyShortcut() {
        FacilityLocator locator = locator(Collections.emptyList());

        assertEquals(KARAGANDA, locator.singleOfficeFor("Карганда").get().getName());
        assertFalse(locator.singleOfficeFor("Темиртау").isPresent());
        assertFalse(locator.singleOfficeFor(" ").isPresent());
    }

    @Test
    @DisplayName("A street address disables the shortcut in favour of distance ranking")
    void testStreetDisablesShortcut() {
        FacilityLocator locator = locator(Collections.emptyList());

        RankedFacilities ranked = locator.locate(at(43.6415, 51.1727), "Aktau", "мкр 14");

        assertEquals(AKTAU, ranked.primary().getName());
        assertEquals(FacilitySelection.NEAREST, ranked.getSelection());
        assertFalse(locator.shortcutFor("Aktau", "мкр 14").isPresent());
        assertTrue(locator.shortcutFor("Aktau", " ").isPresent());
    }

    // ========== Fallback hubs ==========

    @Test
    @DisplayName("Client without a country goes to the hubs even when the city has an office")
    void testUnknownCountryBypassesShortcut() {
        FacilityLocator locator = locator(Collections.emptyList());

        RankedFacilities ranked = locator.locate(UNKNOWN_COUNTRY, "Актау", null);

        assertEquals(FacilitySelection.FALLBACK_HUB, ranked.getSelection());
        assertEquals(ASTANA, ranked.primary().getName());
    }

    @Test
    @DisplayName("Foreign client goes to the hubs even when the city has an office")
    void testForeignBypassesShortcut() {
        FacilityLocator locator = locator(Collections.emptyList());

        RankedFacilities ranked = locator.locate(FOREIGN, "Алматы", null);

        assertEquals(FacilitySelection.FALLBACK_HUB, ranked.getSelection());
        assertEquals(ASTANA, ranked.primary().getName());
        assertEquals(2, ranked.getCandidates().size());
    }

    @Test
    @DisplayName("Unresolved locations alternate between the two hubs")
    void testHubAlternation() {
        FacilityLocator locator = locator(Collections.emptyList());

        assertEquals(ASTANA, locator.locate(NOT_FOUND, null, null).primary().getName());
        assertEquals(ALMATY, locator.locate(FOREIGN, null, null).primary().getName());
        assertEquals(ASTANA, locator.locate(NOT_FOUND, "", null).primary().getName());
        assertEquals(ALMATY, locator.locate(NOT_FOUND, null, null).getCandidates().get(0).getFacility().getName());
    }

    @Test
    @DisplayName("Reset restarts hub alternation")
    void testResetHubAlternation() {
        FacilityLocator locator = locator(Collections.emptyList());
        locator.locate(NOT_FOUND, null, null);

        locator.reset();

        assertEquals(ASTANA, locator.locate(NOT_FOUND, null, null).primary().getName());
    }

    @Test
    @DisplayName("Hub list must name two known facilities")
    void testInvalidHubs() {
        StaffRoster roster = new StaffRoster(EngineFixtures.facilities(), Collections.emptyList());

        assertThrows(IllegalArgumentException.class, () -> new FacilityLocator(roster, EngineFixtures.geoTables(),
                Collections.singletonList(ASTANA), 50.0, 0.75));
        assertThrows(IllegalArgumentException.class, () -> new FacilityLocator(roster, EngineFixtures.geoTables(),
                Arrays.asList(ASTANA, "Шымкент"), 50.0, 0.75));
    }

    // ========== Distance ranking ==========

    @Test
    @DisplayName("Clear nearest office is chosen by haversine distance")
    void testNearest() {
        FacilityLocator locator = locator(Collections.emptyList());

        RankedFacilities ranked = locator.locate(at(50.0597, 72.9594), "Темиртау", null);

        assertEquals(FacilitySelection.NEAREST, ranked.getSelection());
        assertEquals(KARAGANDA, ranked.primary().getName());
        assertEquals(ASTANA, ranked.getCandidates().get(1).getFacility().getName());
        assertEquals(5, ranked.getCandidates().size());
        assertEquals(28.6, ranked.getCandidates().get(0).getDistanceKm(), 0.5);
    }

    @Test
    @DisplayName("Within the equidistant radius the less loaded office wins")
    void testLoadTieBreakSwaps() {
        FacilityLocator locator = locator(Arrays.asList(
                EngineFixtures.staff("A1", AKTAU, Position.SPECIALIST, 5),
                EngineFixtures.staff("T1", ATYRAU, Position.SPECIALIST, 1)));

        RankedFacilities ranked = locator.locate(at(45.30, 51.55), null, null);

        assertEquals(FacilitySelection.LOAD_TIE_BREAK, ranked.getSelection());
        assertEquals(ATYRAU, ranked.primary().getName());
        assertEquals(AKTAU, ranked.getCandidates().get(1).getFacility().getName());
    }

    @Test
    @DisplayName("Equal loads within the radius keep the nearer office")
    void testLoadTieBreakKeepsNearest() {
        FacilityLocator locator = locator(Arrays.asList(
                EngineFixtures.staff("A1", AKTAU, Position.SPECIALIST, 2),
                EngineFixtures.staff("T1", ATYRAU, Position.SPECIALIST, 2)));

        RankedFacilities ranked = locator.locate(at(45.30, 51.55), null, null);

        assertEquals(FacilitySelection.LOAD_TIE_BREAK, ranked.getSelection());
        assertEquals(AKTAU, ranked.primary().getName());
    }

    @Test
    @DisplayName("Second office beyond the radius is never preferred")
    void testNoTieBreakBeyondRadius() {
        FacilityLocator locator = locator(Arrays.asList(
                EngineFixtures.staff("A1", AKTAU, Position.SPECIALIST, 40),
                EngineFixtures.staff("T1", ATYRAU, Position.SPECIALIST, 0)));

        RankedFacilities ranked = locator.locate(at(44.0, 51.3), null, null);

        assertEquals(FacilitySelection.NEAREST, ranked.getSelection());
        assertEquals(AKTAU, ranked.primary().getName());
    }
}
