package org.ticketrouter.engine.domain.model;

/**
 * How the primary facility of a ticket was chosen.
 */
public enum FacilitySelection {
    /** City maps to exactly one office; no distance computed. */
    SINGLE_OFFICE_SHORTCUT,
    /** Nearest office by great-circle distance. */
    NEAREST,
    /** Two nearest offices were close enough that the less loaded one won. */
    LOAD_TIE_BREAK,
    /** Location unresolved or foreign; alternating default hub. */
    FALLBACK_HUB
}
