package org.ticketrouter.engine.domain.model;

/**
 * Staff competency tags.
 */
public enum Skill {
    VIP,
    KZ,
    ENG
}
