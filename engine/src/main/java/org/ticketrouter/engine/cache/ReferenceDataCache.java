package org.ticketrouter.engine.cache;

import org.ticketrouter.engine.domain.model.Facility;
import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.geo.GeoReferenceTables;

import java.util.List;

/**
 * Holds the offices, staff roster and geo lookup tables the engine is wired from.
 */
public interface ReferenceDataCache {

    /**
     * Load or reload every reference document.
     *
     * @throws org.ticketrouter.engine.exception.ReferenceDataException if nothing was loaded yet
     *         and a document cannot be read
     */
    void refresh();

    List<Facility> getFacilities();

    /**
     * Staff members as read from the last refresh. Each refresh creates new instances,
     * so a roster built earlier keeps its own loads.
     */
    List<StaffMember> getStaff();

    GeoReferenceTables getGeoTables();

    boolean isInitialized();
}
