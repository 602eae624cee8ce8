package org.ticketrouter.engine.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ticketrouter.engine.cache.dto.FacilityDto;
import org.ticketrouter.engine.cache.dto.GeoTablesDto;
import org.ticketrouter.engine.cache.dto.StaffDto;
import org.ticketrouter.engine.domain.model.Facility;
import org.ticketrouter.engine.domain.model.GeoPoint;
import org.ticketrouter.engine.domain.model.Position;
import org.ticketrouter.engine.domain.model.Skill;
import org.ticketrouter.engine.domain.model.StaffMember;
import org.ticketrouter.engine.exception.ReferenceDataException;
import org.ticketrouter.engine.geo.GeoReferenceTables;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe ReferenceDataCache reading JSON documents from a directory, or from the
 * bundled classpath copies under /reference when no directory is configured.
 */
public final class ReferenceDataCacheImpl implements ReferenceDataCache {

    private static final Logger LOG = Logger.getLogger(ReferenceDataCacheImpl.class.getName());

    static final String FACILITIES_FILE = "facilities.json";
    static final String STAFF_FILE = "staff.json";
    static final String GEO_TABLES_FILE = "geo-tables.json";
    private static final String CLASSPATH_ROOT = "/reference/";

    private final ObjectMapper mapper;
    private final Path referenceDir;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile boolean initialized = false;
    private List<StaffDto> staffRows = Collections.emptyList();
    private List<Facility> facilities = Collections.emptyList();
    private GeoReferenceTables geoTables;

    /**
     * @param referenceDir directory holding the JSON documents, or null for the bundled copies
     */
    public ReferenceDataCacheImpl(ObjectMapper mapper, Path referenceDir) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.referenceDir = referenceDir;
    }

    @Override
    public void refresh() {
        String source = referenceDir != null ? referenceDir.toString() : "classpath:" + CLASSPATH_ROOT;
        LOG.info(() -> "Loading reference data from " + source);

        List<FacilityDto> newFacilityRows;
        List<StaffDto> newStaffRows;
        GeoReferenceTables newTables;
        List<Facility> newFacilities;
        try {
            newFacilityRows = read(FACILITIES_FILE, new TypeReference<List<FacilityDto>>() { });
            newStaffRows = read(STAFF_FILE, new TypeReference<List<StaffDto>>() { });
            newTables = toTables(read(GEO_TABLES_FILE, new TypeReference<GeoTablesDto>() { }));
            newFacilities = toFacilities(newFacilityRows);
            // Fail here rather than on first use if a staff row is malformed.
            toStaff(newStaffRows);
        } catch (ReferenceDataException e) {
            if (!initialized) {
                throw e;
            }
            LOG.log(Level.SEVERE, "Reference data refresh failed, keeping previous data", e);
            return;
        }

        lock.writeLock().lock();
        try {
            this.staffRows = newStaffRows;
            this.facilities = newFacilities;
            this.geoTables = newTables;
            this.initialized = true;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info(() -> String.format("Loaded %d facilities, %d staff members, %d places",
                newFacilities.size(), newStaffRows.size(), newTables.getCoordinates().size()));
    }

    @Override
    public List<Facility> getFacilities() {
        lock.readLock().lock();
        try {
            requireInitialized();
            return facilities;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StaffMember> getStaff() {
        lock.readLock().lock();
        try {
            requireInitialized();
            return toStaff(staffRows);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public GeoReferenceTables getGeoTables() {
        lock.readLock().lock();
        try {
            requireInitialized();
            return geoTables;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("reference data not loaded, call refresh() first");
        }
    }

    private <T> T read(String fileName, TypeReference<T> type) {
        try (InputStream in = open(fileName)) {
            T value = mapper.readValue(in, type);
            if (value == null) {
                throw new ReferenceDataException(fileName + " is empty");
            }
            return value;
        } catch (IOException e) {
            throw new ReferenceDataException("Cannot read " + fileName + ": " + e.getMessage(), e);
        }
    }

    private InputStream open(String fileName) throws IOException {
        if (referenceDir != null) {
            return Files.newInputStream(referenceDir.resolve(fileName));
        }
        InputStream in = ReferenceDataCacheImpl.class.getResourceAsStream(CLASSPATH_ROOT + fileName);
        if (in == null) {
            throw new ReferenceDataException("Bundled resource " + CLASSPATH_ROOT + fileName + " not found");
        }
        return in;
    }

    private static List<Facility> toFacilities(List<FacilityDto> rows) {
        List<Facility> result = new ArrayList<>(rows.size());
        for (FacilityDto row : rows) {
            if (row.getOfficeName() == null || row.getLatitude() == null || row.getLongitude() == null) {
                throw new ReferenceDataException("Facility row needs office_name, latitude and longitude: "
                        + row.getOfficeName());
            }
            try {
                result.add(new Facility(row.getOfficeName().trim(), row.getCity(), row.getAddress(),
                        row.getLatitude(), row.getLongitude()));
            } catch (IllegalArgumentException e) {
                throw new ReferenceDataException("Invalid facility " + row.getOfficeName() + ": " + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static List<StaffMember> toStaff(List<StaffDto> rows) {
        List<StaffMember> result = new ArrayList<>(rows.size());
        for (StaffDto row : rows) {
            if (row.getId() == null || row.getOffice() == null) {
                throw new ReferenceDataException("Staff row needs id and office: " + row.getFullName());
            }
            StaffMember.Builder builder = new StaffMember.Builder()
                    .id(row.getId().trim())
                    .fullName(row.getFullName() != null ? row.getFullName().trim() : row.getId())
                    .facilityName(row.getOffice().trim())
                    .position(Position.fromLabel(row.getPosition()))
                    .currentLoad(row.getCurrentLoad());
            if (row.getSkills() != null) {
                for (String skill : row.getSkills()) {
                    builder.skill(parseSkill(row.getId(), skill));
                }
            }
            result.add(builder.build());
        }
        return result;
    }

    private static Skill parseSkill(String staffId, String value) {
        try {
            return Skill.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ReferenceDataException("Unknown skill '" + value + "' for staff member " + staffId, e);
        }
    }

    private static GeoReferenceTables toTables(GeoTablesDto dto) {
        Map<String, GeoPoint> coordinates = new LinkedHashMap<>();
        if (dto.getCoordinates() != null) {
            for (GeoTablesDto.PlaceDto place : dto.getCoordinates()) {
                if (place.getName() == null) {
                    throw new ReferenceDataException("Place without a name in " + GEO_TABLES_FILE);
                }
                try {
                    coordinates.putIfAbsent(place.getName(), new GeoPoint(place.getLat(), place.getLon()));
                } catch (IllegalArgumentException e) {
                    throw new ReferenceDataException("Invalid coordinates for " + place.getName(), e);
                }
            }
        }
        Map<String, String> aliases = dto.getAliases() != null ? dto.getAliases() : Collections.emptyMap();
        List<String> countries = dto.getDomesticCountries() != null
                ? dto.getDomesticCountries() : Collections.emptyList();
        return new GeoReferenceTables(coordinates, aliases, new HashSet<>(countries));
    }
}
