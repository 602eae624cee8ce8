package org.ticketrouter.engine;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.ticketrouter.engine.allocation.FairnessAllocator;
import org.ticketrouter.engine.api.GeocodingProvider;
import org.ticketrouter.engine.api.RateLimitedGeocodingProvider;
import org.ticketrouter.engine.api.TwoGisGeocodingProvider;
import org.ticketrouter.engine.batch.BatchAssignmentRunner;
import org.ticketrouter.engine.batch.BatchReport;
import org.ticketrouter.engine.batch.dto.AssignmentResultDto;
import org.ticketrouter.engine.batch.dto.TicketDto;
import org.ticketrouter.engine.cache.ReferenceDataCache;
import org.ticketrouter.engine.cache.ReferenceDataCacheImpl;
import org.ticketrouter.engine.config.EngineConfig;
import org.ticketrouter.engine.domain.model.TicketAttributes;
import org.ticketrouter.engine.domain.service.AssignmentService;
import org.ticketrouter.engine.domain.service.AssignmentServiceImpl;
import org.ticketrouter.engine.domain.service.InMemoryAssignmentResultStore;
import org.ticketrouter.engine.eligibility.EligibilityFilter;
import org.ticketrouter.engine.geo.GeoReferenceTables;
import org.ticketrouter.engine.geo.GeoResolver;
import org.ticketrouter.engine.locator.FacilityLocator;
import org.ticketrouter.engine.roster.StaffRoster;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command line entry point.
 *
 * Usage: {@code Main <tickets.json> [results.json]}. Reads a JSON array of classified tickets,
 * routes them and writes a JSON array of assignment results to the second path or to stdout.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: Main <tickets.json> [results.json]");
            System.exit(2);
        }
        try {
            new Main().run(Paths.get(args[0]), args.length > 1 ? Paths.get(args[1]) : null);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Ticket routing failed", e);
            System.exit(1);
        }
    }

    private void run(Path ticketsFile, Path resultsFile) throws IOException {
        LOG.info("=== Ticket Router ===");

        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        configureLogging(config);

        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        ReferenceDataCache cache = new ReferenceDataCacheImpl(mapper,
                config.getReferenceDataDir().isEmpty() ? null : Paths.get(config.getReferenceDataDir()));
        cache.refresh();

        AssignmentService assignmentService = createAssignmentService(config, cache, createProvider(config));
        BatchAssignmentRunner runner = new BatchAssignmentRunner(assignmentService, config.getWorkerCount());

        List<TicketDto> input = mapper.readValue(ticketsFile.toFile(), new TypeReference<List<TicketDto>>() { });
        List<TicketAttributes> tickets = new ArrayList<>(input.size());
        for (TicketDto dto : input) {
            tickets.add(dto.toAttributes());
        }
        LOG.info(() -> "Read " + tickets.size() + " tickets from " + ticketsFile);

        BatchReport report = runner.run(tickets);

        List<AssignmentResultDto> output = new ArrayList<>(report.getResults().size());
        report.getResults().forEach(result -> output.add(AssignmentResultDto.from(result)));
        if (resultsFile != null) {
            mapper.writeValue(resultsFile.toFile(), output);
            LOG.info(() -> "Results written to " + resultsFile.toAbsolutePath());
        } else {
            mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(System.out, output);
            System.out.flush();
        }

        LOG.info(() -> "=== Done: " + report + " ===");
    }

    static AssignmentService createAssignmentService(EngineConfig config, ReferenceDataCache cache,
                                                     GeocodingProvider provider) {
        GeoReferenceTables tables = cache.getGeoTables();
        StaffRoster roster = new StaffRoster(cache.getFacilities(), cache.getStaff());
        GeoResolver geoResolver = GeoResolver.standard(tables, provider, config.getServiceArea(),
                config.getCountryQualifier(), config.getFuzzyThreshold());
        FacilityLocator locator = new FacilityLocator(roster, tables, config.getFallbackHubs(),
                config.getEquidistantRadiusKm(), config.getFuzzyThreshold());
        return new AssignmentServiceImpl(geoResolver, locator, new EligibilityFilter(),
                new FairnessAllocator(), roster, new InMemoryAssignmentResultStore());
    }

    private static GeocodingProvider createProvider(EngineConfig config) {
        if (!config.isGeocoderEnabled()) {
            LOG.warning("No geocoder API key configured, using offline tables only");
            return GeocodingProvider.disabled();
        }
        LOG.info(() -> "Geocoder configured for: " + config.getGeocoderBaseUrl());
        TwoGisGeocodingProvider client = new TwoGisGeocodingProvider(config.getGeocoderBaseUrl(),
                config.getGeocoderApiKey(), config.getGeocoderLocale(), config.getGeocoderTimeoutSeconds());
        return new RateLimitedGeocodingProvider(client, config.getGeocoderMinIntervalMillis());
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
