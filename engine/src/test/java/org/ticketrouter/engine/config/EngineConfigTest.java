package org.ticketrouter.engine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.ticketrouter.engine.domain.model.GeoPoint;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("EngineConfig Tests")
class EngineConfigTest {

    private static EngineConfig fromMap(Map<String, String> values) {
        return EngineConfig.fromLookup(values::get);
    }

    @Test
    @DisplayName("Missing keys fall back to defaults")
    void testDefaults() {
        EngineConfig config = fromMap(new HashMap<>());

        assertFalse(config.isGeocoderEnabled());
        assertEquals(EngineConfig.DEFAULT_GEOCODER_BASE_URL, config.getGeocoderBaseUrl());
        assertEquals("ru_KZ", config.getGeocoderLocale());
        assertEquals(250, config.getGeocoderMinIntervalMillis());
        assertEquals(8, config.getGeocoderTimeoutSeconds());
        assertEquals(0.75, config.getFuzzyThreshold(), 1e-9);
        assertEquals(50.0, config.getEquidistantRadiusKm(), 1e-9);
        assertEquals(Arrays.asList("Астана", "Алматы"), config.getFallbackHubs());
        assertEquals("", config.getReferenceDataDir());
        assertEquals(1, config.getWorkerCount());
        assertEquals("logs/engine.log", config.getLogFilePath());
        assertFalse(config.isFileLoggingEnabled());
        assertTrue(config.getServiceArea().contains(new GeoPoint(43.2, 76.9)));
        assertFalse(config.getServiceArea().contains(new GeoPoint(55.75, 37.61)));
    }

    @Test
    @DisplayName("Either API key variable enables the geocoder")
    void testApiKeyAliases() {
        Map<String, String> values = new HashMap<>();
        values.put("DGIS_API_KEY", " secret ");
        EngineConfig config = fromMap(values);

        assertTrue(config.isGeocoderEnabled());
        assertEquals("secret", config.getGeocoderApiKey());

        values.put("TWOGIS_API_KEY", "primary");
        assertEquals("primary", fromMap(values).getGeocoderApiKey());
    }

    @Test
    @DisplayName("Explicit values are parsed")
    void testOverrides() {
        Map<String, String> values = new HashMap<>();
        values.put("FALLBACK_HUBS", "Алматы, Шымкент");
        values.put("WORKER_COUNT", "4");
        values.put("FUZZY_THRESHOLD", "0.8");
        values.put("SERVICE_BBOX", "0,10,0,10");
        values.put("ENGINE_FILE_LOGGING_ENABLED", "TRUE");
        EngineConfig config = fromMap(values);

        assertEquals(Arrays.asList("Алматы", "Шымкент"), config.getFallbackHubs());
        assertEquals(4, config.getWorkerCount());
        assertEquals(0.8, config.getFuzzyThreshold(), 1e-9);
        assertTrue(config.getServiceArea().contains(new GeoPoint(5, 5)));
        assertTrue(config.isFileLoggingEnabled());
    }

    @Test
    @DisplayName("Unparseable values fall back to defaults")
    void testInvalidValuesUseDefaults() {
        Map<String, String> values = new HashMap<>();
        values.put("GEOCODER_MIN_INTERVAL_MS", "fast");
        values.put("EQUIDISTANT_RADIUS_KM", "far");
        values.put("SERVICE_BBOX", "1,2,3");
        EngineConfig config = fromMap(values);

        assertEquals(EngineConfig.DEFAULT_GEOCODER_MIN_INTERVAL_MS, config.getGeocoderMinIntervalMillis());
        assertEquals(EngineConfig.DEFAULT_EQUIDISTANT_RADIUS_KM, config.getEquidistantRadiusKm(), 1e-9);
        assertTrue(config.getServiceArea().contains(new GeoPoint(43.2, 76.9)));
    }

    @Test
    @DisplayName("Builder rejects out-of-range values")
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new EngineConfig.Builder().fallbackHubs(Arrays.asList("Астана")));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().fuzzyThreshold(0.0));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().fuzzyThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().workerCount(0));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().geocoderTimeoutSeconds(0));

        Map<String, String> values = new HashMap<>();
        values.put("WORKER_COUNT", "0");
        assertThrows(IllegalArgumentException.class, () -> fromMap(values));
    }
}
