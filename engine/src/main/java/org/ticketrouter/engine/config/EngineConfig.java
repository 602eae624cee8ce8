package org.ticketrouter.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.ticketrouter.engine.geo.BoundingBox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable configuration for the assignment engine.
 * Values come from environment variables, then from a {@code .env} file in the working or parent
 * directory, then from defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_GEOCODER_BASE_URL = "https://catalog.api.2gis.com/";
    public static final String DEFAULT_GEOCODER_LOCALE = "ru_KZ";
    public static final long DEFAULT_GEOCODER_MIN_INTERVAL_MS = 250;
    public static final int DEFAULT_GEOCODER_TIMEOUT_SECONDS = 8;
    public static final String DEFAULT_SERVICE_BBOX = "40.5,55.5,50.2,87.4";
    public static final String DEFAULT_COUNTRY_QUALIFIER = "Казахстан";
    public static final double DEFAULT_FUZZY_THRESHOLD = 0.75;
    public static final double DEFAULT_EQUIDISTANT_RADIUS_KM = 50.0;
    public static final String DEFAULT_FALLBACK_HUBS = "Астана,Алматы";
    public static final int DEFAULT_WORKER_COUNT = 1;
    public static final String DEFAULT_LOG_FILE = "logs/engine.log";

    // Geocoder
    private final String geocoderApiKey;
    private final String geocoderBaseUrl;
    private final String geocoderLocale;
    private final long geocoderMinIntervalMillis;
    private final int geocoderTimeoutSeconds;

    // Routing
    private final BoundingBox serviceArea;
    private final String countryQualifier;
    private final double fuzzyThreshold;
    private final double equidistantRadiusKm;
    private final List<String> fallbackHubs;

    // Runtime
    private final String referenceDataDir;
    private final int workerCount;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.geocoderApiKey = builder.geocoderApiKey;
        this.geocoderBaseUrl = builder.geocoderBaseUrl;
        this.geocoderLocale = builder.geocoderLocale;
        this.geocoderMinIntervalMillis = builder.geocoderMinIntervalMillis;
        this.geocoderTimeoutSeconds = builder.geocoderTimeoutSeconds;
        this.serviceArea = builder.serviceArea;
        this.countryQualifier = builder.countryQualifier;
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.equidistantRadiusKm = builder.equidistantRadiusKm;
        this.fallbackHubs = Collections.unmodifiableList(new ArrayList<>(builder.fallbackHubs));
        this.referenceDataDir = builder.referenceDataDir;
        this.workerCount = builder.workerCount;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables with {@code .env} fallback.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parent = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromLookup(key -> firstNonBlank(System.getenv(key), local.get(key), parent.get(key)));
    }

    /**
     * Creates configuration from an arbitrary key lookup. Missing keys yield defaults.
     */
    public static EngineConfig fromLookup(UnaryOperator<String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        String apiKey = firstNonBlank(lookup.apply("TWOGIS_API_KEY"), lookup.apply("DGIS_API_KEY"));
        return new Builder()
                .geocoderApiKey(apiKey == null ? "" : apiKey)
                .geocoderBaseUrl(getString(lookup, "GEOCODER_BASE_URL", DEFAULT_GEOCODER_BASE_URL))
                .geocoderLocale(getString(lookup, "GEOCODER_LOCALE", DEFAULT_GEOCODER_LOCALE))
                .geocoderMinIntervalMillis(getLong(lookup, "GEOCODER_MIN_INTERVAL_MS", DEFAULT_GEOCODER_MIN_INTERVAL_MS))
                .geocoderTimeoutSeconds((int) getLong(lookup, "GEOCODER_TIMEOUT_SECONDS", DEFAULT_GEOCODER_TIMEOUT_SECONDS))
                .serviceArea(getBoundingBox(lookup, "SERVICE_BBOX", DEFAULT_SERVICE_BBOX))
                .countryQualifier(getString(lookup, "COUNTRY_QUALIFIER", DEFAULT_COUNTRY_QUALIFIER))
                .fuzzyThreshold(getDouble(lookup, "FUZZY_THRESHOLD", DEFAULT_FUZZY_THRESHOLD))
                .equidistantRadiusKm(getDouble(lookup, "EQUIDISTANT_RADIUS_KM", DEFAULT_EQUIDISTANT_RADIUS_KM))
                .fallbackHubs(splitList(getString(lookup, "FALLBACK_HUBS", DEFAULT_FALLBACK_HUBS)))
                .referenceDataDir(getString(lookup, "REFERENCE_DATA_DIR", ""))
                .workerCount((int) getLong(lookup, "WORKER_COUNT", DEFAULT_WORKER_COUNT))
                .logFilePath(getString(lookup, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "ENGINE_FILE_LOGGING_ENABLED", false))
                .build();
    }

    public String getGeocoderApiKey() {
        return geocoderApiKey;
    }

    public boolean isGeocoderEnabled() {
        return !geocoderApiKey.isEmpty();
    }

    public String getGeocoderBaseUrl() {
        return geocoderBaseUrl;
    }

    public String getGeocoderLocale() {
        return geocoderLocale;
    }

    public long getGeocoderMinIntervalMillis() {
        return geocoderMinIntervalMillis;
    }

    public int getGeocoderTimeoutSeconds() {
        return geocoderTimeoutSeconds;
    }

    public BoundingBox getServiceArea() {
        return serviceArea;
    }

    public String getCountryQualifier() {
        return countryQualifier;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public double getEquidistantRadiusKm() {
        return equidistantRadiusKm;
    }

    public List<String> getFallbackHubs() {
        return fallbackHubs;
    }

    public String getReferenceDataDir() {
        return referenceDataDir;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Lookup helpers
    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String getString(UnaryOperator<String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static long getLong(UnaryOperator<String> lookup, String key, long defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static double getDouble(UnaryOperator<String> lookup, String key, double defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid number for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(UnaryOperator<String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static BoundingBox getBoundingBox(UnaryOperator<String> lookup, String key, String defaultValue) {
        String value = getString(lookup, key, defaultValue);
        try {
            return BoundingBox.parse(value);
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> String.format("Invalid bounding box for %s: %s, using default: %s", key, value, defaultValue));
            return BoundingBox.parse(defaultValue);
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.trim().isEmpty()) {
                items.add(part.trim());
            }
        }
        return items;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "geocoderEnabled=" + isGeocoderEnabled() +
                ", geocoderBaseUrl='" + geocoderBaseUrl + '\'' +
                ", geocoderMinIntervalMillis=" + geocoderMinIntervalMillis +
                ", serviceArea=" + serviceArea +
                ", fuzzyThreshold=" + fuzzyThreshold +
                ", equidistantRadiusKm=" + equidistantRadiusKm +
                ", fallbackHubs=" + fallbackHubs +
                ", referenceDataDir='" + referenceDataDir + '\'' +
                ", workerCount=" + workerCount +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String geocoderApiKey = "";
        private String geocoderBaseUrl = DEFAULT_GEOCODER_BASE_URL;
        private String geocoderLocale = DEFAULT_GEOCODER_LOCALE;
        private long geocoderMinIntervalMillis = DEFAULT_GEOCODER_MIN_INTERVAL_MS;
        private int geocoderTimeoutSeconds = DEFAULT_GEOCODER_TIMEOUT_SECONDS;
        private BoundingBox serviceArea = BoundingBox.parse(DEFAULT_SERVICE_BBOX);
        private String countryQualifier = DEFAULT_COUNTRY_QUALIFIER;
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private double equidistantRadiusKm = DEFAULT_EQUIDISTANT_RADIUS_KM;
        private List<String> fallbackHubs = splitList(DEFAULT_FALLBACK_HUBS);
        private String referenceDataDir = "";
        private int workerCount = DEFAULT_WORKER_COUNT;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;

        public Builder geocoderApiKey(String geocoderApiKey) {
            this.geocoderApiKey = Objects.requireNonNull(geocoderApiKey, "geocoderApiKey must not be null");
            return this;
        }

        public Builder geocoderBaseUrl(String geocoderBaseUrl) {
            this.geocoderBaseUrl = Objects.requireNonNull(geocoderBaseUrl, "geocoderBaseUrl must not be null");
            return this;
        }

        public Builder geocoderLocale(String geocoderLocale) {
            this.geocoderLocale = Objects.requireNonNull(geocoderLocale, "geocoderLocale must not be null");
            return this;
        }

        public Builder geocoderMinIntervalMillis(long geocoderMinIntervalMillis) {
            if (geocoderMinIntervalMillis < 0) {
                throw new IllegalArgumentException("geocoderMinIntervalMillis must not be negative");
            }
            this.geocoderMinIntervalMillis = geocoderMinIntervalMillis;
            return this;
        }

        public Builder geocoderTimeoutSeconds(int geocoderTimeoutSeconds) {
            if (geocoderTimeoutSeconds < 1) {
                throw new IllegalArgumentException("geocoderTimeoutSeconds must be at least 1");
            }
            this.geocoderTimeoutSeconds = geocoderTimeoutSeconds;
            return this;
        }

        public Builder serviceArea(BoundingBox serviceArea) {
            this.serviceArea = Objects.requireNonNull(serviceArea, "serviceArea must not be null");
            return this;
        }

        public Builder countryQualifier(String countryQualifier) {
            this.countryQualifier = Objects.requireNonNull(countryQualifier, "countryQualifier must not be null");
            return this;
        }

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            if (fuzzyThreshold <= 0.0 || fuzzyThreshold > 1.0) {
                throw new IllegalArgumentException("fuzzyThreshold must be in (0, 1]");
            }
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder equidistantRadiusKm(double equidistantRadiusKm) {
            if (equidistantRadiusKm < 0.0) {
                throw new IllegalArgumentException("equidistantRadiusKm must not be negative");
            }
            this.equidistantRadiusKm = equidistantRadiusKm;
            return this;
        }

        public Builder fallbackHubs(List<String> fallbackHubs) {
            Objects.requireNonNull(fallbackHubs, "fallbackHubs must not be null");
            if (fallbackHubs.size() != 2) {
                throw new IllegalArgumentException("exactly two fallback hubs are required, got " + fallbackHubs);
            }
            this.fallbackHubs = new ArrayList<>(fallbackHubs);
            return this;
        }

        public Builder referenceDataDir(String referenceDataDir) {
            this.referenceDataDir = Objects.requireNonNull(referenceDataDir, "referenceDataDir must not be null");
            return this;
        }

        public Builder workerCount(int workerCount) {
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be at least 1");
            }
            this.workerCount = workerCount;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
