package com.tbpivot.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings and backend safety limits for the exporter.
 * Sources, lowest to highest precedence:
 * 1. Properties file (tb-pivot.properties on the classpath, or an explicit file)
 * 2. Environment variables
 * 3. System properties prefixed with "tbpivot." (command line -D)
 */
public class PivotExportConfig {

    private static final Logger logger = LoggerFactory.getLogger(PivotExportConfig.class);

    // Configuration keys
    public static final String TB_URL = "tbUrl";
    public static final String TB_USERNAME = "tbUsername";
    public static final String TB_PASSWORD = "tbPassword";
    public static final String DEFAULT_TIMEZONE = "defaultTimezone";
    public static final String OUTPUT_DIR = "outputDir";
    public static final String MAX_ENTITIES = "maxEntities";
    public static final String MAX_KEYS = "maxKeys";
    public static final String MAX_POINTS_PER_KEY = "maxPointsPerKey";
    public static final String MAX_INTERVALS_PER_REQUEST = "maxIntervalsPerRequest";

    // Environment variable keys
    public static final String ENV_TB_URL = "TB_URL";
    public static final String ENV_TB_USERNAME = "TB_USERNAME";
    public static final String ENV_TB_PASSWORD = "TB_PASSWORD";

    public static final String DEFAULT_PROPERTIES_FILE = "tb-pivot.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "tbpivot.";

    private static PivotExportConfig instance;
    private final Properties properties;

    private PivotExportConfig(Properties effective) {
        this.properties = effective;
    }

    private static PivotExportConfig layered(Properties fileProperties) {
        return new PivotExportConfig(loadConfiguration(fileProperties));
    }

    /**
     * Configuration backed by tb-pivot.properties from the classpath
     */
    public static synchronized PivotExportConfig getInstance() {
        if (instance == null) {
            instance = layered(loadFromClasspath());
        }
        return instance;
    }

    /**
     * Configuration backed by an explicit properties file
     */
    public static PivotExportConfig fromFile(File file) throws IOException {
        Properties fileProperties = new Properties();
        try (InputStream input = new FileInputStream(file)) {
            fileProperties.load(input);
        }
        logger.info("Loaded configuration from {}", file.getAbsolutePath());
        return layered(fileProperties);
    }

    /**
     * Configuration backed by already loaded properties; environment variables
     * and system properties still apply on top.
     */
    public static PivotExportConfig fromProperties(Properties fileProperties) {
        return layered(fileProperties);
    }

    private static Properties loadFromClasspath() {
        Properties config = new Properties();
        try (InputStream input = PivotExportConfig.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES_FILE)) {
            if (input != null) {
                config.load(input);
                logger.info("Loaded configuration from {}", DEFAULT_PROPERTIES_FILE);
            } else {
                logger.debug("Properties file {} not found in classpath", DEFAULT_PROPERTIES_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties file {}: {}", DEFAULT_PROPERTIES_FILE, e.getMessage());
        }
        return config;
    }

    private static Properties loadConfiguration(Properties fileProperties) {
        Properties config = new Properties();
        config.putAll(fileProperties);

        mapEnvToProperty(config, ENV_TB_URL, TB_URL);
        mapEnvToProperty(config, ENV_TB_USERNAME, TB_USERNAME);
        mapEnvToProperty(config, ENV_TB_PASSWORD, TB_PASSWORD);

        System.getProperties().stringPropertyNames().stream()
            .filter(name -> name.startsWith(SYSTEM_PROPERTY_PREFIX))
            .forEach(name -> config.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()),
                    System.getProperty(name)));

        logConfigurationStatus(config);
        return config;
    }

    private static void mapEnvToProperty(Properties config, String envKey, String propKey) {
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.trim().isEmpty()) {
            config.setProperty(propKey, envValue);
        }
    }

    /**
     * Log configuration status without revealing secrets
     */
    private static void logConfigurationStatus(Properties config) {
        logger.debug("Export configuration status:");
        logger.debug("  ThingsBoard URL: {}", getConfiguredValue(config, TB_URL, "not set"));
        logger.debug("  Username: {}", isConfigured(config, TB_USERNAME) ? "configured" : "missing");
        logger.debug("  Password: {}", isConfigured(config, TB_PASSWORD) ? "configured" : "missing");
        logger.debug("  Default timezone: {}", getConfiguredValue(config, DEFAULT_TIMEZONE, "Asia/Bangkok (default)"));
    }

    private static boolean isConfigured(Properties config, String key) {
        String value = config.getProperty(key);
        return value != null && !value.trim().isEmpty();
    }

    private static String getConfiguredValue(Properties config, String key, String defaultDisplay) {
        String value = config.getProperty(key);
        return (value != null && !value.trim().isEmpty()) ? value : defaultDisplay;
    }

    public String getTbUrl() {
        return properties.getProperty(TB_URL);
    }

    public String getTbUsername() {
        return properties.getProperty(TB_USERNAME);
    }

    public String getTbPassword() {
        return properties.getProperty(TB_PASSWORD);
    }

    public String getOutputDir() {
        return properties.getProperty(OUTPUT_DIR, "outputs");
    }

    public ZoneId getDefaultTimezone() {
        String zone = properties.getProperty(DEFAULT_TIMEZONE, ExportLimits.DEFAULT_TIMEZONE);
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid " + DEFAULT_TIMEZONE + ": " + zone, e);
        }
    }

    public int getMaxEntities() {
        return getIntProperty(MAX_ENTITIES, ExportLimits.MAX_ENTITIES);
    }

    public int getMaxKeys() {
        return getIntProperty(MAX_KEYS, ExportLimits.MAX_KEYS);
    }

    public int getMaxPointsPerKey() {
        return getIntProperty(MAX_POINTS_PER_KEY, ExportLimits.MAX_POINTS_PER_KEY);
    }

    public int getMaxIntervalsPerRequest() {
        return getIntProperty(MAX_INTERVALS_PER_REQUEST, ExportLimits.MAX_INTERVALS_PER_REQUEST);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public ExportLimits toLimits() {
        return new ExportLimits(getMaxEntities(), getMaxKeys(), getMaxPointsPerKey(),
                getMaxIntervalsPerRequest(), getDefaultTimezone());
    }

    public boolean hasRequiredCredentials() {
        return getTbUsername() != null && getTbPassword() != null
                && !getTbUsername().trim().isEmpty() && !getTbPassword().trim().isEmpty();
    }

    public void validateConfiguration() throws IllegalStateException {
        if (getTbUrl() == null || getTbUrl().trim().isEmpty()) {
            throw new IllegalStateException("ThingsBoard URL not configured. Please set " + TB_URL
                    + " in the properties file or the " + ENV_TB_URL + " environment variable.");
        }
        if (!hasRequiredCredentials()) {
            throw new IllegalStateException("ThingsBoard credentials not configured. Please set "
                    + TB_USERNAME + " and " + TB_PASSWORD + " in the properties file or environment variables.");
        }
    }

    /**
     * Copy with command line values on top of every other source; null values are ignored
     */
    public PivotExportConfig withOverrides(Map<String, String> overrides) {
        Properties merged = new Properties();
        merged.putAll(properties);
        overrides.forEach((key, value) -> {
            if (value != null) {
                merged.setProperty(key, value);
            }
        });
        return new PivotExportConfig(merged);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }
}
