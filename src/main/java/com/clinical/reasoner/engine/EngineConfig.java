package com.clinical.reasoner.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Engine configuration loaded from a {@code .properties} file.
 * <p>
 * By default the file is read from the classpath resource {@value #DEFAULT_CLASSPATH_RESOURCE}.
 * Setting the system property {@value #SYS_PROP_CONFIG_PATH} to a readable file path overrides
 * it, as does the {@link #EngineConfig(Path)} constructor. Keys that are absent fall back to
 * built-in defaults, so {@link #defaults()} works without any file.
 * <p>
 * Numeric values are parsed on access; a malformed value raises {@link IllegalStateException}.
 * Call {@link #validate()} at startup to collect every problem at once.
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_CLASSPATH_RESOURCE = "config/engine.properties";
    public static final String SYS_PROP_CONFIG_PATH = "clinical.reasoner.config";

    static final String K_CONTINUITY_WINDOW_DAYS = "timeline.continuity-window-days";
    static final String K_INFER_STOP_FROM_VISITS = "timeline.infer-stop-from-visits";
    static final String K_SAME_DAY_CONFLICT_PENALTY = "timeline.same-day-conflict-penalty";
    static final String K_INCOMPARABLE_DOSE_PENALTY = "timeline.incomparable-dose-penalty";
    static final String K_SIGNIFICANT_OVERLAP_DAYS = "timeline.significant-overlap-days";
    static final String K_REVIEW_THRESHOLD = "evidence.review-threshold";
    static final String K_EXACT_CONFIDENCE = "rules.exact-confidence";
    static final String K_CLASS_CONFIDENCE = "rules.class-confidence";
    static final String K_CATALOG_RESOURCE = "catalog.resource";
    static final String K_FHIR_SERVER_URL = "fhir.server-url";
    static final String K_FHIR_DEFAULT_CONFIDENCE = "fhir.default-confidence";
    static final String K_THREAD_POOL_SIZE = "app.thread-pool-size";

    private static final int DEFAULT_CONTINUITY_WINDOW_DAYS = 0;
    private static final double DEFAULT_SAME_DAY_CONFLICT_PENALTY = 0.5;
    private static final double DEFAULT_INCOMPARABLE_DOSE_PENALTY = 0.5;
    private static final int DEFAULT_SIGNIFICANT_OVERLAP_DAYS = 7;
    private static final double DEFAULT_REVIEW_THRESHOLD = 0.4;
    private static final double DEFAULT_EXACT_CONFIDENCE = 0.95;
    private static final double DEFAULT_CLASS_CONFIDENCE = 0.75;
    private static final String DEFAULT_CATALOG_RESOURCE = "catalog/rule-catalog.json";
    private static final String DEFAULT_FHIR_SERVER_URL = "https://hapi.fhir.org/baseR4";
    private static final double DEFAULT_FHIR_CONFIDENCE = 1.0;
    private static final int DEFAULT_THREAD_POOL_SIZE = 10;

    private final Properties properties;

    /**
     * Load from the system property path when set and readable, else from the classpath resource
     */
    public EngineConfig() {
        this.properties = new Properties();
        String external = System.getProperty(SYS_PROP_CONFIG_PATH);
        if (external != null && !external.isBlank()) {
            Path path = Path.of(external.trim());
            if (Files.isReadable(path)) {
                loadFromFile(path);
                return;
            }
            logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, path);
        }
        loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
    }

    /**
     * Load a specific file
     * @param filePath Path to a .properties file
     * @throws IllegalArgumentException if the file is not readable
     */
    public EngineConfig(Path filePath) {
        if (filePath == null || !Files.isReadable(filePath)) {
            throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
        }
        this.properties = new Properties();
        loadFromFile(filePath);
    }

    /**
     * Wrap already-loaded properties
     */
    public EngineConfig(Properties properties) {
        this.properties = new Properties();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * @return Configuration with every documented default and no file behind it
     */
    public static EngineConfig defaults() {
        return new EngineConfig(new Properties());
    }

    /**
     * @return A copy of this configuration with one key replaced
     */
    public EngineConfig with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(key, value);
        return new EngineConfig(copy);
    }

    /**
     * Check every key for parseability and range. Does not throw.
     * @return Human-readable issues; empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> issues = new ArrayList<>();
        check(issues, () -> getContinuityWindowDays());
        check(issues, () -> getSameDayConflictPenalty());
        check(issues, () -> getIncomparableDosePenalty());
        check(issues, () -> getSignificantOverlapDays());
        check(issues, () -> getReviewThreshold());
        check(issues, () -> getExactRuleConfidence());
        check(issues, () -> getClassRuleConfidence());
        check(issues, () -> getFhirDefaultConfidence());
        check(issues, () -> getThreadPoolSize());
        String flag = getOptional(K_INFER_STOP_FROM_VISITS, null);
        if (flag != null && !flag.equalsIgnoreCase("true") && !flag.equalsIgnoreCase("false")) {
            issues.add(K_INFER_STOP_FROM_VISITS + " must be true or false, got '" + flag + "'");
        }
        if (getCatalogResource().isBlank()) {
            issues.add(K_CATALOG_RESOURCE + " must not be blank");
        }
        return issues;
    }

    public int getContinuityWindowDays() {
        int value = getInt(K_CONTINUITY_WINDOW_DAYS, DEFAULT_CONTINUITY_WINDOW_DAYS);
        if (value < 0) {
            throw new IllegalStateException(K_CONTINUITY_WINDOW_DAYS + " must not be negative: " + value);
        }
        return value;
    }

    public boolean isInferStopFromVisits() {
        return Boolean.parseBoolean(getOptional(K_INFER_STOP_FROM_VISITS, "false"));
    }

    /**
     * Multiplier applied to the confidence of periods and events whose start date had
     * conflicting same-day records
     */
    public double getSameDayConflictPenalty() {
        return getFraction(K_SAME_DAY_CONFLICT_PENALTY, DEFAULT_SAME_DAY_CONFLICT_PENALTY);
    }

    /**
     * Multiplier applied to the confidence of a dose change whose units could not be compared
     */
    public double getIncomparableDosePenalty() {
        return getFraction(K_INCOMPARABLE_DOSE_PENALTY, DEFAULT_INCOMPARABLE_DOSE_PENALTY);
    }

    public int getSignificantOverlapDays() {
        int value = getInt(K_SIGNIFICANT_OVERLAP_DAYS, DEFAULT_SIGNIFICANT_OVERLAP_DAYS);
        if (value < 0) {
            throw new IllegalStateException(K_SIGNIFICANT_OVERLAP_DAYS + " must not be negative: " + value);
        }
        return value;
    }

    public double getReviewThreshold() {
        return getFraction(K_REVIEW_THRESHOLD, DEFAULT_REVIEW_THRESHOLD);
    }

    public double getExactRuleConfidence() {
        return getFraction(K_EXACT_CONFIDENCE, DEFAULT_EXACT_CONFIDENCE);
    }

    public double getClassRuleConfidence() {
        return getFraction(K_CLASS_CONFIDENCE, DEFAULT_CLASS_CONFIDENCE);
    }

    public String getCatalogResource() {
        return getOptional(K_CATALOG_RESOURCE, DEFAULT_CATALOG_RESOURCE);
    }

    public String getFhirServerUrl() {
        return getOptional(K_FHIR_SERVER_URL, DEFAULT_FHIR_SERVER_URL);
    }

    /**
     * Extraction confidence assigned to records mapped from structured FHIR resources
     */
    public double getFhirDefaultConfidence() {
        return getFraction(K_FHIR_DEFAULT_CONFIDENCE, DEFAULT_FHIR_CONFIDENCE);
    }

    public int getThreadPoolSize() {
        int value = getInt(K_THREAD_POOL_SIZE, DEFAULT_THREAD_POOL_SIZE);
        if (value <= 0) {
            throw new IllegalStateException(K_THREAD_POOL_SIZE + " must be positive: " + value);
        }
        return value;
    }

    public String getOptional(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    // -------------------------- Internals --------------------------------------

    private int getInt(String key, int defaultValue) {
        String raw = getOptional(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " is not an integer: '" + raw + "'", e);
        }
    }

    private double getFraction(String key, double defaultValue) {
        String raw = getOptional(key, null);
        if (raw == null) {
            return defaultValue;
        }
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " is not a number: '" + raw + "'", e);
        }
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalStateException(key + " must be within [0, 1]: " + value);
        }
        return value;
    }

    private static void check(List<String> issues, Runnable getter) {
        try {
            getter.run();
        } catch (IllegalStateException e) {
            issues.add(e.getMessage());
        }
    }

    private void loadFromClasspath(String resource) {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("Config resource {} not found on classpath, using defaults", resource);
                return;
            }
            properties.load(in);
            logger.info("Loaded engine configuration from classpath:{}", resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config resource " + resource + ": " + e.getMessage(), e);
        }
    }

    private void loadFromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            properties.load(in);
            logger.info("Loaded engine configuration from {}", path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config file " + path + ": " + e.getMessage(), e);
        }
    }
}
