package com.jobagents.app;

import com.jobagents.core.AgentConfig;
import com.jobagents.matching.MatcherSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Pipeline settings.
 *
 * <p><b>Sources</b>, later ones win:</p>
 * <ol>
 *   <li>{@code pipeline.properties} on the classpath (defaults)</li>
 *   <li>the file named by the {@code pipeline.config} system property, if set</li>
 *   <li>environment variables, see {@link #ENVIRONMENT_KEYS}</li>
 * </ol>
 *
 * <p>Durations use ISO-8601 notation, e.g. {@code PT5M}. A malformed value fails fast
 * with an {@link IllegalArgumentException} naming the key.</p>
 */
public class PipelineConfig {
    private static final Logger logger = Logger.getLogger(PipelineConfig.class.getName());

    static final String DEFAULTS_RESOURCE = "pipeline.properties";
    static final String CONFIG_FILE_PROPERTY = "pipeline.config";

    /**
     * Environment variable → property key.
     */
    static final Map<String, String> ENVIRONMENT_KEYS = new LinkedHashMap<>();

    static {
        ENVIRONMENT_KEYS.put("API_BASE_URL", "backend.url");
        ENVIRONMENT_KEYS.put("ADZUNA_APP_ID", "adzuna.app-id");
        ENVIRONMENT_KEYS.put("ADZUNA_API_KEY", "adzuna.api-key");
        ENVIRONMENT_KEYS.put("DB_URL", "db.url");
        ENVIRONMENT_KEYS.put("DATA_DIR", "data.dir");
        ENVIRONMENT_KEYS.put("OUTPUT_DIR", "output.dir");
    }

    private final Properties properties;

    public PipelineConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load from all sources using the process environment.
     */
    public static PipelineConfig load() {
        return load(System.getProperty(CONFIG_FILE_PROPERTY), System.getenv());
    }

    /**
     * @param externalFile optional properties file, may be null
     * @param environment environment variables to apply last
     * @throws IllegalArgumentException if the external file cannot be read
     */
    public static PipelineConfig load(String externalFile, Map<String, String> environment) {
        Properties properties = new Properties();

        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            } else {
                logger.warning(DEFAULTS_RESOURCE + " not found on classpath, using built-in defaults");
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read " + DEFAULTS_RESOURCE, e);
        }

        if (externalFile != null && !externalFile.isBlank()) {
            Path path = Paths.get(externalFile);
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                properties.load(reader);
                logger.info("Loaded configuration overrides from " + path);
            } catch (IOException e) {
                throw new IllegalArgumentException("Failed to read configuration file " + path, e);
            }
        }

        for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.isBlank()) {
                properties.setProperty(entry.getValue(), value.trim());
            }
        }
        return new PipelineConfig(properties);
    }

    public String getString(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }

    // Typed accessors

    public String getBackendUrl() {
        return getString("backend.url", "http://127.0.0.1:8000");
    }

    public Path getDataDirectory() {
        return Paths.get(getString("data.dir", "data"));
    }

    public Path getOutputDirectory() {
        return Paths.get(getString("output.dir", "generated"));
    }

    public Duration getTickPeriod() {
        return getDuration("scheduler.tick", Duration.ofSeconds(5));
    }

    public int getConnectTimeoutMillis() {
        return getInt("http.connect-timeout-ms", 10_000);
    }

    /**
     * @return interval between two launches of a task, default 5 minutes
     */
    public Duration getTaskInterval(String taskName) {
        return getDuration("task." + taskName + ".interval", Duration.ofMinutes(5));
    }

    /**
     * @return name of the queue that must be non-empty before the task runs, or null
     */
    public String getReadyQueue(String taskName) {
        String queue = getString("task." + taskName + ".ready-queue", null);
        return queue == null || queue.isEmpty() ? null : queue;
    }

    /**
     * Agent settings with the state file in the data directory. The standalone loop
     * sleeps for the task interval.
     */
    public AgentConfig agentConfig(String taskName) {
        return AgentConfig.inDirectory(taskName, getDataDirectory(), getTaskInterval(taskName));
    }

    public MatcherSettings getMatcherSettings() {
        return new MatcherSettings(
                getDouble("matcher.threshold", MatcherSettings.DEFAULT_THRESHOLD),
                getInt("matcher.min-description-length", MatcherSettings.DEFAULT_MIN_DESCRIPTION_LENGTH),
                getInt("matcher.pool-width", MatcherSettings.DEFAULT_POOL_WIDTH),
                getDouble("matcher.skill-weight", MatcherSettings.DEFAULT_SKILL_WEIGHT));
    }

    public int getMatchTopK() {
        return getInt("matcher.top-k", 10);
    }

    public String getSkipList() {
        return getString("matcher.skip-list", "");
    }

    public int getGenerationTopK() {
        return getInt("generation.top-k", 5);
    }

    public String getAdzunaBaseUrl() {
        return getString("adzuna.base-url", "https://api.adzuna.com/v1/api/jobs/us/search");
    }

    public String getAdzunaAppId() {
        return getString("adzuna.app-id", "");
    }

    public String getAdzunaApiKey() {
        return getString("adzuna.api-key", "");
    }

    public String getAdzunaWhat() {
        return getString("adzuna.what", "data engineer");
    }

    public String getAdzunaWhere() {
        return getString("adzuna.where", "New York City");
    }

    public int getAdzunaMaxPages() {
        return getInt("adzuna.max-pages", 3);
    }

    public String getDbUrl() {
        return getString("db.url", "jdbc:h2:./data/packages");
    }

    public String getDbUser() {
        return getString("db.user", "sa");
    }

    public String getDbPassword() {
        return getString("db.password", "");
    }

    public int getDbPoolSize() {
        return getInt("db.pool-size", 4);
    }
}
