package de.mirkosertic.imagemonitor.config;

import de.mirkosertic.imagemonitor.monitor.WatchConfig;
import de.mirkosertic.imagemonitor.monitor.WatchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the image monitor.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.imagemonitor/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_DIRECTORY = "IMAGEMONITOR_DIRECTORY";
    private static final String ENV_WATCH_MODE = "IMAGEMONITOR_WATCH_MODE";
    private static final String PROP_DIRECTORY = "imagemonitor.directory";
    private static final String PROP_WATCH_MODE = "imagemonitor.watch-mode";
    private static final String PROP_PROFILE = "imagemonitor.profile";
    private static final String CONFIG_DIR = ".imagemonitor";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Map<String, String> environment;

    // Monitor settings
    private String directory;
    private List<String> acceptedExtensions = new ArrayList<>(WatchConfig.DEFAULT_EXTENSIONS);
    private double debounceSeconds = 1.0;
    private int maxInFlight = 100;
    private WatchMode watchMode = WatchMode.NATIVE;
    private long pollIntervalMs = 1000;
    private int workerThreads = 4;
    private long shutdownTimeoutSeconds = 5;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig(final Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath(), System.getenv());
    }

    static ApplicationConfig load(final Path userConfigPath, final Map<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig(environment);

        config.loadFromClasspath();
        config.loadFromFile(userConfigPath);
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: directory={}, watchMode={}, maxInFlight={}, deployedMode={}",
                config.directory, config.watchMode, config.maxInFlight, config.deployedMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            return;
        }
        try (final InputStream is = Files.newInputStream(configPath)) {
            applyYaml(is);
            logger.debug("Loaded user config from: {}", configPath);
        } catch (final IOException e) {
            logger.warn("Failed to load user config from: {}", configPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYaml(final InputStream is) {
        final Map<String, Object> config = new Yaml().load(is);
        if (config == null) {
            return;
        }
        final Map<String, Object> rootConfig = (Map<String, Object>) config.get("imagemonitor");
        if (rootConfig == null) {
            return;
        }
        final Map<String, Object> monitorConfig = (Map<String, Object>) rootConfig.get("monitor");
        if (monitorConfig != null) {
            applyMonitorConfig(monitorConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyMonitorConfig(final Map<String, Object> monitorConfig) {
        if (monitorConfig.containsKey("directory")) {
            final Object dir = monitorConfig.get("directory");
            if (dir != null) {
                setDirectoryIfPresent(resolveVariables(dir.toString()));
            }
        }
        if (monitorConfig.containsKey("accepted-extensions")) {
            final Object extensions = monitorConfig.get("accepted-extensions");
            if (extensions instanceof List) {
                this.acceptedExtensions = new ArrayList<>((List<String>) extensions);
            }
        }
        if (monitorConfig.containsKey("debounce-seconds")) {
            this.debounceSeconds = ((Number) monitorConfig.get("debounce-seconds")).doubleValue();
        }
        if (monitorConfig.containsKey("max-in-flight")) {
            this.maxInFlight = ((Number) monitorConfig.get("max-in-flight")).intValue();
        }
        if (monitorConfig.containsKey("watch-mode")) {
            this.watchMode = WatchMode.parse(String.valueOf(monitorConfig.get("watch-mode")));
        }
        if (monitorConfig.containsKey("poll-interval-ms")) {
            this.pollIntervalMs = ((Number) monitorConfig.get("poll-interval-ms")).longValue();
        }
        if (monitorConfig.containsKey("worker-threads")) {
            this.workerThreads = ((Number) monitorConfig.get("worker-threads")).intValue();
        }
        if (monitorConfig.containsKey("shutdown-timeout-seconds")) {
            this.shutdownTimeoutSeconds = ((Number) monitorConfig.get("shutdown-timeout-seconds")).longValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envDirectory = environment.get(ENV_DIRECTORY);
        if (envDirectory != null && !envDirectory.trim().isEmpty()) {
            this.directory = envDirectory.trim();
            logger.info("Monitored directory from environment: {}", this.directory);
        }

        final String envWatchMode = environment.get(ENV_WATCH_MODE);
        if (envWatchMode != null && !envWatchMode.trim().isEmpty()) {
            this.watchMode = WatchMode.parse(envWatchMode);
        }

        final String propDirectory = System.getProperty(PROP_DIRECTORY);
        if (propDirectory != null && !propDirectory.isEmpty()) {
            this.directory = propDirectory;
        }

        final String propWatchMode = System.getProperty(PROP_WATCH_MODE);
        if (propWatchMode != null && !propWatchMode.isEmpty()) {
            this.watchMode = WatchMode.parse(propWatchMode);
        }
    }

    private void determineProfile() {
        this.deployedMode = isDeployedProfile();
    }

    public static boolean isDeployedProfile() {
        return "deployed".equalsIgnoreCase(System.getProperty(PROP_PROFILE, "default"));
    }

    private void setDirectoryIfPresent(final String value) {
        if (value != null && !value.isBlank()) {
            this.directory = value.trim();
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = environment.get(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    /**
     * Build the immutable monitor configuration.
     *
     * @throws IllegalStateException if no directory has been configured
     */
    public WatchConfig toWatchConfig() {
        if (directory == null || directory.isBlank()) {
            throw new IllegalStateException("No monitored directory configured. Set imagemonitor.monitor.directory in "
                    + getUserConfigPath() + " or the " + ENV_DIRECTORY + " environment variable");
        }
        return new WatchConfig(
                Paths.get(directory).toAbsolutePath().normalize(),
                new LinkedHashSet<>(acceptedExtensions),
                Duration.ofMillis(Math.round(debounceSeconds * 1000)),
                maxInFlight,
                watchMode,
                Duration.ofMillis(pollIntervalMs),
                Duration.ofSeconds(shutdownTimeoutSeconds)
        );
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getDirectory() {
        return directory;
    }

    public List<String> getAcceptedExtensions() {
        return acceptedExtensions;
    }

    public double getDebounceSeconds() {
        return debounceSeconds;
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public WatchMode getWatchMode() {
        return watchMode;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public long getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
