package de.mirkosertic.imagemonitor.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to the deployed profile.
 * <p>
 * The default profile needs nothing from here, logback.xml is picked up from the classpath.
 * The deployed profile writes a rolling file into {@link #logDirectory()}, which
 * logback-deployed.xml reads from the {@value #LOG_DIR_PROPERTY} context property.
 * Problems go to stderr because logging is exactly what is being set up.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "IMAGEMONITOR_LOG_DIR";
    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything else logs.
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            switchToFileLogging(logDirectory());
        }
    }

    public static Path logDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    /**
     * @return true if the deployed configuration is active afterwards
     */
    static boolean switchToFileLogging(final Path logDirectory) {
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
            return false;
        }
        return reconfigure(DEPLOYED_CONFIG, logDirectory);
    }

    /**
     * Replaces the active Logback configuration with a classpath resource. The current
     * configuration stays untouched if the resource does not exist.
     */
    static boolean reconfigure(final String resource, final Path logDirectory) {
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource(resource);
        if (configUrl == null) {
            System.err.println("Warning: Could not find " + resource + " on classpath");
            return false;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        // reset() clears context properties, so set it afterwards
        context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(configUrl);
            return true;
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading " + resource + ": " + e.getMessage());
            return false;
        }
    }
}
