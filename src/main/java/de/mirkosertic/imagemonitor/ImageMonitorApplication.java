package de.mirkosertic.imagemonitor;

import de.mirkosertic.imagemonitor.config.ApplicationConfig;
import de.mirkosertic.imagemonitor.config.LoggingConfigurator;
import de.mirkosertic.imagemonitor.monitor.FileMonitor;
import de.mirkosertic.imagemonitor.monitor.ImageProcessor;
import de.mirkosertic.imagemonitor.monitor.LoggingImageProcessor;
import de.mirkosertic.imagemonitor.monitor.MonitorStatistics;
import de.mirkosertic.imagemonitor.monitor.TikaImageVerifier;
import de.mirkosertic.imagemonitor.monitor.WatchConfig;
import de.mirkosertic.imagemonitor.monitor.WorkerPoolService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Main entry point of the image monitor.
 * Wires the shared pools, the monitor and the processor, then blocks until the JVM shuts down.
 */
public class ImageMonitorApplication {

    private static final Logger logger = LoggerFactory.getLogger(ImageMonitorApplication.class);

    private final ApplicationConfig config;
    private final WatchConfig watchConfig;
    private final WorkerPoolService workerPool;
    private final WorkerPoolService consumer;
    private final FileMonitor monitor;

    public ImageMonitorApplication(final ApplicationConfig config, final ImageProcessor processor) {
        this.config = config;
        this.watchConfig = config.toWatchConfig();

        // Initialize services in dependency order
        this.workerPool = new WorkerPoolService("monitor-worker", config.getWorkerThreads());
        this.consumer = new WorkerPoolService("image-processor", 1);

        this.monitor = new FileMonitor(
                watchConfig,
                processor,
                new TikaImageVerifier(),
                workerPool,
                consumer
        );
    }

    /**
     * Start watching. Creates the monitored directory if it does not exist yet.
     */
    public void start() throws IOException {
        logger.info("Starting image monitor...");
        Files.createDirectories(watchConfig.directory());
        monitor.start();
        logger.info("Image monitor is watching {}", watchConfig.directory());
    }

    /**
     * Block the calling thread until it is interrupted.
     */
    public void awaitTermination() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down image monitor...");

        // Shutdown in reverse order of initialization
        try {
            monitor.stop();
        } catch (final RuntimeException e) {
            logger.error("Error stopping monitor", e);
        }

        try {
            workerPool.shutdown(config.getShutdownTimeoutSeconds());
        } catch (final RuntimeException e) {
            logger.error("Error shutting down worker pool", e);
        }

        try {
            consumer.shutdown(config.getShutdownTimeoutSeconds());
        } catch (final RuntimeException e) {
            logger.error("Error shutting down processor pool", e);
        }

        final MonitorStatistics statistics = monitor.getStatistics();
        logger.info("Image monitor shutdown complete (admitted: {}, processed: {}, dropped: {}, invalid: {})",
                statistics.filesAdmitted(), statistics.filesProcessed(),
                statistics.filesDropped(), statistics.verificationFailures());
    }

    public FileMonitor getMonitor() {
        return monitor;
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            LoggingConfigurator.configure(ApplicationConfig.isDeployedProfile());

            final ApplicationConfig config = ApplicationConfig.load();

            final ImageMonitorApplication app = new ImageMonitorApplication(config, new LoggingImageProcessor());
            app.start();
            app.awaitTermination();

            logger.info("Image monitor finished.");

        } catch (final Exception e) {
            // In deployed mode there is no console appender, so write to stderr
            System.err.println("Failed to start image monitor: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
