package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executor;

/**
 * Owns the watch registration of one directory and feeds its creation events into the
 * admission pipeline.
 * <p>
 * The worker pool and the consumer executor are shared and injected, the monitor never
 * shuts them down. {@link #stop()} only ends event intake: debounce, verification and
 * processing work that is already under way runs to completion against the tracker of
 * the run it was started in. Each {@link #start()} begins with a fresh tracker.
 */
public class FileMonitor {

    private static final Logger logger = LoggerFactory.getLogger(FileMonitor.class);

    private final WatchConfig config;
    private final ImageProcessor processor;
    private final ImageVerifier verifier;
    private final Executor workerPool;
    private final Executor consumerExecutor;
    private final DirectoryWatcherFactory watcherFactory;

    private DirectoryWatcher watcher;
    private AdmissionGate gate;
    private volatile LifecycleTracker tracker = new LifecycleTracker();

    public FileMonitor(final WatchConfig config,
                       final ImageProcessor processor,
                       final ImageVerifier verifier,
                       final Executor workerPool,
                       final Executor consumerExecutor) {
        this(config, processor, verifier, workerPool, consumerExecutor, DirectoryWatcherFactory.byWatchMode());
    }

    public FileMonitor(final WatchConfig config,
                       final ImageProcessor processor,
                       final ImageVerifier verifier,
                       final Executor workerPool,
                       final Executor consumerExecutor,
                       final DirectoryWatcherFactory watcherFactory) {
        this.config = config;
        this.processor = processor;
        this.verifier = verifier;
        this.workerPool = workerPool;
        this.consumerExecutor = consumerExecutor;
        this.watcherFactory = watcherFactory;
    }

    /**
     * Start monitoring the directory. Does nothing if already running. A watcher that
     * ended on its own is discarded and replaced.
     *
     * @throws IOException if the directory cannot be watched, the monitor stays stopped
     */
    public synchronized void start() throws IOException {
        if (watcher != null) {
            if (watcher.isAlive()) {
                logger.info("Monitor for {} is already running", config.directory());
                return;
            }
            logger.warn("Watcher for {} has ended on its own, restarting it", config.directory());
            watcher.stop(config.shutdownTimeout());
            watcher = null;
            gate = null;
        }

        logger.info("Starting monitor for: {} (mode: {}, max in flight: {}, debounce: {} ms)",
                config.directory(), config.watchMode(), config.maxInFlight(), config.debounce().toMillis());

        final LifecycleTracker newTracker = new LifecycleTracker();
        final ProcessingDispatcher dispatcher = new ProcessingDispatcher(processor, consumerExecutor, newTracker);
        final AdmissionGate newGate = new AdmissionGate(config, newTracker, workerPool, verifier, dispatcher);

        final DirectoryWatcher newWatcher = watcherFactory.create(config);
        newWatcher.start(newGate);

        tracker = newTracker;
        gate = newGate;
        watcher = newWatcher;

        logger.info("Monitor started successfully");
    }

    /**
     * Stop monitoring. Waits at most the configured shutdown timeout for the watcher thread.
     * Does nothing if not running.
     */
    public synchronized void stop() {
        if (watcher == null) {
            return;
        }

        logger.info("Stopping monitor for {}...", config.directory());
        final boolean terminated = watcher.stop(config.shutdownTimeout());
        if (!terminated) {
            logger.warn("Watcher for {} did not stop within {} ms, abandoning it",
                    config.directory(), config.shutdownTimeout().toMillis());
        }
        watcher = null;
        gate = null;

        final LifecycleTracker current = tracker;
        logger.info("Monitor stopped ({} files still in flight, {} dropped)",
                current.getInFlightCount(), current.getDroppedCount());
    }

    public synchronized boolean isRunning() {
        return watcher != null && watcher.isAlive();
    }

    /**
     * Tracker of the current run, or of the last one after {@link #stop()}.
     */
    public LifecycleTracker getTracker() {
        return tracker;
    }

    public MonitorStatistics getStatistics() {
        return tracker.getStatistics();
    }

    public WatchConfig getConfig() {
        return config;
    }

    synchronized AdmissionGate getGate() {
        return gate;
    }
}
