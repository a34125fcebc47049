package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * {@link DirectoryWatcher} that compares directory listings at a fixed interval.
 * <p>
 * Files that already exist when the watcher starts are the baseline and are not
 * reported. A file that disappears and shows up again between two scans is reported
 * again.
 */
public class PollingDirectoryWatcher implements DirectoryWatcher {

    private static final Logger logger = LoggerFactory.getLogger(PollingDirectoryWatcher.class);

    private final Path directory;
    private final Duration pollInterval;
    private final ScheduledExecutorService pollExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread thread = new Thread(r, "directory-poller");
        thread.setDaemon(true);
        return thread;
    });

    // Only touched from the poller thread after start
    private Set<Path> knownFiles = new HashSet<>();
    private volatile boolean started;

    public PollingDirectoryWatcher(final Path directory, final Duration pollInterval) {
        this.directory = directory;
        this.pollInterval = pollInterval;
    }

    @Override
    public void start(final FileCreatedListener listener) throws IOException {
        if (started) {
            throw new IllegalStateException("Watcher for " + directory + " has already been started");
        }
        if (!Files.isDirectory(directory)) {
            pollExecutor.shutdownNow();
            throw new NotDirectoryException(directory.toString());
        }
        knownFiles = listRegularFiles();
        started = true;
        logger.info("Polling {} every {} ms, {} existing files ignored", directory, pollInterval.toMillis(), knownFiles.size());

        pollExecutor.scheduleWithFixedDelay(() -> scan(listener),
                pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void scan(final FileCreatedListener listener) {
        final Set<Path> currentFiles;
        try {
            currentFiles = listRegularFiles();
        } catch (final IOException e) {
            logger.warn("Cannot list {}: {}", directory, e.getMessage());
            return;
        }

        for (final Path file : currentFiles) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            if (!knownFiles.contains(file)) {
                try {
                    listener.onFileCreated(file);
                } catch (final RuntimeException e) {
                    logger.error("Error processing watch event for: {}", file, e);
                }
            }
        }
        knownFiles = currentFiles;
    }

    private Set<Path> listRegularFiles() throws IOException {
        final Set<Path> files = new HashSet<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile).forEach(files::add);
        }
        return files;
    }

    @Override
    public boolean stop(final Duration timeout) {
        pollExecutor.shutdownNow();
        try {
            return pollExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public boolean isAlive() {
        return started && !pollExecutor.isShutdown();
    }
}
