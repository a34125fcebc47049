package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * {@link DirectoryWatcher} backed by the JDK {@link WatchService}, which uses inotify,
 * FSEvents or ReadDirectoryChangesW where available.
 */
public class NativeDirectoryWatcher implements DirectoryWatcher {

    private static final Logger logger = LoggerFactory.getLogger(NativeDirectoryWatcher.class);

    private final Path directory;
    private final Duration pollTimeout;
    private final ExecutorService watchExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "directory-watcher");
        thread.setDaemon(true);
        return thread;
    });

    private volatile WatchService watchService;
    private volatile boolean running;

    public NativeDirectoryWatcher(final Path directory, final Duration pollTimeout) {
        this.directory = directory;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public void start(final FileCreatedListener listener) throws IOException {
        if (watchService != null) {
            throw new IllegalStateException("Watcher for " + directory + " has already been started");
        }
        final WatchService service = FileSystems.getDefault().newWatchService();
        try {
            directory.register(service, ENTRY_CREATE);
        } catch (final IOException | RuntimeException e) {
            service.close();
            watchExecutor.shutdownNow();
            throw e;
        }
        watchService = service;
        running = true;
        logger.debug("Registered watch for directory: {}", directory);

        watchExecutor.execute(() -> {
            try {
                processEvents(service, listener);
            } finally {
                running = false;
            }
        });
    }

    private void processEvents(final WatchService service, final FileCreatedListener listener) {
        logger.info("Directory watcher started for {}", directory);

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = service.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.debug("Watch service closed");
                break;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();

                if (kind == OVERFLOW) {
                    logger.warn("Watch event overflow for {}, some creations were not reported", directory);
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = directory.resolve(pathEvent.context());

                if (Files.isDirectory(fullPath)) {
                    continue;
                }
                try {
                    listener.onFileCreated(fullPath);
                } catch (final RuntimeException e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            if (!key.reset()) {
                logger.warn("Watch key for {} is no longer valid, directory was probably removed", directory);
                break;
            }
        }

        logger.info("Directory watcher stopped for {}", directory);
    }

    @Override
    public boolean stop(final Duration timeout) {
        watchExecutor.shutdownNow();
        final WatchService service = watchService;
        if (service != null) {
            try {
                service.close();
            } catch (final IOException e) {
                logger.warn("Error closing watch service for {}", directory, e);
            }
        }
        try {
            return watchExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public boolean isAlive() {
        return running && !watchExecutor.isTerminated();
    }
}
