package de.mirkosertic.imagemonitor.monitor;

import java.io.IOException;
import java.time.Duration;

/**
 * Delivers creation events for regular files in a single directory, non-recursive.
 * A watcher instance is started at most once.
 */
public interface DirectoryWatcher {

    /**
     * Registers the watch and starts the event thread.
     *
     * @throws IOException if the directory cannot be watched
     */
    void start(FileCreatedListener listener) throws IOException;

    /**
     * Requests the event thread to halt and waits for it.
     *
     * @return false if the thread was still running when the timeout elapsed
     */
    boolean stop(Duration timeout);

    boolean isAlive();
}
