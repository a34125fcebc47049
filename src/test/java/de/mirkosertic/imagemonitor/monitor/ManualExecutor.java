package de.mirkosertic.imagemonitor.monitor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Executor that only queues tasks until the test runs them explicitly.
 */
class ManualExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(final Runnable command) {
        tasks.add(command);
    }

    synchronized int size() {
        return tasks.size();
    }

    /**
     * Runs queued tasks, including tasks queued while running, until the queue is empty.
     */
    void runAll() {
        Runnable next;
        while ((next = poll()) != null) {
            next.run();
        }
    }

    private synchronized Runnable poll() {
        return tasks.poll();
    }
}
