package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed size thread pool with a bounded queue, shared by the monitor and the rest of the
 * application. A pool with a single thread serves as the consumer context of the
 * {@link ProcessingDispatcher}.
 * <p>
 * A full queue rejects with {@link RejectedExecutionException} instead of running the
 * task on the caller, so a watcher thread is never blocked by a debounce.
 */
public class WorkerPoolService implements Executor {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPoolService.class);

    private static final int QUEUE_CAPACITY = 10000;

    private final String name;
    private final ThreadPoolExecutor executor;

    public WorkerPoolService(final String name, final int threads) {
        this(name, threads, QUEUE_CAPACITY);
    }

    public WorkerPoolService(final String name, final int threads, final int queueCapacity) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.name = name;
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, threads == 1 ? name : name + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()
        );

        logger.info("{} pool initialized with {} threads", name, threads);
    }

    @Override
    public void execute(final Runnable task) {
        executor.execute(task);
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    public int getQueueSize() {
        return executor.getQueue().size();
    }

    /**
     * Lets queued tasks finish for up to the given time, then interrupts the rest.
     * Should be called on application shutdown.
     */
    public void shutdown(final long timeoutSeconds) {
        logger.info("Shutting down {} pool", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("{} pool did not terminate in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for {} pool to terminate", name, e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
