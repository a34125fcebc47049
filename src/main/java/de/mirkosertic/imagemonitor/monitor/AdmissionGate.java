package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * First stage of the pipeline, called on the watcher thread for every created file.
 * <p>
 * Filters by extension, suppresses duplicates and enforces the in-flight bound, then
 * submits a {@link DebounceVerifyTask} to the worker pool. Never blocks and never does
 * file I/O. The pending entry is inserted before the task is submitted, so no worker can
 * observe the task without the entry.
 */
public class AdmissionGate implements FileCreatedListener {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionGate.class);

    private final ExtensionMatcher extensionMatcher;
    private final int maxInFlight;
    private final Duration debounce;
    private final LifecycleTracker tracker;
    private final Executor workerPool;
    private final ImageVerifier verifier;
    private final ProcessingDispatcher dispatcher;

    public AdmissionGate(final WatchConfig config,
                         final LifecycleTracker tracker,
                         final Executor workerPool,
                         final ImageVerifier verifier,
                         final ProcessingDispatcher dispatcher) {
        this.extensionMatcher = new ExtensionMatcher(config.acceptedExtensions());
        this.maxInFlight = config.maxInFlight();
        this.debounce = config.debounce();
        this.tracker = tracker;
        this.workerPool = workerPool;
        this.verifier = verifier;
        this.dispatcher = dispatcher;
    }

    @Override
    public void onFileCreated(final Path file) {
        admit(file);
    }

    AdmissionOutcome admit(final Path file) {
        if (!extensionMatcher.matches(file)) {
            tracker.recordRejection(AdmissionOutcome.UNSUPPORTED_EXTENSION);
            logger.debug("Rejected {}: unsupported extension", file);
            return AdmissionOutcome.UNSUPPORTED_EXTENSION;
        }

        final LifecycleTracker.Admission admission = tracker.tryAdmit(file, maxInFlight);
        if (admission.outcome() == AdmissionOutcome.DUPLICATE) {
            logger.debug("Rejected {}: already tracked", file);
            return AdmissionOutcome.DUPLICATE;
        }
        if (admission.outcome() == AdmissionOutcome.CAPACITY_EXCEEDED) {
            logger.warn("Queue full ({}/{}), dropping: {} (total dropped: {})",
                    admission.inFlight(), maxInFlight, file.getFileName(), admission.droppedTotal());
            return AdmissionOutcome.CAPACITY_EXCEEDED;
        }
        return submit(file);
    }

    private AdmissionOutcome submit(final Path file) {
        try {
            workerPool.execute(new DebounceVerifyTask(file, debounce, tracker, verifier, dispatcher));
            logger.debug("Admitted {}", file);
            return AdmissionOutcome.ADMITTED;
        } catch (final RejectedExecutionException e) {
            final long droppedTotal = tracker.dropPending(file);
            logger.warn("Worker pool rejected {}, dropping it (total dropped: {})", file.getFileName(), droppedTotal);
            return AdmissionOutcome.CAPACITY_EXCEEDED;
        }
    }
}
