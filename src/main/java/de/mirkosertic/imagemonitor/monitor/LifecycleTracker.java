package de.mirkosertic.imagemonitor.monitor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Shared state of one monitor run: which files are pending, verifying or processing,
 * plus the counters behind {@link MonitorStatistics}.
 * <p>
 * All membership changes happen under a single lock, so a file is in at most one state
 * at any instant and the duplicate check, the capacity check and the insert of an
 * admission are one atomic step. Counters are atomics and may be read without the lock.
 * <p>
 * Every transition tolerates a file that is no longer tracked in the expected state.
 * Tasks that outlive the run they were started in keep mutating the tracker after the
 * monitor has stopped.
 */
public class LifecycleTracker {

    private final Object lock = new Object();
    private final LongSupplier clock;

    // Insertion ordered, guarded by lock
    private final Map<Path, TrackedFile> trackedFiles = new LinkedHashMap<>();
    private final Map<FileState, Integer> stateCounts = new EnumMap<>(FileState.class);

    private final AtomicLong admitted = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);
    private final Map<AdmissionOutcome, AtomicLong> rejections = new EnumMap<>(AdmissionOutcome.class);
    private final AtomicLong vanished = new AtomicLong(0);
    private final AtomicLong verificationFailures = new AtomicLong(0);
    private final AtomicLong processed = new AtomicLong(0);
    private final AtomicLong processingFailures = new AtomicLong(0);

    public LifecycleTracker() {
        this(System::currentTimeMillis);
    }

    LifecycleTracker(final LongSupplier clock) {
        this.clock = clock;
        for (final FileState state : FileState.values()) {
            stateCounts.put(state, 0);
        }
        for (final AdmissionOutcome outcome : AdmissionOutcome.values()) {
            if (outcome.isRejected()) {
                rejections.put(outcome, new AtomicLong(0));
            }
        }
    }

    /**
     * Result of an admission attempt, with the in-flight and dropped totals observed
     * while the decision was taken.
     */
    public record Admission(AdmissionOutcome outcome, int inFlight, long droppedTotal) {
    }

    /**
     * Atomically checks for a duplicate, checks the capacity and inserts the file as pending.
     */
    public Admission tryAdmit(final Path file, final int maxInFlight) {
        synchronized (lock) {
            final int inFlight = trackedFiles.size();
            if (trackedFiles.containsKey(file)) {
                rejections.get(AdmissionOutcome.DUPLICATE).incrementAndGet();
                return new Admission(AdmissionOutcome.DUPLICATE, inFlight, dropped.get());
            }
            if (inFlight >= maxInFlight) {
                rejections.get(AdmissionOutcome.CAPACITY_EXCEEDED).incrementAndGet();
                return new Admission(AdmissionOutcome.CAPACITY_EXCEEDED, inFlight, dropped.incrementAndGet());
            }
            put(new TrackedFile(file, FileState.PENDING, clock.getAsLong()));
            admitted.incrementAndGet();
            return new Admission(AdmissionOutcome.ADMITTED, inFlight + 1, dropped.get());
        }
    }

    /**
     * Counts a rejection that did not need any tracked state, like a wrong extension.
     */
    public void recordRejection(final AdmissionOutcome outcome) {
        if (!outcome.isRejected()) {
            throw new IllegalArgumentException("Not a rejection: " + outcome);
        }
        rejections.get(outcome).incrementAndGet();
    }

    /**
     * Undoes an admission whose worker task could not be submitted. Counted as a drop.
     *
     * @return the new dropped total
     */
    public long dropPending(final Path file) {
        synchronized (lock) {
            final TrackedFile tracked = trackedFiles.get(file);
            if (tracked != null && tracked.state() == FileState.PENDING) {
                remove(file);
                admitted.decrementAndGet();
            }
            rejections.get(AdmissionOutcome.CAPACITY_EXCEEDED).incrementAndGet();
            return dropped.incrementAndGet();
        }
    }

    /**
     * Ends the debounce wait. The file leaves the pending state in any case.
     *
     * @return true if the file was pending and is now verifying
     */
    public boolean finishDebounce(final Path file) {
        synchronized (lock) {
            final TrackedFile tracked = trackedFiles.get(file);
            if (tracked == null || tracked.state() != FileState.PENDING) {
                return false;
            }
            put(tracked.withState(FileState.VERIFYING));
            return true;
        }
    }

    /**
     * Releases a file that disappeared between admission and verification.
     */
    public void discardVanished(final Path file) {
        if (discard(file)) {
            vanished.incrementAndGet();
        }
    }

    /**
     * Releases a file that failed the structural check.
     */
    public void discardInvalid(final Path file) {
        if (discard(file)) {
            verificationFailures.incrementAndGet();
        }
    }

    /**
     * @return true if the file was verifying and is now processing
     */
    public boolean markProcessing(final Path file) {
        synchronized (lock) {
            final TrackedFile tracked = trackedFiles.get(file);
            if (tracked == null || tracked.state() != FileState.VERIFYING) {
                return false;
            }
            put(tracked.withState(FileState.PROCESSING));
            return true;
        }
    }

    /**
     * Releases a file after the processor completed, successfully or not.
     */
    public void finishProcessing(final Path file, final boolean success) {
        synchronized (lock) {
            final TrackedFile tracked = trackedFiles.get(file);
            if (tracked == null || tracked.state() != FileState.PROCESSING) {
                return;
            }
            remove(file);
        }
        if (success) {
            processed.incrementAndGet();
        } else {
            processingFailures.incrementAndGet();
        }
    }

    private boolean discard(final Path file) {
        synchronized (lock) {
            final TrackedFile tracked = trackedFiles.get(file);
            if (tracked == null || tracked.state() == FileState.PROCESSING) {
                return false;
            }
            remove(file);
            return true;
        }
    }

    private void put(final TrackedFile tracked) {
        final TrackedFile previous = trackedFiles.put(tracked.file(), tracked);
        if (previous != null) {
            stateCounts.merge(previous.state(), -1, Integer::sum);
        }
        stateCounts.merge(tracked.state(), 1, Integer::sum);
    }

    private void remove(final Path file) {
        final TrackedFile previous = trackedFiles.remove(file);
        if (previous != null) {
            stateCounts.merge(previous.state(), -1, Integer::sum);
        }
    }

    public Optional<FileState> stateOf(final Path file) {
        synchronized (lock) {
            final TrackedFile tracked = trackedFiles.get(file);
            return tracked == null ? Optional.empty() : Optional.of(tracked.state());
        }
    }

    public boolean isTracked(final Path file) {
        synchronized (lock) {
            return trackedFiles.containsKey(file);
        }
    }

    public int getPendingCount() {
        return countOf(FileState.PENDING);
    }

    public int getVerifyingCount() {
        return countOf(FileState.VERIFYING);
    }

    public int getProcessingCount() {
        return countOf(FileState.PROCESSING);
    }

    public int getInFlightCount() {
        synchronized (lock) {
            return trackedFiles.size();
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    private int countOf(final FileState state) {
        synchronized (lock) {
            return stateCounts.get(state);
        }
    }

    public MonitorStatistics getStatistics() {
        final long now = clock.getAsLong();
        final List<MonitorStatistics.ActiveFile> active = new ArrayList<>();
        final int pending;
        final int verifying;
        final int processing;
        synchronized (lock) {
            for (final TrackedFile tracked : trackedFiles.values()) {
                active.add(new MonitorStatistics.ActiveFile(tracked.file().toString(), tracked.state(), tracked.ageMs(now)));
            }
            pending = stateCounts.get(FileState.PENDING);
            verifying = stateCounts.get(FileState.VERIFYING);
            processing = stateCounts.get(FileState.PROCESSING);
        }
        final Map<AdmissionOutcome, Long> rejected = new EnumMap<>(AdmissionOutcome.class);
        rejections.forEach((outcome, count) -> rejected.put(outcome, count.get()));
        return new MonitorStatistics(
                pending,
                verifying,
                processing,
                admitted.get(),
                dropped.get(),
                rejected,
                vanished.get(),
                verificationFailures.get(),
                processed.get(),
                processingFailures.get(),
                active
        );
    }
}
