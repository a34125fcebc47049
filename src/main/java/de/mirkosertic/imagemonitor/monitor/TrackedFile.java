package de.mirkosertic.imagemonitor.monitor;

import java.nio.file.Path;

/**
 * Snapshot of a file known to the pipeline.
 *
 * @param file          the admitted path
 * @param state         current lifecycle state
 * @param admittedAtMs  epoch millis of the admission
 */
public record TrackedFile(Path file, FileState state, long admittedAtMs) {

    TrackedFile withState(final FileState newState) {
        return new TrackedFile(file, newState, admittedAtMs);
    }

    public long ageMs(final long nowMs) {
        return nowMs - admittedAtMs;
    }
}
