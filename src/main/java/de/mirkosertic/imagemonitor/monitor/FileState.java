package de.mirkosertic.imagemonitor.monitor;

/**
 * Materialised states of a tracked file. Files that are not tracked at all are either
 * unseen, finished or discarded.
 */
public enum FileState {
    /** Waiting for the debounce interval to elapse. */
    PENDING,
    /** Debounce done, structural check running. */
    VERIFYING,
    /** Handed to the image processor, waiting for its completion. */
    PROCESSING
}
