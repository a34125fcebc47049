package de.mirkosertic.imagemonitor.monitor;

/**
 * Decision of the {@link AdmissionGate} for a single creation event.
 */
public enum AdmissionOutcome {
    ADMITTED,
    UNSUPPORTED_EXTENSION,
    DUPLICATE,
    CAPACITY_EXCEEDED;

    public boolean isRejected() {
        return this != ADMITTED;
    }
}
