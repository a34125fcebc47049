package de.mirkosertic.imagemonitor.monitor;

import java.util.List;
import java.util.Map;

public record MonitorStatistics(
        int pendingCount,
        int verifyingCount,
        int processingCount,
        long filesAdmitted,
        long filesDropped,
        /** Rejections per reason, capacity drops included. */
        Map<AdmissionOutcome, Long> rejections,
        /** Files that disappeared during the debounce wait. */
        long filesVanished,
        long verificationFailures,
        long filesProcessed,
        long processingFailures,
        /** Files currently tracked, in admission order. */
        List<ActiveFile> activeFiles
) {

    public MonitorStatistics {
        rejections = Map.copyOf(rejections);
        activeFiles = List.copyOf(activeFiles);
    }

    public int inFlightCount() {
        return pendingCount + verifyingCount + processingCount;
    }

    public long rejectedCount(final AdmissionOutcome outcome) {
        return rejections.getOrDefault(outcome, 0L);
    }

    /** A file known to the pipeline together with the time since its admission. */
    public record ActiveFile(String filePath, FileState state, long ageMs) {
    }
}
