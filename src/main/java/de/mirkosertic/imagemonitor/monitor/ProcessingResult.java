package de.mirkosertic.imagemonitor.monitor;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Outcome reported by an {@link ImageProcessor}. Only logged by the monitor.
 */
public record ProcessingResult(Path file, boolean success, @Nullable String message) {

    public static ProcessingResult success(final Path file) {
        return new ProcessingResult(file, true, null);
    }

    public static ProcessingResult success(final Path file, final String message) {
        return new ProcessingResult(file, true, message);
    }

    public static ProcessingResult failure(final Path file, final String message) {
        return new ProcessingResult(file, false, message);
    }
}
