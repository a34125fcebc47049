package de.mirkosertic.imagemonitor.monitor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings of a {@link FileMonitor}.
 *
 * @param directory          directory to watch, non-recursive
 * @param acceptedExtensions lower case extensions including the leading dot
 * @param debounce           settle interval between admission and verification
 * @param maxInFlight        upper bound for tracked files, excess admissions are dropped
 * @param watchMode          native notifications or polling
 * @param pollInterval       scan interval in polling mode, poll timeout in native mode
 * @param shutdownTimeout    how long {@link FileMonitor#stop()} waits for the watcher thread
 */
public record WatchConfig(
        Path directory,
        Set<String> acceptedExtensions,
        Duration debounce,
        int maxInFlight,
        WatchMode watchMode,
        Duration pollInterval,
        Duration shutdownTimeout
) {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp");

    public WatchConfig {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(debounce, "debounce");
        Objects.requireNonNull(watchMode, "watchMode");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must not be negative: " + debounce);
        }
        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be positive: " + maxInFlight);
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative: " + shutdownTimeout);
        }
        acceptedExtensions = normalizeExtensions(acceptedExtensions);
    }

    /**
     * Configuration with the default extensions, a one second debounce and room for 100 files.
     */
    public static WatchConfig defaults(final Path directory) {
        return new WatchConfig(directory, Set.copyOf(DEFAULT_EXTENSIONS), Duration.ofSeconds(1), 100,
                WatchMode.NATIVE, Duration.ofSeconds(1), Duration.ofSeconds(5));
    }

    public WatchConfig withDebounce(final Duration value) {
        return new WatchConfig(directory, acceptedExtensions, value, maxInFlight, watchMode, pollInterval, shutdownTimeout);
    }

    public WatchConfig withMaxInFlight(final int value) {
        return new WatchConfig(directory, acceptedExtensions, debounce, value, watchMode, pollInterval, shutdownTimeout);
    }

    public WatchConfig withWatchMode(final WatchMode value) {
        return new WatchConfig(directory, acceptedExtensions, debounce, maxInFlight, value, pollInterval, shutdownTimeout);
    }

    public WatchConfig withPollInterval(final Duration value) {
        return new WatchConfig(directory, acceptedExtensions, debounce, maxInFlight, watchMode, value, shutdownTimeout);
    }

    private static Set<String> normalizeExtensions(final Collection<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one accepted extension is required");
        }
        final Set<String> normalized = new LinkedHashSet<>();
        for (final String extension : extensions) {
            final String trimmed = extension.trim().toLowerCase(Locale.ROOT);
            if (trimmed.isEmpty() || ".".equals(trimmed)) {
                continue;
            }
            normalized.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one accepted extension is required");
        }
        return Set.copyOf(normalized);
    }
}
