package de.mirkosertic.imagemonitor.monitor;

import java.util.Locale;

/**
 * How creation events are obtained from the file system.
 */
public enum WatchMode {

    /** OS notifications through the JDK {@link java.nio.file.WatchService}. */
    NATIVE,

    /** Periodic directory listing, for file systems without native notifications (network shares, some containers). */
    POLLING;

    public static WatchMode parse(final String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown watch mode '" + value + "', expected native or polling", e);
        }
    }
}
