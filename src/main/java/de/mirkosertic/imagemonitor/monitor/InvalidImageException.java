package de.mirkosertic.imagemonitor.monitor;

/**
 * Thrown when a file does not pass the structural image check.
 */
public class InvalidImageException extends Exception {

    public InvalidImageException(final String message) {
        super(message);
    }

    public InvalidImageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
