package de.mirkosertic.imagemonitor.monitor;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Case-insensitive exact match of a file's last extension against a fixed set.
 * Works on the name only, never touches the file system.
 */
public class ExtensionMatcher {

    private final Set<String> acceptedExtensions;

    public ExtensionMatcher(final Set<String> acceptedExtensions) {
        this.acceptedExtensions = Set.copyOf(acceptedExtensions);
    }

    public boolean matches(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final String extension = extensionOf(fileName.toString());
        return extension != null && acceptedExtensions.contains(extension);
    }

    static String extensionOf(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        // Dotfiles like ".png" have no extension
        if (dot <= 0 || dot == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
