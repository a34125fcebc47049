package de.mirkosertic.imagemonitor.monitor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Lightweight structural check run before a file is committed to processing.
 * Implementations must not decode the full image.
 */
public interface ImageVerifier {

    void verify(Path file) throws IOException, InvalidImageException;
}
