package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Processor used when no downstream pipeline is plugged in. Logs every new image.
 */
public class LoggingImageProcessor implements ImageProcessor {

    private static final Logger logger = LoggerFactory.getLogger(LoggingImageProcessor.class);

    @Override
    public CompletionStage<ProcessingResult> process(final Path file) {
        try {
            final long size = Files.size(file);
            logger.info("New image: {} ({} bytes)", file.getFileName(), size);
            return CompletableFuture.completedFuture(ProcessingResult.success(file, size + " bytes"));
        } catch (final IOException e) {
            return CompletableFuture.completedFuture(ProcessingResult.failure(file, "Cannot read size: " + e.getMessage()));
        }
    }
}
