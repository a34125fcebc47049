package de.mirkosertic.imagemonitor.monitor;

import java.nio.file.Path;
import java.util.concurrent.CompletionStage;

/**
 * Downstream consumer of verified images.
 * <p>
 * Invoked at most once per admission, always on the monitor's consumer thread. The call
 * itself must not block; long running work belongs in the returned stage. Neither a failed
 * result nor an exceptional completion causes a retry.
 */
@FunctionalInterface
public interface ImageProcessor {

    CompletionStage<ProcessingResult> process(Path file);
}
