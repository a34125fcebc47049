package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands verified files from worker threads to the {@link ImageProcessor}.
 * <p>
 * The processor always runs on the consumer executor, which is expected to be single
 * threaded. {@link #dispatch(Path)} only enqueues and returns immediately. When the
 * processor's stage completes, successfully or not, the file is released from the
 * processing state. This is the only place that releases it.
 */
public class ProcessingDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingDispatcher.class);

    private final ImageProcessor processor;
    private final Executor consumerExecutor;
    private final LifecycleTracker tracker;

    public ProcessingDispatcher(final ImageProcessor processor, final Executor consumerExecutor, final LifecycleTracker tracker) {
        this.processor = processor;
        this.consumerExecutor = consumerExecutor;
        this.tracker = tracker;
    }

    public void dispatch(final Path file) {
        try {
            consumerExecutor.execute(() -> invoke(file));
        } catch (final RejectedExecutionException e) {
            logger.error("Consumer rejected {}, releasing it unprocessed", file, e);
            tracker.finishProcessing(file, false);
        }
    }

    private void invoke(final Path file) {
        logger.info("Processing new file: {}", file.getFileName());
        boolean handedOff = false;
        try {
            final CompletionStage<ProcessingResult> stage = processor.process(file);
            if (stage == null) {
                logger.error("Processor returned no result for {}", file);
            } else {
                stage.whenComplete((result, error) -> complete(file, result, error));
                handedOff = true;
            }
        } catch (final RuntimeException e) {
            logger.error("Error processing {}", file, e);
        } finally {
            // Errors still propagate, but never with the file left in processing
            if (!handedOff) {
                tracker.finishProcessing(file, false);
            }
        }
    }

    private void complete(final Path file, final ProcessingResult result, final Throwable error) {
        boolean success = false;
        try {
            if (error != null) {
                logger.error("Error processing {}", file, error);
            } else if (result == null || !result.success()) {
                logger.error("Processing failed for {}: {}", file, result == null ? "no result" : result.message());
            } else {
                success = true;
                logger.info("Successfully processed: {}", file.getFileName());
            }
        } finally {
            tracker.finishProcessing(file, success);
        }
    }
}
