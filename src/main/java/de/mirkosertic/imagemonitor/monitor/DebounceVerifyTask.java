package de.mirkosertic.imagemonitor.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Worker side of one admission: waits for the writer to settle, checks that the file is
 * still there and structurally valid, then hands it to the dispatcher.
 * <p>
 * Runs on a pool thread. Every outcome is terminal and there are no retries. Exceptions
 * never escape {@link #run()}; an {@link Error} is rethrown, but only after the file has
 * been released.
 */
class DebounceVerifyTask implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(DebounceVerifyTask.class);

    private final Path file;
    private final Duration debounce;
    private final LifecycleTracker tracker;
    private final ImageVerifier verifier;
    private final ProcessingDispatcher dispatcher;

    DebounceVerifyTask(final Path file,
                       final Duration debounce,
                       final LifecycleTracker tracker,
                       final ImageVerifier verifier,
                       final ProcessingDispatcher dispatcher) {
        this.file = file;
        this.debounce = debounce;
        this.tracker = tracker;
        this.verifier = verifier;
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        try {
            if (!debounce.isZero()) {
                Thread.sleep(debounce.toMillis());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Debounce interrupted for {}, discarding it", file);
            tracker.finishDebounce(file);
            tracker.discardVanished(file);
            return;
        }

        if (!tracker.finishDebounce(file)) {
            logger.debug("{} is no longer pending, skipping verification", file);
            return;
        }

        try {
            verifyAndDispatch();
        } catch (final RuntimeException e) {
            logger.error("Error handing off {}", file, e);
            releaseAfterFailure();
        } catch (final Error e) {
            logger.error("Fatal error while handling {}, releasing it", file, e);
            releaseAfterFailure();
            throw e;
        }
    }

    private void verifyAndDispatch() {
        try {
            if (!Files.exists(file)) {
                // Temp files and write-then-rename patterns end up here
                logger.debug("File disappeared before verification: {}", file);
                tracker.discardVanished(file);
                return;
            }

            verifier.verify(file);
        } catch (final NoSuchFileException e) {
            logger.debug("File disappeared during verification: {}", file);
            tracker.discardVanished(file);
            return;
        } catch (final InvalidImageException | IOException e) {
            logger.warn("Invalid image file {}: {}", file, e.getMessage());
            tracker.discardInvalid(file);
            return;
        } catch (final RuntimeException e) {
            logger.error("Error verifying {}", file, e);
            tracker.discardInvalid(file);
            return;
        }

        if (tracker.markProcessing(file)) {
            dispatcher.dispatch(file);
        }
    }

    private void releaseAfterFailure() {
        if (tracker.stateOf(file).orElse(null) == FileState.PROCESSING) {
            tracker.finishProcessing(file, false);
        } else {
            tracker.discardInvalid(file);
        }
    }
}
