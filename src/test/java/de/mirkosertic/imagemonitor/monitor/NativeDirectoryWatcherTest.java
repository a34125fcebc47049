package de.mirkosertic.imagemonitor.monitor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * Uses the platform WatchService. On platforms where the JDK falls back to polling,
 * events can take several seconds, hence the generous timeouts.
 */
@DisplayName("NativeDirectoryWatcher Tests")
class NativeDirectoryWatcherTest {

    @TempDir
    Path tempDir;

    private NativeDirectoryWatcher watcher;

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.stop(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("Should report created files")
    void shouldReportCreatedFiles() throws Exception {
        final FileCreatedListener listener = mock(FileCreatedListener.class);
        watcher = new NativeDirectoryWatcher(tempDir, Duration.ofMillis(100));
        watcher.start(listener);

        final Path created = Files.createFile(tempDir.resolve("photo.png"));

        verify(listener, timeout(15000)).onFileCreated(created);
        assertThat(watcher.isAlive()).isTrue();
    }

    @Test
    @DisplayName("Should not report created directories")
    void shouldIgnoreDirectories() throws Exception {
        final FileCreatedListener listener = mock(FileCreatedListener.class);
        watcher = new NativeDirectoryWatcher(tempDir, Duration.ofMillis(100));
        watcher.start(listener);

        Files.createDirectory(tempDir.resolve("album"));

        verify(listener, after(1000).never()).onFileCreated(any());
    }

    @Test
    @DisplayName("Should stop and report not alive")
    void shouldStop() throws Exception {
        watcher = new NativeDirectoryWatcher(tempDir, Duration.ofMillis(100));
        watcher.start(mock(FileCreatedListener.class));

        assertThat(watcher.stop(Duration.ofSeconds(5))).isTrue();
        assertThat(watcher.isAlive()).isFalse();
    }

    @Test
    @DisplayName("Should fail to start on a missing directory")
    void shouldFailOnMissingDirectory() {
        watcher = new NativeDirectoryWatcher(tempDir.resolve("missing"), Duration.ofMillis(100));

        assertThatThrownBy(() -> watcher.start(mock(FileCreatedListener.class)))
                .isInstanceOf(IOException.class);
        assertThat(watcher.isAlive()).isFalse();
    }
}
