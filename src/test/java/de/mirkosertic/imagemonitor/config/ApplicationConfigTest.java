package de.mirkosertic.imagemonitor.config;

import de.mirkosertic.imagemonitor.monitor.WatchConfig;
import de.mirkosertic.imagemonitor.monitor.WatchMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should use classpath defaults when nothing else is configured")
    void shouldUseDefaults() {
        final ApplicationConfig config = ApplicationConfig.load(tempDir.resolve("missing.yaml"), Map.of());

        assertThat(config.getDirectory()).isNull();
        assertThat(config.getAcceptedExtensions()).containsExactly(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp");
        assertThat(config.getDebounceSeconds()).isEqualTo(1.0);
        assertThat(config.getMaxInFlight()).isEqualTo(100);
        assertThat(config.getWatchMode()).isEqualTo(WatchMode.NATIVE);
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getShutdownTimeoutSeconds()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should fail to build a watch config without directory")
    void shouldRequireDirectory() {
        final ApplicationConfig config = ApplicationConfig.load(tempDir.resolve("missing.yaml"), Map.of());

        assertThatThrownBy(config::toWatchConfig)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("IMAGEMONITOR_DIRECTORY");
    }

    @Test
    @DisplayName("Should carry the default extensions into the watch config")
    void shouldBuildWatchConfigFromDefaults() {
        final WatchConfig watchConfig = ApplicationConfig.load(tempDir.resolve("missing.yaml"),
                Map.of("IMAGEMONITOR_DIRECTORY", tempDir.toString())).toWatchConfig();

        assertThat(watchConfig.acceptedExtensions()).containsExactly(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp");
        assertThat(watchConfig.maxInFlight()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should apply the user config file")
    void shouldApplyUserConfig() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                imagemonitor:
                  monitor:
                    directory: /srv/memes
                    accepted-extensions: [PNG, .webp]
                    debounce-seconds: 0.25
                    max-in-flight: 7
                    watch-mode: polling
                    poll-interval-ms: 500
                    worker-threads: 2
                    shutdown-timeout-seconds: 3
                """);

        final WatchConfig watchConfig = ApplicationConfig.load(userConfig, Map.of()).toWatchConfig();

        assertThat(watchConfig.directory()).isEqualTo(Path.of("/srv/memes").toAbsolutePath());
        assertThat(watchConfig.acceptedExtensions()).containsExactlyInAnyOrder(".png", ".webp");
        assertThat(watchConfig.debounce()).isEqualTo(Duration.ofMillis(250));
        assertThat(watchConfig.maxInFlight()).isEqualTo(7);
        assertThat(watchConfig.watchMode()).isEqualTo(WatchMode.POLLING);
        assertThat(watchConfig.pollInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(watchConfig.shutdownTimeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("Should let environment variables override the config file")
    void shouldApplyEnvironmentOverrides() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                imagemonitor:
                  monitor:
                    directory: /srv/memes
                    watch-mode: native
                """);

        final ApplicationConfig config = ApplicationConfig.load(userConfig, Map.of(
                "IMAGEMONITOR_DIRECTORY", "/mnt/share/images",
                "IMAGEMONITOR_WATCH_MODE", "POLLING"));

        assertThat(config.getDirectory()).isEqualTo("/mnt/share/images");
        assertThat(config.getWatchMode()).isEqualTo(WatchMode.POLLING);
    }

    @Test
    @DisplayName("Should resolve placeholders against the environment")
    void shouldResolvePlaceholders() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, """
                imagemonitor:
                  monitor:
                    directory: ${MEME_ROOT:/fallback}/incoming
                """);

        assertThat(ApplicationConfig.load(userConfig, Map.of("MEME_ROOT", "/data")).getDirectory())
                .isEqualTo("/data/incoming");
        assertThat(ApplicationConfig.load(userConfig, Map.of()).getDirectory())
                .isEqualTo("/fallback/incoming");
    }

    @Test
    @DisplayName("Should ignore a config file without monitor section")
    void shouldIgnoreUnrelatedYaml() throws Exception {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, "other:\n  key: value\n");

        final ApplicationConfig config = ApplicationConfig.load(userConfig, Map.of());

        assertThat(config.getMaxInFlight()).isEqualTo(100);
    }
}
