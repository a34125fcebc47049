package de.mirkosertic.imagemonitor.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoggingConfigurator Tests")
class LoggingConfiguratorTest {

    private static final Logger logger = LoggerFactory.getLogger(LoggingConfiguratorTest.class);

    @TempDir
    Path tempDir;

    @AfterEach
    void restoreTestLogging() {
        LoggingConfigurator.reconfigure("logback-test.xml", tempDir);
    }

    @Test
    @DisplayName("Should write the deployed log file into the given directory")
    void shouldWriteDeployedLogFile() throws Exception {
        final Path logDir = tempDir.resolve("log");

        assertThat(LoggingConfigurator.switchToFileLogging(logDir)).isTrue();
        logger.info("deployed logging active");

        final Path logFile = logDir.resolve("imagemonitor.log");
        assertThat(logFile).exists();
        assertThat(Files.readString(logFile)).contains("deployed logging active");
    }

    @Test
    @DisplayName("Should keep the current configuration when the resource is missing")
    void shouldIgnoreMissingResource() {
        assertThat(LoggingConfigurator.reconfigure("no-such-logback.xml", tempDir)).isFalse();
    }

    @Test
    @DisplayName("Should place the log directory below the user config directory")
    void shouldResolveLogDirectory() {
        assertThat(LoggingConfigurator.logDirectory())
                .isEqualTo(ApplicationConfig.getConfigDirectory().resolve("log"));
    }
}
