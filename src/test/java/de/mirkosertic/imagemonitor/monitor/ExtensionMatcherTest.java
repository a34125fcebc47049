package de.mirkosertic.imagemonitor.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExtensionMatcher Tests")
class ExtensionMatcherTest {

    private final ExtensionMatcher matcher = new ExtensionMatcher(Set.copyOf(WatchConfig.DEFAULT_EXTENSIONS));

    @ParameterizedTest(name = "{0} is accepted")
    @ValueSource(strings = {"photo.jpg", "photo.JPG", "scan.Jpeg", "icon.png", "anim.gif", "old.bmp", "new.webp", "archive.tar.png"})
    void shouldAcceptImageExtensions(final String name) {
        assertThat(matcher.matches(Path.of("/data", name))).isTrue();
    }

    @ParameterizedTest(name = "{0} is rejected")
    @ValueSource(strings = {"notes.txt", "photo.jpg.tmp", "photo", ".png", "photo.", "photo.tiff", "jpg"})
    void shouldRejectOtherNames(final String name) {
        assertThat(matcher.matches(Path.of("/data", name))).isFalse();
    }

    @Test
    @DisplayName("Should reject a root path without file name")
    void shouldRejectRoot() {
        assertThat(matcher.matches(Path.of("/"))).isFalse();
    }
}
