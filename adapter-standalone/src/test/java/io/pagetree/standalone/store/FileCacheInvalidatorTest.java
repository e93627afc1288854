package io.pagetree.standalone.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileCacheInvalidator")
class FileCacheInvalidatorTest {

    @TempDir
    Path cacheDir;

    @Test
    @DisplayName("Deletes the stylesheet and its sidecar, leaving other documents alone")
    void invalidate_deletesDocumentFiles() throws Exception {
        Files.writeString(cacheDir.resolve("post-5.css"), ".a{}");
        Files.writeString(cacheDir.resolve("post-5.json"), "{}");
        Files.writeString(cacheDir.resolve("post-6.css"), ".b{}");

        assertThat(new FileCacheInvalidator(cacheDir).invalidate(5)).isTrue();

        assertThat(cacheDir.resolve("post-5.css")).doesNotExist();
        assertThat(cacheDir.resolve("post-5.json")).doesNotExist();
        assertThat(cacheDir.resolve("post-6.css")).exists();
    }

    @Test
    @DisplayName("Nothing cached is still a successful invalidation")
    void invalidate_nothingCached() {
        assertThat(new FileCacheInvalidator(cacheDir).invalidate(9)).isTrue();
    }

    @Test
    @DisplayName("Missing cache directory is accepted")
    void invalidate_missingDirectory() {
        assertThat(new FileCacheInvalidator(cacheDir.resolve("absent")).invalidate(9)).isTrue();
    }

    @Test
    @DisplayName("A regular file in place of the directory fails the invalidation")
    void invalidate_notADirectory() throws Exception {
        Path file = cacheDir.resolve("css");
        Files.writeString(file, "x");

        assertThat(new FileCacheInvalidator(file).invalidate(1)).isFalse();
    }

    @Test
    @DisplayName("Cache file names follow the renderer's convention")
    void fileNames() {
        assertThat(FileCacheInvalidator.cssFileName(42)).isEqualTo("post-42.css");
        assertThat(FileCacheInvalidator.sidecarFileName(42)).isEqualTo("post-42.json");
    }
}
