package com.example.chronotrace.ingest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class SegmentFilesTest {

    @TempDir
    Path dir;

    private SegmentFiles filesUnder(Path root) {
        return new SegmentFiles(root.toString());
    }

    @Test
    public void relativePathBelowTheRootIsRead() throws Exception {
        Path root = Files.createDirectories(dir.resolve("segments/cam-1"));
        Files.write(root.resolve("seg-0.mp4"), "frames".getBytes(StandardCharsets.UTF_8));
        SegmentFiles files = filesUnder(dir.resolve("segments"));

        assertThat(files.isEnabled()).isTrue();
        assertThat(files.read("cam-1/seg-0.mp4")).isEqualTo("frames".getBytes(StandardCharsets.UTF_8));
        assertThat(files.read("cam-1/../cam-1/seg-0.mp4")).hasSize(6);
    }

    @Test
    public void pathsLeavingTheRootAreRejected() throws Exception {
        Path root = Files.createDirectories(dir.resolve("segments"));
        Files.write(dir.resolve("secret.txt"), "keys".getBytes(StandardCharsets.UTF_8));
        SegmentFiles files = filesUnder(root);

        assertThatThrownBy(() -> files.read("../secret.txt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inside the segment root");
        assertThatThrownBy(() -> files.read("a/../../secret.txt"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> files.read(dir.resolve("secret.txt").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("relative");
        assertThatThrownBy(() -> files.read(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void symlinkPointingOutsideTheRootIsRejected() throws Exception {
        Path root = Files.createDirectories(dir.resolve("segments"));
        Path outside = Files.write(dir.resolve("outside.bin"), new byte[]{1, 2, 3});
        Path link = root.resolve("link.bin");
        try {
            Files.createSymbolicLink(link, outside);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links unavailable: " + e.getMessage());
        }

        assertThatThrownBy(() -> filesUnder(root).read("link.bin"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inside the segment root");
    }

    @Test
    public void unsetRootDisablesPathUploads() {
        SegmentFiles files = new SegmentFiles((String) null);

        assertThat(files.isEnabled()).isFalse();
        assertThatThrownBy(() -> files.read("seg-0.mp4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("disabled");
        assertThat(new SegmentFiles("  ").isEnabled()).isFalse();
    }

    @Test
    public void missingFileIsAnIoFailure() throws Exception {
        SegmentFiles files = filesUnder(Files.createDirectories(dir.resolve("segments")));

        assertThatThrownBy(() -> files.read("nope.mp4"))
                .isInstanceOf(UncheckedIOException.class);
    }
}
