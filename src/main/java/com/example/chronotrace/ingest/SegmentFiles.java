package com.example.chronotrace.ingest;

import com.example.chronotrace.config.ChronoTraceProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads segment files written by the segmentation step. Only relative paths below the
 * configured segment root are accepted, after normalisation and symlink resolution.
 */
@Component
public class SegmentFiles {

    private final Path root;

    @Autowired
    public SegmentFiles(ChronoTraceProperties properties) {
        this(properties.getIngest().getSegmentRoot());
    }

    SegmentFiles(String root) {
        this.root = root == null || root.isBlank() ? null : Paths.get(root).toAbsolutePath().normalize();
    }

    public boolean isEnabled() {
        return root != null;
    }

    public byte[] read(String relativePath) {
        Path file = resolve(relativePath);
        try {
            Path real = file.toRealPath();
            if (!real.startsWith(root.toRealPath())) {
                throw new IllegalArgumentException("contentPath must stay inside the segment root");
            }
            return Files.readAllBytes(real);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read segment content " + relativePath, e);
        }
    }

    Path resolve(String relativePath) {
        if (root == null) {
            throw new IllegalArgumentException("contentPath uploads are disabled; send contentBase64");
        }
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("contentPath must not be blank");
        }
        Path requested = Paths.get(relativePath);
        if (requested.isAbsolute()) {
            throw new IllegalArgumentException("contentPath must be relative to the segment root");
        }
        Path file = root.resolve(requested).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("contentPath must stay inside the segment root");
        }
        return file;
    }
}
