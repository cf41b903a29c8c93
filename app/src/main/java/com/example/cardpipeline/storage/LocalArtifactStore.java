package com.example.cardpipeline.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class LocalArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(LocalArtifactStore.class);

    private final Path baseDir;

    public LocalArtifactStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public String store(String artifactName, byte[] content, String contentType) {
        Path target = baseDir.resolve(artifactName).normalize();
        if (!target.startsWith(baseDir.normalize())) {
            throw new IllegalArgumentException("Artifact name escapes the output directory: " + artifactName);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            log.error("Error writing artifact {} to {}: {}", artifactName, target, e.getMessage(), e);
            throw new ArtifactStorageException(artifactName, e);
        }
        log.info("Artifact saved: {} ({} bytes)", target, content.length);
        return target.toString();
    }
}
