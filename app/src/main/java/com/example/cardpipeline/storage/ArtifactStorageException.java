package com.example.cardpipeline.storage;

public class ArtifactStorageException extends RuntimeException {

    public ArtifactStorageException(String artifactName, Throwable cause) {
        super("Failed to store artifact '" + artifactName + "': " + cause.getMessage(), cause);
    }
}
