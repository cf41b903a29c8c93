package com.example.cardpipeline.storage;

/**
 * Destination for the artifacts of a pipeline run.
 */
public interface ArtifactStore {

    /**
     * Writes an artifact, replacing any previous version with the same name.
     *
     * @param artifactName relative name, e.g. {@code gold/customer_summary.csv}
     * @param content      the bytes to write
     * @param contentType  MIME type of the content
     * @return where the artifact was written
     * @throws ArtifactStorageException if the write fails
     */
    String store(String artifactName, byte[] content, String contentType);
}
