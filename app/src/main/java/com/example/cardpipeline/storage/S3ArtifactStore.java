package com.example.cardpipeline.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

public class S3ArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(S3ArtifactStore.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String keyPrefix;

    public S3ArtifactStore(S3Client s3Client, String bucketName, String keyPrefix) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.keyPrefix = normalizePrefix(keyPrefix);
    }

    @Override
    public String store(String artifactName, byte[] content, String contentType) {
        String objectKey = keyPrefix + artifactName;
        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .contentType(contentType)
                .build();
        try {
            s3Client.putObject(putObjectRequest, RequestBody.fromBytes(content));
        } catch (S3Exception e) {
            log.error("Error saving artifact {} to bucket {}: {}", artifactName, bucketName,
                    e.awsErrorDetails() == null ? e.getMessage() : e.awsErrorDetails().errorMessage(), e);
            throw new ArtifactStorageException(artifactName, e);
        }
        String location = String.format("s3://%s/%s", bucketName, objectKey);
        log.info("Artifact saved to S3: {}", location);
        return location;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }
}
