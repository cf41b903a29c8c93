package com.example.cardpipeline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * S3 client for the artifact store. Only created when artifacts go to S3.
 */
@Configuration
@ConditionalOnProperty(name = "app.pipeline.storage.type", havingValue = "s3")
public class AwsConfig {

    private static final Logger log = LoggerFactory.getLogger(AwsConfig.class);

    @Value("${app.aws.region:us-east-1}")
    private String region;

    @Value("${app.aws.localstack.enabled:false}")
    private boolean localstackEnabled;

    @Value("${app.aws.localstack.endpoint:http://localhost:4566}")
    private String localstackEndpoint;

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder().region(Region.of(region));
        if (localstackEnabled) {
            log.info("Configuring S3 client for LocalStack at {}", localstackEndpoint);
            // LocalStack serves buckets on the path, not as virtual hosts
            builder.endpointOverride(URI.create(localstackEndpoint)).forcePathStyle(true);
        } else {
            log.info("Configuring S3 client for AWS in region {}", region);
        }
        return builder.build();
    }
}
