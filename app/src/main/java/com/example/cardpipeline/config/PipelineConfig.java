package com.example.cardpipeline.config;

import com.example.cardpipeline.gold.GoldAggregator;
import com.example.cardpipeline.insight.InsightReporter;
import com.example.cardpipeline.silver.SilverValidator;
import com.example.cardpipeline.storage.ArtifactStore;
import com.example.cardpipeline.storage.LocalArtifactStore;
import com.example.cardpipeline.storage.S3ArtifactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SilverValidator silverValidator(Clock clock, PipelineProperties properties) {
        return new SilverValidator(clock, ZoneId.of(properties.getZoneId()));
    }

    @Bean
    public GoldAggregator goldAggregator() {
        return new GoldAggregator();
    }

    @Bean
    public InsightReporter insightReporter(Clock clock, PipelineProperties properties) {
        return new InsightReporter(properties.getTopN(), clock);
    }

    @Bean
    public ArtifactStore artifactStore(PipelineProperties properties, ObjectProvider<S3Client> s3Client) {
        PipelineProperties.Storage storage = properties.getStorage();
        if (storage.getType() == PipelineProperties.StorageType.S3) {
            if (storage.getBucketName() == null || storage.getBucketName().isBlank()) {
                throw new IllegalStateException("app.pipeline.storage.bucket-name is required when storage type is s3.");
            }
            log.info("Artifacts will be written to s3://{}/{}", storage.getBucketName(), storage.getKeyPrefix());
            return new S3ArtifactStore(s3Client.getObject(), storage.getBucketName(), storage.getKeyPrefix());
        }
        Path outputDir = Path.of(storage.getOutputDir()).toAbsolutePath();
        log.info("Artifacts will be written under {}", outputDir);
        return new LocalArtifactStore(outputDir);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
