package com.example.cardpipeline.processor;

import com.example.cardpipeline.exception.SchemaException;
import com.example.cardpipeline.storage.ArtifactStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Runs the pipeline once at startup and turns the outcome into the process exit code.
 */
@Component
@ConditionalOnProperty(name = "app.pipeline.run-on-startup", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final int SCHEMA_ERROR = 2;
    static final int RUN_FAILED = 1;

    private final PipelineOrchestrator orchestrator;
    private int exitCode;

    public PipelineRunner(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) {
        try {
            orchestrator.run();
            exitCode = 0;
        } catch (SchemaException e) {
            log.error("Pipeline aborted, input schema is invalid: {}", e.getMessage(), e);
            exitCode = SCHEMA_ERROR;
        } catch (IOException e) {
            log.error("Pipeline failed reading its input: {}", e.getMessage(), e);
            exitCode = RUN_FAILED;
        } catch (ArtifactStorageException e) {
            log.error("Pipeline failed writing its output: {}", e.getMessage(), e);
            exitCode = RUN_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
