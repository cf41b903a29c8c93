package com.example.cardpipeline.processor;

import com.example.cardpipeline.bronze.BronzeCsvReader;
import com.example.cardpipeline.config.PipelineProperties;
import com.example.cardpipeline.gold.GoldAggregator;
import com.example.cardpipeline.insight.InsightReport;
import com.example.cardpipeline.insight.InsightReporter;
import com.example.cardpipeline.model.BronzeTable;
import com.example.cardpipeline.model.GoldResult;
import com.example.cardpipeline.model.PipelineRunSummary;
import com.example.cardpipeline.model.RejectionReason;
import com.example.cardpipeline.model.SilverResult;
import com.example.cardpipeline.model.TransactionColumns;
import com.example.cardpipeline.silver.SilverValidator;
import com.example.cardpipeline.storage.ArtifactSerializer;
import com.example.cardpipeline.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs Bronze, Silver, Gold and Insights once, in that order, persisting each stage's artifacts before the next
 * stage starts. A failing stage aborts the run.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String BRONZE_FILE = "bronze/transactions.csv";
    static final String SILVER_VALID_FILE = "silver/transactions_valid.csv";
    static final String SILVER_REJECTED_FILE = "silver/transactions_rejected.csv";
    static final String CUSTOMER_SUMMARY_FILE = "gold/customer_summary.csv";
    static final String CATEGORY_ANALYSIS_FILE = "gold/merchant_category_analysis.csv";
    static final String INSIGHTS_REPORT_FILE = "gold/insights_report.txt";
    static final String RUN_SUMMARY_FILE = "metadata/run_summary.json";

    private final PipelineProperties properties;
    private final BronzeCsvReader bronzeCsvReader;
    private final SilverValidator silverValidator;
    private final GoldAggregator goldAggregator;
    private final InsightReporter insightReporter;
    private final ArtifactSerializer serializer;
    private final ArtifactStore artifactStore;
    private final Clock clock;

    public PipelineOrchestrator(PipelineProperties properties,
                                BronzeCsvReader bronzeCsvReader,
                                SilverValidator silverValidator,
                                GoldAggregator goldAggregator,
                                InsightReporter insightReporter,
                                ArtifactSerializer serializer,
                                ArtifactStore artifactStore,
                                Clock clock) {
        this.properties = properties;
        this.bronzeCsvReader = bronzeCsvReader;
        this.silverValidator = silverValidator;
        this.goldAggregator = goldAggregator;
        this.insightReporter = insightReporter;
        this.serializer = serializer;
        this.artifactStore = artifactStore;
        this.clock = clock;
    }

    /**
     * @return counts and artifact locations of the run
     * @throws IOException if the raw input cannot be read
     * @throws com.example.cardpipeline.exception.SchemaException if the input lacks expected columns
     * @throws com.example.cardpipeline.storage.ArtifactStorageException if an artifact cannot be written
     */
    public PipelineRunSummary run() throws IOException {
        Instant startedAt = clock.instant();
        Path input = Path.of(properties.getInputFile());
        log.info("Pipeline started at {} for {}", startedAt, input);

        BronzeTable bronze = bronzeCsvReader.read(input);
        String bronzeFile = artifactStore.store(BRONZE_FILE, serializer.bronzeCsv(bronze), ArtifactSerializer.CSV);

        SilverResult silver = silverValidator.validate(bronze);
        List<String> auxiliaryColumns = bronze.getColumns().stream()
                .filter(TransactionColumns::isAuxiliary)
                .collect(Collectors.toList());
        String validFile = artifactStore.store(SILVER_VALID_FILE,
                serializer.validCsv(silver.getValid(), auxiliaryColumns), ArtifactSerializer.CSV);
        String rejectedFile = artifactStore.store(SILVER_REJECTED_FILE,
                serializer.rejectedCsv(bronze.getColumns(), silver.getRejected()), ArtifactSerializer.CSV);

        log.info("[GOLD] Using {} valid records out of {} total", silver.getValidCount(), silver.getTotalCount());
        GoldResult gold = goldAggregator.aggregate(silver.getValid());
        String customerFile = artifactStore.store(CUSTOMER_SUMMARY_FILE,
                serializer.customerCsv(gold.getCustomerSummaries()), ArtifactSerializer.CSV);
        String categoryFile = artifactStore.store(CATEGORY_ANALYSIS_FILE,
                serializer.categoryCsv(gold.getCategorySummaries()), ArtifactSerializer.CSV);

        InsightReport report = insightReporter.summarize(gold.getCustomerSummaries(), gold.getCategorySummaries());
        String reportText = insightReporter.render(report);
        String reportFile = artifactStore.store(INSIGHTS_REPORT_FILE, serializer.text(reportText), ArtifactSerializer.TEXT);

        PipelineRunSummary summary = PipelineRunSummary.builder()
                .startedAt(startedAt)
                .sourceFile(bronze.getSourceFile())
                .sourceSystem(bronze.getSourceSystem())
                .bronze(PipelineRunSummary.BronzeStage.builder()
                        .rowCount(bronze.size())
                        .columnCount(bronze.getColumns().size())
                        .ingestedAt(bronze.getIngestedAt())
                        .outputFile(bronzeFile)
                        .build())
                .silver(PipelineRunSummary.SilverStage.builder()
                        .totalRows(silver.getTotalCount())
                        .validRows(silver.getValidCount())
                        .invalidRows(silver.getRejectedCount())
                        .rejectionReasons(reasonCodes(silver.getReasonCounts()))
                        .processedAt(silver.getProcessedAt())
                        .validFile(validFile)
                        .rejectedFile(rejectedFile)
                        .build())
                .gold(PipelineRunSummary.GoldStage.builder()
                        .validRowsUsed(silver.getValidCount())
                        .customers(gold.getCustomerSummaries().size())
                        .categories(gold.getCategorySummaries().size())
                        .customerSummaryFile(customerFile)
                        .categoryAnalysisFile(categoryFile)
                        .build())
                .insights(PipelineRunSummary.InsightsStage.builder()
                        .totalTransactions(report.getTotalTransactions())
                        .fraudTransactions(report.getTotalFraudTransactions())
                        .overallFraudRate(report.getOverallFraudRate())
                        .reportFile(reportFile)
                        .build())
                .completedAt(clock.instant())
                .build();
        artifactStore.store(RUN_SUMMARY_FILE, serializer.json(summary), ArtifactSerializer.JSON);

        log.info("Pipeline completed. Bronze: {} rows ingested. Silver: {} valid rows out of {}. "
                        + "Gold: {} customers, {} categories.",
                bronze.size(), silver.getValidCount(), silver.getTotalCount(),
                gold.getCustomerSummaries().size(), gold.getCategorySummaries().size());
        log.info("\n{}", reportText);
        return summary;
    }

    private static Map<String, Long> reasonCodes(Map<RejectionReason, Long> counts) {
        Map<String, Long> byCode = new LinkedHashMap<>();
        counts.forEach((reason, count) -> byCode.put(reason.getCode(), count));
        return byCode;
    }
}
