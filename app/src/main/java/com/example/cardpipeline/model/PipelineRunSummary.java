package com.example.cardpipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * What one pipeline run read, produced and where it put it. Written as {@code metadata/run_summary.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunSummary {

    private Instant startedAt;
    private Instant completedAt;
    private String sourceFile;
    private String sourceSystem;
    private BronzeStage bronze;
    private SilverStage silver;
    private GoldStage gold;
    private InsightsStage insights;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BronzeStage {
        private int rowCount;
        private int columnCount;
        private Instant ingestedAt;
        private String outputFile;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SilverStage {
        private int totalRows;
        private int validRows;
        private int invalidRows;
        private Map<String, Long> rejectionReasons;
        private Instant processedAt;
        private String validFile;
        private String rejectedFile;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GoldStage {
        private int validRowsUsed;
        private int customers;
        private int categories;
        private String customerSummaryFile;
        private String categoryAnalysisFile;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InsightsStage {
        private long totalTransactions;
        private long fraudTransactions;
        private double overallFraudRate;
        private String reportFile;
    }
}
