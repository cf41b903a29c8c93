package com.example.cardpipeline.config;

import com.example.cardpipeline.model.TransactionColumns;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    @NotBlank(message = "app.pipeline.input-file must point to the raw transactions CSV.")
    private String inputFile;

    @NotBlank
    private String sourceSystem = "credit_card_system";

    @NotBlank
    private String zoneId = "UTC";

    @Min(value = 1, message = "app.pipeline.top-n must be at least 1.")
    private int topN = 5;

    private boolean runOnStartup = true;

    @Valid
    @NotNull
    private Columns columns = new Columns();

    @Valid
    @NotNull
    private Storage storage = new Storage();

    /**
     * Source header for each logical column. Defaults to the logical names themselves.
     */
    @Data
    public static class Columns {
        @NotBlank
        private String transactionId = TransactionColumns.TRANSACTION_ID;
        @NotBlank
        private String timestamp = TransactionColumns.TIMESTAMP;
        @NotBlank
        private String customerId = TransactionColumns.CUSTOMER_ID;
        @NotBlank
        private String merchantId = TransactionColumns.MERCHANT_ID;
        @NotBlank
        private String category = TransactionColumns.CATEGORY;
        @NotBlank
        private String amount = TransactionColumns.AMOUNT;
        @NotBlank
        private String isFraud = TransactionColumns.IS_FRAUD;

        /**
         * @return source header to logical column name, for the headers that differ
         */
        public Map<String, String> sourceToLogical() {
            Map<String, String> mapping = new LinkedHashMap<>();
            mapping.put(transactionId, TransactionColumns.TRANSACTION_ID);
            mapping.put(timestamp, TransactionColumns.TIMESTAMP);
            mapping.put(customerId, TransactionColumns.CUSTOMER_ID);
            mapping.put(merchantId, TransactionColumns.MERCHANT_ID);
            mapping.put(category, TransactionColumns.CATEGORY);
            mapping.put(amount, TransactionColumns.AMOUNT);
            mapping.put(isFraud, TransactionColumns.IS_FRAUD);
            mapping.entrySet().removeIf(entry -> entry.getKey().equals(entry.getValue()));
            return mapping;
        }
    }

    @Data
    public static class Storage {
        @NotNull
        private StorageType type = StorageType.LOCAL;
        @NotBlank
        private String outputDir = "data";
        private String bucketName;
        private String keyPrefix = "";
    }

    public enum StorageType {
        LOCAL, S3
    }
}
