package com.example.cardpipeline.storage;

import com.example.cardpipeline.model.BronzeRecord;
import com.example.cardpipeline.model.BronzeTable;
import com.example.cardpipeline.model.CategorySummary;
import com.example.cardpipeline.model.CustomerSummary;
import com.example.cardpipeline.model.RejectedTransaction;
import com.example.cardpipeline.model.Transaction;
import com.example.cardpipeline.model.TransactionColumns;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders pipeline tables as CSV and run metadata as JSON. Money is written with two decimals, rates with six.
 */
@Component
public class ArtifactSerializer {

    public static final String CSV = "text/csv";
    public static final String JSON = "application/json";
    public static final String TEXT = "text/plain";

    static final String REJECTION_REASONS = "rejection_reasons";

    private static final String[] VALID_HEADER = {
            TransactionColumns.TRANSACTION_ID, TransactionColumns.TIMESTAMP, TransactionColumns.CUSTOMER_ID,
            "customer_name", TransactionColumns.MERCHANT_ID, TransactionColumns.CATEGORY, TransactionColumns.AMOUNT,
            TransactionColumns.IS_FRAUD};

    private static final String[] CUSTOMER_HEADER = {
            "customer_id", "customer_name", "total_transactions", "total_spend", "avg_transaction",
            "median_transaction", "fraud_count", "fraud_rate", "first_transaction_date", "last_transaction_date",
            "customer_lifetime_days", "unique_merchants", "city", "state", "job"};

    private static final String[] CATEGORY_HEADER = {
            "category", "total_transactions", "total_amount", "avg_amount", "median_amount", "fraud_count",
            "fraud_rate", "unique_customers", "unique_merchants"};

    private final ObjectMapper objectMapper;

    public ArtifactSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] bronzeCsv(BronzeTable bronze) {
        return csv(bronze.getColumns(), bronze.getRecords().stream()
                .map(record -> rawValues(bronze.getColumns(), record))
                .collect(Collectors.toList()));
    }

    /**
     * @param auxiliaryColumns optional columns to append after the typed ones, in order
     */
    public byte[] validCsv(List<Transaction> transactions, List<String> auxiliaryColumns) {
        List<String> header = new ArrayList<>(List.of(VALID_HEADER));
        header.addAll(auxiliaryColumns);
        List<List<Object>> rows = new ArrayList<>();
        for (Transaction transaction : transactions) {
            List<Object> row = new ArrayList<>(List.of(
                    transaction.getTransactionId(),
                    transaction.getTimestamp().toString(),
                    transaction.getCustomerId(),
                    Objects.toString(transaction.getCustomerName(), ""),
                    transaction.getMerchantId(),
                    transaction.getCategory(),
                    transaction.getAmount().toPlainString(),
                    transaction.isFraud() ? "1" : "0"));
            for (String column : auxiliaryColumns) {
                row.add(Objects.toString(transaction.getAttributes().get(column), ""));
            }
            rows.add(row);
        }
        return csv(header, rows);
    }

    public byte[] rejectedCsv(List<String> bronzeColumns, List<RejectedTransaction> rejected) {
        List<String> header = new ArrayList<>(bronzeColumns);
        header.add(REJECTION_REASONS);
        List<List<Object>> rows = new ArrayList<>();
        for (RejectedTransaction rejectedTransaction : rejected) {
            List<Object> row = rawValues(bronzeColumns, rejectedTransaction.getRecord());
            row.add(rejectedTransaction.reasonCodes());
            rows.add(row);
        }
        return csv(header, rows);
    }

    public byte[] customerCsv(List<CustomerSummary> customers) {
        return csv(List.of(CUSTOMER_HEADER), customers.stream()
                .map(summary -> List.<Object>of(
                        summary.getCustomerId(),
                        Objects.toString(summary.getCustomerName(), ""),
                        summary.getTransactionCount(),
                        money(summary.getTotalAmount()),
                        money(summary.getMeanAmount()),
                        money(summary.getMedianAmount()),
                        summary.getFraudCount(),
                        rate(summary.getFraudRate()),
                        summary.getFirstTransactionAt().toString(),
                        summary.getLastTransactionAt().toString(),
                        summary.getLifetimeDays(),
                        summary.getUniqueMerchants(),
                        Objects.toString(summary.getCity(), ""),
                        Objects.toString(summary.getState(), ""),
                        Objects.toString(summary.getJob(), "")))
                .collect(Collectors.toList()));
    }

    public byte[] categoryCsv(List<CategorySummary> categories) {
        return csv(List.of(CATEGORY_HEADER), categories.stream()
                .map(summary -> List.<Object>of(
                        summary.getCategory(),
                        summary.getTransactionCount(),
                        money(summary.getTotalAmount()),
                        money(summary.getMeanAmount()),
                        money(summary.getMedianAmount()),
                        summary.getFraudCount(),
                        rate(summary.getFraudRate()),
                        summary.getUniqueCustomers(),
                        summary.getUniqueMerchants()))
                .collect(Collectors.toList()));
    }

    public byte[] json(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName() + " to JSON", e);
        }
    }

    public byte[] text(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static List<Object> rawValues(List<String> columns, BronzeRecord record) {
        List<Object> values = new ArrayList<>();
        for (String column : columns) {
            values.add(Objects.toString(record.get(column), ""));
        }
        return values;
    }

    private static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static String rate(double rate) {
        return BigDecimal.valueOf(rate).setScale(6, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static byte[] csv(List<String> header, List<List<Object>> rows) {
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .setRecordSeparator("\n")
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (List<Object> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            // StringWriter does not fail
            throw new UncheckedIOException(e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
