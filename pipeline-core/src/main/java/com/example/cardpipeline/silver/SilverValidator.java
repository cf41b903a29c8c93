package com.example.cardpipeline.silver;

import com.example.cardpipeline.exception.SchemaException;
import com.example.cardpipeline.model.BronzeRecord;
import com.example.cardpipeline.model.BronzeTable;
import com.example.cardpipeline.model.RejectedTransaction;
import com.example.cardpipeline.model.RejectionReason;
import com.example.cardpipeline.model.SilverResult;
import com.example.cardpipeline.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.cardpipeline.model.TransactionColumns.AMOUNT;
import static com.example.cardpipeline.model.TransactionColumns.CATEGORY;
import static com.example.cardpipeline.model.TransactionColumns.CUSTOMER_ID;
import static com.example.cardpipeline.model.TransactionColumns.EXPECTED;
import static com.example.cardpipeline.model.TransactionColumns.FIRST_NAME;
import static com.example.cardpipeline.model.TransactionColumns.IS_FRAUD;
import static com.example.cardpipeline.model.TransactionColumns.LAST_NAME;
import static com.example.cardpipeline.model.TransactionColumns.MERCHANT_ID;
import static com.example.cardpipeline.model.TransactionColumns.REQUIRED_VALUES;
import static com.example.cardpipeline.model.TransactionColumns.TIMESTAMP;
import static com.example.cardpipeline.model.TransactionColumns.TRANSACTION_ID;
import static com.example.cardpipeline.model.TransactionColumns.isAuxiliary;

/**
 * Splits a Bronze table into valid and rejected partitions.
 * <p>
 * Every rule is evaluated on every row, so a rejected row carries all the reasons it triggered. A timestamp equal
 * to the processing time is accepted; only a strictly later one is a {@link RejectionReason#FUTURE_DATE}.
 */
public class SilverValidator {

    private static final Logger log = LoggerFactory.getLogger(SilverValidator.class);

    private final Clock clock;
    private final ZoneId zoneId;

    public SilverValidator(Clock clock, ZoneId zoneId) {
        this.clock = clock;
        this.zoneId = zoneId;
    }

    /**
     * @param bronze the landed table
     * @return both partitions; their sizes always add up to the input size
     * @throws SchemaException if the table lacks any expected column
     */
    public SilverResult validate(BronzeTable bronze) {
        requireExpectedColumns(bronze);

        Instant processedAt = clock.instant();
        log.info("[SILVER] Validating {} rows from '{}' against processing time {}",
                bronze.size(), bronze.getSourceFile(), processedAt);

        List<Transaction> valid = new ArrayList<>();
        List<RejectedTransaction> rejected = new ArrayList<>();

        for (BronzeRecord record : bronze.getRecords()) {
            Set<RejectionReason> reasons = EnumSet.noneOf(RejectionReason.class);

            checkRequiredValues(record, reasons);
            Optional<BigDecimal> amount = checkAmount(record, reasons);
            Optional<Instant> timestamp = checkTimestamp(record, processedAt, reasons);
            checkCategory(record, reasons);
            Optional<Boolean> fraud = checkFraudFlag(record, reasons);

            if (reasons.isEmpty()) {
                valid.add(toTransaction(record, amount.orElseThrow(), timestamp.orElseThrow(), fraud.orElseThrow()));
            } else {
                RejectedTransaction rejectedTransaction = new RejectedTransaction(record, reasons);
                log.debug("[SILVER] Row {} rejected: {}", record.getRowNumber(), rejectedTransaction.reasonCodes());
                rejected.add(rejectedTransaction);
            }
        }

        SilverResult result = new SilverResult(processedAt, valid, rejected);
        log.info("[SILVER] Validation complete. Valid: {}, Rejected: {}, Reasons: {}",
                result.getValidCount(), result.getRejectedCount(), result.getReasonCounts());
        return result;
    }

    private void requireExpectedColumns(BronzeTable bronze) {
        List<String> missing = EXPECTED.stream()
                .filter(column -> !bronze.hasColumn(column))
                .sorted()
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.error("[SILVER] Bronze table '{}' is missing expected columns {}", bronze.getSourceFile(), missing);
            throw new SchemaException(bronze.getSourceFile(), missing);
        }
    }

    private void checkRequiredValues(BronzeRecord record, Set<RejectionReason> reasons) {
        for (String column : REQUIRED_VALUES) {
            if (!record.isPresent(column)) {
                reasons.add(RejectionReason.MISSING_FIELD);
                return;
            }
        }
    }

    private Optional<BigDecimal> checkAmount(BronzeRecord record, Set<RejectionReason> reasons) {
        String text = record.get(AMOUNT);
        if (text == null) {
            return Optional.empty();
        }
        Optional<BigDecimal> amount = FieldParsers.parseAmount(text);
        if (amount.isEmpty()) {
            reasons.add(RejectionReason.INVALID_AMOUNT);
        } else if (amount.get().signum() < 0) {
            reasons.add(RejectionReason.NEGATIVE_AMOUNT);
        }
        return amount;
    }

    private Optional<Instant> checkTimestamp(BronzeRecord record, Instant processedAt, Set<RejectionReason> reasons) {
        String text = record.get(TIMESTAMP);
        if (text == null) {
            return Optional.empty();
        }
        Optional<Instant> timestamp = FieldParsers.parseTimestamp(text, zoneId);
        if (timestamp.isEmpty()) {
            reasons.add(RejectionReason.INVALID_DATE);
        } else if (timestamp.get().isAfter(processedAt)) {
            reasons.add(RejectionReason.FUTURE_DATE);
        }
        return timestamp;
    }

    private void checkCategory(BronzeRecord record, Set<RejectionReason> reasons) {
        if (!record.isPresent(CATEGORY)) {
            reasons.add(RejectionReason.MISSING_CATEGORY);
        }
    }

    private Optional<Boolean> checkFraudFlag(BronzeRecord record, Set<RejectionReason> reasons) {
        Optional<Boolean> fraud = FieldParsers.parseFraudFlag(record.get(IS_FRAUD));
        if (fraud.isEmpty()) {
            reasons.add(RejectionReason.INVALID_FRAUD_FLAG);
        }
        return fraud;
    }

    private Transaction toTransaction(BronzeRecord record, BigDecimal amount, Instant timestamp, boolean fraud) {
        Transaction.TransactionBuilder builder = Transaction.builder()
                .transactionId(record.get(TRANSACTION_ID))
                .timestamp(timestamp)
                .customerId(record.get(CUSTOMER_ID))
                .customerName(customerName(record))
                .merchantId(record.get(MERCHANT_ID))
                .category(record.get(CATEGORY))
                .amount(amount)
                .fraud(fraud);
        for (Map.Entry<String, String> entry : record.getValues().entrySet()) {
            if (isAuxiliary(entry.getKey()) && entry.getValue() != null) {
                builder.attribute(entry.getKey(), entry.getValue());
            }
        }
        return builder.build();
    }

    private static String customerName(BronzeRecord record) {
        String name = ((record.get(FIRST_NAME) == null ? "" : record.get(FIRST_NAME)) + " "
                + (record.get(LAST_NAME) == null ? "" : record.get(LAST_NAME))).trim();
        return name.isEmpty() ? null : name;
    }
}
