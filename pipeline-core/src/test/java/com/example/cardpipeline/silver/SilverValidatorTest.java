package com.example.cardpipeline.silver;

import com.example.cardpipeline.exception.SchemaException;
import com.example.cardpipeline.model.BronzeTable;
import com.example.cardpipeline.model.RejectedTransaction;
import com.example.cardpipeline.model.RejectionReason;
import com.example.cardpipeline.model.SilverResult;
import com.example.cardpipeline.model.Transaction;
import com.example.cardpipeline.model.TransactionColumns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.cardpipeline.BronzeFixtures.NOW;
import static com.example.cardpipeline.BronzeFixtures.cleanRow;
import static com.example.cardpipeline.BronzeFixtures.row;
import static com.example.cardpipeline.BronzeFixtures.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SilverValidatorTest {

    private SilverValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SilverValidator(Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private RejectedTransaction onlyRejected(SilverResult result) {
        assertEquals(0, result.getValidCount());
        assertEquals(1, result.getRejectedCount());
        return result.getRejected().get(0);
    }

    @Test
    @DisplayName("Should accept a clean transaction and type its fields")
    void shouldAcceptCleanTransaction() {
        SilverResult result = validator.validate(table(cleanRow("t1", "c1", "grocery_pos", "50.25", "1")));

        assertEquals(1, result.getValidCount());
        assertEquals(0, result.getRejectedCount());
        Transaction transaction = result.getValid().get(0);
        assertEquals("t1", transaction.getTransactionId());
        assertEquals("c1", transaction.getCustomerId());
        assertEquals("grocery_pos", transaction.getCategory());
        assertEquals(0, new BigDecimal("50.25").compareTo(transaction.getAmount()));
        assertEquals(Instant.parse("2024-05-30T09:15:00Z"), transaction.getTimestamp());
        assertTrue(transaction.isFraud());
        assertEquals(NOW, result.getProcessedAt());
    }

    @Test
    @DisplayName("Should reject a negative amount")
    void shouldRejectNegativeAmount() {
        RejectedTransaction rejected = onlyRejected(validator.validate(
                table(cleanRow("t1", "c1", "grocery_pos", "-50.00", "0"))));

        assertEquals(Set.of(RejectionReason.NEGATIVE_AMOUNT), rejected.getReasons());
    }

    @Test
    @DisplayName("Should accept a zero amount")
    void shouldAcceptZeroAmount() {
        SilverResult result = validator.validate(table(cleanRow("t1", "c1", "grocery_pos", "0.00", "0")));

        assertEquals(1, result.getValidCount());
    }

    @Test
    @DisplayName("Should reject each missing required value as missing_field")
    void shouldRejectMissingRequiredValues() {
        for (String column : TransactionColumns.REQUIRED_VALUES) {
            Map<String, String> values = cleanRow("t1", "c1", "grocery_pos", "10.00", "0");
            values.put(column, null);

            RejectedTransaction rejected = onlyRejected(validator.validate(table(values)));

            assertTrue(rejected.hasReason(RejectionReason.MISSING_FIELD), "expected missing_field for " + column);
        }
    }

    @Test
    @DisplayName("Should treat a blank value as missing")
    void shouldTreatBlankAsMissing() {
        RejectedTransaction rejected = onlyRejected(validator.validate(
                table(cleanRow("t1", "   ", "grocery_pos", "10.00", "0"))));

        assertEquals(Set.of(RejectionReason.MISSING_FIELD), rejected.getReasons());
    }

    @Test
    @DisplayName("Should record every rule a row fails, not just the first")
    void shouldRecordAllReasons() {
        RejectedTransaction rejected = onlyRejected(validator.validate(
                table(cleanRow("t1", null, "grocery_pos", "-5", "0"))));

        assertTrue(rejected.hasReason(RejectionReason.NEGATIVE_AMOUNT));
        assertTrue(rejected.hasReason(RejectionReason.MISSING_FIELD));
        assertEquals(2, rejected.getReasons().size());
        assertEquals("negative_amount|missing_field", rejected.reasonCodes());
    }

    @Test
    @DisplayName("Should accept a timestamp equal to the processing time")
    void shouldAcceptTimestampAtProcessingTime() {
        SilverResult result = validator.validate(table(
                row("t1", "2024-06-01T12:00:00Z", "c1", "m1", "grocery_pos", "10", "0")));

        assertEquals(1, result.getValidCount());
    }

    @Test
    @DisplayName("Should reject a timestamp one microsecond after the processing time")
    void shouldRejectTimestampOneMicrosecondLater() {
        String oneMicroLater = NOW.plus(1, ChronoUnit.MICROS).toString();
        assertEquals("2024-06-01T12:00:00.000001Z", oneMicroLater);

        RejectedTransaction rejected = onlyRejected(validator.validate(table(
                row("t1", oneMicroLater, "c1", "m1", "grocery_pos", "10", "0"))));

        assertEquals(Set.of(RejectionReason.FUTURE_DATE), rejected.getReasons());
    }

    @Test
    @DisplayName("Should read timestamps without an offset in the configured zone")
    void shouldReadLocalTimestampsInConfiguredZone() {
        SilverValidator saoPaulo = new SilverValidator(Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.ofHours(-3));

        SilverResult result = saoPaulo.validate(table(
                row("t1", "2024-06-01 08:30:00", "c1", "m1", "grocery_pos", "10", "0"),
                row("t2", "2024-06-01T09:30:00", "c1", "m1", "grocery_pos", "10", "0")));

        assertEquals(1, result.getValidCount());
        assertEquals(Instant.parse("2024-06-01T11:30:00Z"), result.getValid().get(0).getTimestamp());
        assertEquals(Set.of(RejectionReason.FUTURE_DATE), result.getRejected().get(0).getReasons());
    }

    @Test
    @DisplayName("Should read a bare date as the start of that day in the configured zone")
    void shouldReadDateOnlyTimestamps() {
        SilverValidator saoPaulo = new SilverValidator(Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.ofHours(-3));

        SilverResult utc = validator.validate(table(
                row("t1", "2024-05-30", "c1", "m1", "grocery_pos", "10", "0"),
                row("t2", "2024-06-02", "c1", "m1", "grocery_pos", "10", "0")));
        SilverResult local = saoPaulo.validate(table(
                row("t1", "2024-05-30", "c1", "m1", "grocery_pos", "10", "0")));

        assertEquals(1, utc.getValidCount());
        assertEquals(Instant.parse("2024-05-30T00:00:00Z"), utc.getValid().get(0).getTimestamp());
        assertEquals(Set.of(RejectionReason.FUTURE_DATE), utc.getRejected().get(0).getReasons());
        assertEquals(Instant.parse("2024-05-30T03:00:00Z"), local.getValid().get(0).getTimestamp());
    }

    @Test
    @DisplayName("Should reject values that cannot be parsed")
    void shouldRejectUnparseableValues() {
        SilverResult result = validator.validate(table(
                row("t1", "yesterday", "c1", "m1", "grocery_pos", "10", "0"),
                row("t2", "2024-05-01T00:00:00Z", "c1", "m1", "grocery_pos", "ten", "0"),
                row("t3", "2024-05-01T00:00:00Z", "c1", "m1", "grocery_pos", "10", "maybe")));

        assertEquals(0, result.getValidCount());
        assertEquals(Set.of(RejectionReason.INVALID_DATE), result.getRejected().get(0).getReasons());
        assertEquals(Set.of(RejectionReason.INVALID_AMOUNT), result.getRejected().get(1).getReasons());
        assertEquals(Set.of(RejectionReason.INVALID_FRAUD_FLAG), result.getRejected().get(2).getReasons());
    }

    @Test
    @DisplayName("Should reject a missing category and read a missing fraud flag as not fraud")
    void shouldHandleCategoryAndFraudFlag() {
        SilverResult result = validator.validate(table(
                cleanRow("t1", "c1", null, "10", "0"),
                cleanRow("t2", "c1", "travel", "10", null),
                cleanRow("t3", "c1", "travel", "10", "TRUE")));

        assertEquals(Set.of(RejectionReason.MISSING_CATEGORY), result.getRejected().get(0).getReasons());
        assertEquals(2, result.getValidCount());
        assertFalse(result.getValid().get(0).isFraud());
        assertTrue(result.getValid().get(1).isFraud());
    }

    @Test
    @DisplayName("Should keep every original field on rejected rows")
    void shouldKeepOriginalFieldsOnRejectedRows() {
        Map<String, String> values = cleanRow("t1", "c1", "grocery_pos", "-1", "0");
        values.put("lat", "40.7128");

        RejectedTransaction rejected = onlyRejected(validator.validate(table(
                List.of(TransactionColumns.TRANSACTION_ID, TransactionColumns.TIMESTAMP, TransactionColumns.CUSTOMER_ID,
                        TransactionColumns.MERCHANT_ID, TransactionColumns.CATEGORY, TransactionColumns.AMOUNT,
                        TransactionColumns.IS_FRAUD, "lat"),
                List.of(values))));

        assertEquals(values, rejected.getRecord().getValues());
        assertEquals(1, rejected.getRecord().getRowNumber());
    }

    @Test
    @DisplayName("Should carry auxiliary columns and the customer name onto valid transactions")
    void shouldCarryAuxiliaryColumns() {
        Map<String, String> values = cleanRow("t1", "c1", "grocery_pos", "12", "0");
        values.put("lat", "40.7128");
        values.put(TransactionColumns.FIRST_NAME, "Jane");
        values.put(TransactionColumns.LAST_NAME, "Smith");

        Transaction transaction = validator.validate(table(List.copyOf(values.keySet()), List.of(values)))
                .getValid().get(0);

        assertEquals("Jane Smith", transaction.getCustomerName());
        assertEquals("40.7128", transaction.getAttributes().get("lat"));
        assertFalse(transaction.getAttributes().containsKey(TransactionColumns.AMOUNT));
        assertFalse(transaction.getAttributes().containsKey(TransactionColumns.FIRST_NAME));
        assertFalse(transaction.getAttributes().containsKey(TransactionColumns.LAST_NAME));
    }

    @Test
    @DisplayName("Should fail with a schema error naming every missing column")
    void shouldFailOnMissingColumns() {
        BronzeTable bronze = table(
                List.of(TransactionColumns.TRANSACTION_ID, TransactionColumns.TIMESTAMP,
                        TransactionColumns.MERCHANT_ID, TransactionColumns.CATEGORY, TransactionColumns.IS_FRAUD),
                List.of());

        SchemaException exception = assertThrows(SchemaException.class, () -> validator.validate(bronze));

        assertEquals(List.of("amount", "customer_id"), exception.getMissingColumns());
        assertTrue(exception.getMessage().contains("amount"));
        assertTrue(exception.getMessage().contains("customer_id"));
    }

    @Test
    @DisplayName("Should place every input row in exactly one partition")
    void shouldPartitionEveryRow() {
        SilverResult result = validator.validate(table(
                cleanRow("t1", "c1", "grocery_pos", "10", "0"),
                cleanRow("t2", "c2", "grocery_pos", "-10", "0"),
                cleanRow("t3", null, null, "abc", "x"),
                row("t4", "2030-01-01T00:00:00Z", "c3", "m3", "travel", "10", "1"),
                cleanRow("t5", "c3", "travel", "99.99", "1")));

        assertEquals(5, result.getTotalCount());
        assertEquals(2, result.getValidCount());
        assertEquals(3, result.getRejectedCount());
        result.getRejected().forEach(rejected -> assertFalse(rejected.getReasons().isEmpty()));
        assertEquals(1L, result.getReasonCounts().get(RejectionReason.MISSING_FIELD));
        assertEquals(1L, result.getReasonCounts().get(RejectionReason.FUTURE_DATE));
    }

    @Test
    @DisplayName("Should produce empty partitions for an empty table")
    void shouldHandleEmptyTable() {
        SilverResult result = validator.validate(table());

        assertEquals(0, result.getTotalCount());
        assertTrue(result.getReasonCounts().isEmpty());
    }
}
