package com.example.cardpipeline.insight;

import com.example.cardpipeline.model.CategorySummary;
import com.example.cardpipeline.model.CustomerSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InsightReporterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private static CategorySummary category(String name, long count, long fraud, String total) {
        return CategorySummary.builder()
                .category(name)
                .transactionCount(count)
                .fraudCount(fraud)
                .fraudRate((double) fraud / count)
                .totalAmount(new BigDecimal(total))
                .meanAmount(new BigDecimal(total).divide(BigDecimal.valueOf(count)))
                .build();
    }

    private static CustomerSummary customer(String id, String total) {
        return CustomerSummary.builder()
                .customerId(id)
                .transactionCount(1)
                .totalAmount(new BigDecimal(total))
                .meanAmount(new BigDecimal(total))
                .build();
    }

    @Test
    @DisplayName("Should rank categories by fraud rate and break ties on the category name")
    void shouldRankCategories() {
        InsightReporter reporter = new InsightReporter(2, CLOCK);

        InsightReport report = reporter.summarize(List.of(), List.of(
                category("travel", 4, 1, "40"),
                category("misc_net", 2, 1, "20"),
                category("gas_transport", 4, 2, "40"),
                category("grocery_pos", 10, 0, "100")));

        assertEquals(List.of("gas_transport", "misc_net"), report.getHighRiskCategories().stream()
                .map(CategorySummary::getCategory).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should rank customers by total spend and break ties on the customer id")
    void shouldRankCustomers() {
        InsightReporter reporter = new InsightReporter(3, CLOCK);

        InsightReport report = reporter.summarize(List.of(
                customer("c3", "10.00"),
                customer("c2", "99.50"),
                customer("c1", "99.50"),
                customer("c4", "5.00")), List.of());

        assertEquals(List.of("c1", "c2", "c3"), report.getTopSpenders().stream()
                .map(CustomerSummary::getCustomerId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should compute totals and the overall fraud rate from the category view")
    void shouldComputeTotals() {
        InsightReporter reporter = new InsightReporter(5, CLOCK);

        InsightReport report = reporter.summarize(
                List.of(customer("c1", "30"), customer("c2", "70")),
                List.of(category("travel", 3, 1, "30"), category("grocery_pos", 1, 1, "70")));

        assertEquals(2, report.getTotalCustomers());
        assertEquals(2, report.getTotalCategories());
        assertEquals(4, report.getTotalTransactions());
        assertEquals(2, report.getTotalFraudTransactions());
        assertEquals(0, new BigDecimal("100").compareTo(report.getTotalAmount()));
        assertEquals(0.5, report.getOverallFraudRate(), 1e-12);
        assertEquals(Instant.parse("2024-06-01T12:00:00Z"), report.getGeneratedAt());
    }

    @Test
    @DisplayName("Should render the report text")
    void shouldRenderText() {
        InsightReporter reporter = new InsightReporter(5, CLOCK);

        String text = reporter.report(
                List.of(customer("c1", "1234.5")),
                List.of(category("travel", 2, 1, "1234.5")));

        assertTrue(text.startsWith("CREDIT CARD TRANSACTION INSIGHTS REPORT\n"));
        assertTrue(text.contains("Generated: 2024-06-01 12:00:00 UTC"));
        assertTrue(text.contains("travel"));
        assertTrue(text.contains("50.00% fraud rate (1 fraudulent / 2 total)"));
        assertTrue(text.contains("c1"));
        assertTrue(text.contains("$1,234.50"));
        assertTrue(text.contains("Overall Fraud Rate: 50.00%"));
        assertTrue(text.contains("Total Transactions: 2"));
    }

    @Test
    @DisplayName("Should render an empty report without dividing by zero")
    void shouldRenderEmptyReport() {
        InsightReporter reporter = new InsightReporter(5, CLOCK);

        InsightReport report = reporter.summarize(List.of(), List.of());
        String text = reporter.render(report);

        assertEquals(0.0, report.getOverallFraudRate());
        assertTrue(text.contains("No categories to report."));
        assertTrue(text.contains("Overall Fraud Rate: 0.00%"));
    }

    @Test
    @DisplayName("Should refuse a top list size below one")
    void shouldRejectInvalidTopN() {
        assertThrows(IllegalArgumentException.class, () -> new InsightReporter(0, CLOCK));
    }
}
