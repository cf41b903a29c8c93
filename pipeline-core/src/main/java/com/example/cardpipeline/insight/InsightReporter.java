package com.example.cardpipeline.insight;

import com.example.cardpipeline.gold.FraudRates;
import com.example.cardpipeline.model.CategorySummary;
import com.example.cardpipeline.model.CustomerSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns the two Gold views into a short plain-text digest of fraud hot spots and spending.
 * Top lists break ties on the group key so the output is stable.
 */
public class InsightReporter {

    private static final Logger log = LoggerFactory.getLogger(InsightReporter.class);

    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);
    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);

    static final Comparator<CategorySummary> BY_FRAUD_RATE = Comparator
            .comparingDouble(CategorySummary::getFraudRate).reversed()
            .thenComparing(CategorySummary::getCategory);

    static final Comparator<CustomerSummary> BY_SPEND = Comparator
            .comparing(CustomerSummary::getTotalAmount).reversed()
            .thenComparing(CustomerSummary::getCustomerId);

    private final int topN;
    private final Clock clock;

    public InsightReporter(int topN, Clock clock) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be at least 1, was " + topN);
        }
        this.topN = topN;
        this.clock = clock;
    }

    public String report(List<CustomerSummary> customers, List<CategorySummary> categories) {
        return render(summarize(customers, categories));
    }

    public InsightReport summarize(List<CustomerSummary> customers, List<CategorySummary> categories) {
        long totalTransactions = categories.stream().mapToLong(CategorySummary::getTransactionCount).sum();
        long totalFraud = categories.stream().mapToLong(CategorySummary::getFraudCount).sum();
        BigDecimal totalAmount = categories.stream()
                .map(CategorySummary::getTotalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        InsightReport report = InsightReport.builder()
                .generatedAt(clock.instant())
                .totalCustomers(customers.size())
                .totalCategories(categories.size())
                .totalTransactions(totalTransactions)
                .totalFraudTransactions(totalFraud)
                .totalAmount(totalAmount)
                .overallFraudRate(FraudRates.of(totalFraud, totalTransactions))
                .highRiskCategories(categories.stream().sorted(BY_FRAUD_RATE).limit(topN).collect(Collectors.toList()))
                .topSpenders(customers.stream().sorted(BY_SPEND).limit(topN).collect(Collectors.toList()))
                .build();

        log.info("[INSIGHTS] {} transactions, {} fraudulent, overall fraud rate {}",
                totalTransactions, totalFraud, percent(report.getOverallFraudRate()));
        return report;
    }

    public String render(InsightReport report) {
        StringBuilder out = new StringBuilder();
        out.append("CREDIT CARD TRANSACTION INSIGHTS REPORT\n");
        out.append(RULE).append('\n');
        out.append("Generated: ").append(GENERATED_AT.format(report.getGeneratedAt())).append("\n\n");

        out.append("HIGH-RISK MERCHANT CATEGORIES\n");
        out.append(THIN_RULE).append('\n');
        if (report.getHighRiskCategories().isEmpty()) {
            out.append("No categories to report.\n");
        }
        for (CategorySummary category : report.getHighRiskCategories()) {
            out.append(String.format(Locale.ROOT, "%-20s - %7s fraud rate (%,d fraudulent / %,d total)\n",
                    category.getCategory(), percent(category.getFraudRate()),
                    category.getFraudCount(), category.getTransactionCount()));
        }
        out.append('\n');

        out.append("TOP SPENDING CUSTOMERS\n");
        out.append(THIN_RULE).append('\n');
        if (report.getTopSpenders().isEmpty()) {
            out.append("No customers to report.\n");
        }
        for (CustomerSummary customer : report.getTopSpenders()) {
            String label = customer.getCustomerName() == null
                    ? customer.getCustomerId()
                    : customer.getCustomerId() + " (" + customer.getCustomerName() + ")";
            out.append(String.format(Locale.ROOT, "%-30s - %s over %,d transactions (avg %s)\n",
                    label, money(customer.getTotalAmount()), customer.getTransactionCount(),
                    money(customer.getMeanAmount())));
        }
        out.append('\n');

        out.append("KEY METRICS\n");
        out.append(THIN_RULE).append('\n');
        out.append(String.format(Locale.ROOT, "Total Customers: %,d\n", report.getTotalCustomers()));
        out.append(String.format(Locale.ROOT, "Total Merchant Categories: %,d\n", report.getTotalCategories()));
        out.append(String.format(Locale.ROOT, "Total Transactions: %,d\n", report.getTotalTransactions()));
        out.append(String.format(Locale.ROOT, "Total Fraudulent Transactions: %,d\n", report.getTotalFraudTransactions()));
        out.append(String.format(Locale.ROOT, "Total Transaction Volume: %s\n", money(report.getTotalAmount())));
        out.append(String.format(Locale.ROOT, "Overall Fraud Rate: %s\n", percent(report.getOverallFraudRate())));
        return out.toString();
    }

    static String percent(double rate) {
        return String.format(Locale.ROOT, "%.2f%%", rate * 100);
    }

    static String money(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%,.2f", amount.setScale(2, RoundingMode.HALF_EVEN));
    }
}
