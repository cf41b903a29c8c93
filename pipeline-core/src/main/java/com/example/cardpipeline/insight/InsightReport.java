package com.example.cardpipeline.insight;

import com.example.cardpipeline.model.CategorySummary;
import com.example.cardpipeline.model.CustomerSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class InsightReport {
    Instant generatedAt;
    int totalCustomers;
    int totalCategories;
    long totalTransactions;
    long totalFraudTransactions;
    BigDecimal totalAmount;
    double overallFraudRate;
    List<CategorySummary> highRiskCategories;
    List<CustomerSummary> topSpenders;
}
