package com.example.cardpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Spending of one customer across the valid Silver partition.
 */
@Value
@Builder
public class CustomerSummary {
    String customerId;
    String customerName;
    long transactionCount;
    BigDecimal totalAmount;
    BigDecimal meanAmount;
    BigDecimal medianAmount;
    long fraudCount;
    double fraudRate;
    Instant firstTransactionAt;
    Instant lastTransactionAt;
    long lifetimeDays;
    int uniqueMerchants;
    // first non-empty value in sort order, null when the source carries none
    String city;
    String state;
    String job;
}
