package com.example.cardpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Volume and fraud figures of one merchant category across the valid Silver partition.
 */
@Value
@Builder
public class CategorySummary {
    String category;
    long transactionCount;
    BigDecimal totalAmount;
    BigDecimal meanAmount;
    BigDecimal medianAmount;
    long fraudCount;
    double fraudRate;
    int uniqueCustomers;
    int uniqueMerchants;
}
