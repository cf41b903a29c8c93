package com.example.cardpipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A transaction that passed every Silver rule, with typed fields.
 */
@Value
@Builder
public class Transaction {
    String transactionId;
    Instant timestamp;
    String customerId;
    String customerName; // null when the source has no name columns
    String merchantId;
    String category;
    BigDecimal amount;
    boolean fraud;
    @Singular
    Map<String, String> attributes; // auxiliary columns, not validated
}
