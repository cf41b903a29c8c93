package com.example.cardpipeline.model;

/**
 * Data quality rules a Silver row can fail. A rejected row carries every reason it triggered.
 */
public enum RejectionReason {

    NEGATIVE_AMOUNT("negative_amount"),
    MISSING_FIELD("missing_field"),
    FUTURE_DATE("future_date"),
    INVALID_AMOUNT("invalid_amount"),
    INVALID_DATE("invalid_date"),
    MISSING_CATEGORY("missing_category"),
    INVALID_FRAUD_FLAG("invalid_fraud_flag");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
