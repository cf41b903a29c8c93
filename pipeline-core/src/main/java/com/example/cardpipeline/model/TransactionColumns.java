package com.example.cardpipeline.model;

import java.util.List;

/**
 * Logical column names of the transaction table, independent of the headers used by the source file.
 */
public final class TransactionColumns {

    public static final String TRANSACTION_ID = "transaction_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String CUSTOMER_ID = "customer_id";
    public static final String MERCHANT_ID = "merchant_id";
    public static final String CATEGORY = "category";
    public static final String AMOUNT = "amount";
    public static final String IS_FRAUD = "is_fraud";

    // Optional, used to label customers when present.
    public static final String FIRST_NAME = "first";
    public static final String LAST_NAME = "last";

    // Optional, carried to the customer summary when present.
    public static final String CITY = "city";
    public static final String STATE = "state";
    public static final String JOB = "job";

    /**
     * Columns a Bronze table must carry. A table without any of them cannot be validated at all.
     */
    public static final List<String> EXPECTED = List.of(
            TRANSACTION_ID, TIMESTAMP, CUSTOMER_ID, MERCHANT_ID, CATEGORY, AMOUNT, IS_FRAUD);

    /**
     * Columns whose value must be present on every row.
     */
    public static final List<String> REQUIRED_VALUES = List.of(
            TRANSACTION_ID, CUSTOMER_ID, MERCHANT_ID, AMOUNT, TIMESTAMP);

    /**
     * Whether a column is carried alongside a valid transaction as a pass-through attribute. The name parts are not,
     * they are folded into the customer name.
     */
    public static boolean isAuxiliary(String column) {
        return !EXPECTED.contains(column) && !FIRST_NAME.equals(column) && !LAST_NAME.equals(column);
    }

    private TransactionColumns() {
    }
}
