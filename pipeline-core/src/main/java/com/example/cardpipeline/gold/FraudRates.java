package com.example.cardpipeline.gold;

/**
 * Fraud rate as a fraction in [0, 1].
 */
public final class FraudRates {

    private FraudRates() {
    }

    /**
     * @return {@code fraudCount / total}, or 0 when {@code total} is 0
     */
    public static double of(long fraudCount, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return (double) fraudCount / total;
    }
}
