package com.example.cardpipeline.gold;

import com.example.cardpipeline.model.Transaction;
import com.example.cardpipeline.model.TransactionColumns;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Running fold of one aggregation group. The mean and the fraud rate are derived from the folded count and sums,
 * never averaged incrementally.
 */
final class SpendingAccumulator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private long count;
    private long fraudCount;
    private BigDecimal total = BigDecimal.ZERO;
    private final List<BigDecimal> amounts = new ArrayList<>();
    private Instant first;
    private Instant last;
    private String name;
    private String city;
    private String state;
    private String job;
    private final Set<String> customers = new HashSet<>();
    private final Set<String> merchants = new HashSet<>();

    void add(Transaction transaction) {
        count++;
        total = total.add(transaction.getAmount());
        amounts.add(transaction.getAmount());
        if (transaction.isFraud()) {
            fraudCount++;
        }
        Instant timestamp = transaction.getTimestamp();
        if (first == null || timestamp.isBefore(first)) {
            first = timestamp;
        }
        if (last == null || timestamp.isAfter(last)) {
            last = timestamp;
        }
        // smallest value wins so labels do not depend on row order
        name = smallest(name, transaction.getCustomerName());
        city = smallest(city, transaction.getAttributes().get(TransactionColumns.CITY));
        state = smallest(state, transaction.getAttributes().get(TransactionColumns.STATE));
        job = smallest(job, transaction.getAttributes().get(TransactionColumns.JOB));
        customers.add(transaction.getCustomerId());
        merchants.add(transaction.getMerchantId());
    }

    private static String smallest(String current, String candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.compareTo(current) < 0 ? candidate : current;
    }

    long count() {
        return count;
    }

    long fraudCount() {
        return fraudCount;
    }

    BigDecimal total() {
        return total;
    }

    BigDecimal mean() {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return total.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
    }

    /**
     * Middle amount of the group; the mean of the two middle amounts when the group size is even.
     */
    BigDecimal median() {
        if (amounts.isEmpty()) {
            return BigDecimal.ZERO;
        }
        List<BigDecimal> sorted = new ArrayList<>(amounts);
        sorted.sort(null);
        int middle = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(middle);
        }
        return sorted.get(middle - 1).add(sorted.get(middle)).divide(TWO, MathContext.DECIMAL64);
    }

    double fraudRate() {
        return FraudRates.of(fraudCount, count);
    }

    Instant first() {
        return first;
    }

    Instant last() {
        return last;
    }

    /**
     * Whole days between the first and the last transaction, truncated.
     */
    long lifetimeDays() {
        if (first == null) {
            return 0;
        }
        return Duration.between(first, last).toDays();
    }

    String name() {
        return name;
    }

    String city() {
        return city;
    }

    String state() {
        return state;
    }

    String job() {
        return job;
    }

    int uniqueCustomers() {
        return customers.size();
    }

    int uniqueMerchants() {
        return merchants.size();
    }
}
