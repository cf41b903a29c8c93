package com.example.cardpipeline.gold;

import com.example.cardpipeline.model.CategorySummary;
import com.example.cardpipeline.model.CustomerSummary;
import com.example.cardpipeline.model.GoldResult;
import com.example.cardpipeline.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Builds the customer and merchant category views from the valid Silver partition.
 * Summaries come back sorted by their key, whatever the order of the input rows.
 */
public class GoldAggregator {

    private static final Logger log = LoggerFactory.getLogger(GoldAggregator.class);

    public GoldResult aggregate(List<Transaction> validTransactions) {
        log.info("[GOLD] Aggregating {} valid transactions", validTransactions.size());

        List<CustomerSummary> customers = summarizeCustomers(validTransactions);
        List<CategorySummary> categories = summarizeCategories(validTransactions);

        log.info("[GOLD] Customer summary: {} customers, category summary: {} categories",
                customers.size(), categories.size());
        return new GoldResult(customers, categories);
    }

    public List<CustomerSummary> summarizeCustomers(List<Transaction> validTransactions) {
        List<CustomerSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, SpendingAccumulator> group : fold(validTransactions, Transaction::getCustomerId).entrySet()) {
            SpendingAccumulator acc = group.getValue();
            summaries.add(CustomerSummary.builder()
                    .customerId(group.getKey())
                    .customerName(acc.name())
                    .transactionCount(acc.count())
                    .totalAmount(acc.total())
                    .meanAmount(acc.mean())
                    .medianAmount(acc.median())
                    .fraudCount(acc.fraudCount())
                    .fraudRate(acc.fraudRate())
                    .firstTransactionAt(acc.first())
                    .lastTransactionAt(acc.last())
                    .lifetimeDays(acc.lifetimeDays())
                    .uniqueMerchants(acc.uniqueMerchants())
                    .city(acc.city())
                    .state(acc.state())
                    .job(acc.job())
                    .build());
        }
        return summaries;
    }

    public List<CategorySummary> summarizeCategories(List<Transaction> validTransactions) {
        List<CategorySummary> summaries = new ArrayList<>();
        for (Map.Entry<String, SpendingAccumulator> group : fold(validTransactions, Transaction::getCategory).entrySet()) {
            SpendingAccumulator acc = group.getValue();
            summaries.add(CategorySummary.builder()
                    .category(group.getKey())
                    .transactionCount(acc.count())
                    .totalAmount(acc.total())
                    .meanAmount(acc.mean())
                    .medianAmount(acc.median())
                    .fraudCount(acc.fraudCount())
                    .fraudRate(acc.fraudRate())
                    .uniqueCustomers(acc.uniqueCustomers())
                    .uniqueMerchants(acc.uniqueMerchants())
                    .build());
        }
        return summaries;
    }

    private static SortedMap<String, SpendingAccumulator> fold(List<Transaction> transactions,
                                                               Function<Transaction, String> key) {
        SortedMap<String, SpendingAccumulator> groups = new TreeMap<>();
        for (Transaction transaction : transactions) {
            groups.computeIfAbsent(key.apply(transaction), k -> new SpendingAccumulator()).add(transaction);
        }
        return groups;
    }
}
