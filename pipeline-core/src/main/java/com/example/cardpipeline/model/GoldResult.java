package com.example.cardpipeline.model;

import lombok.Value;

import java.util.List;

@Value
public class GoldResult {

    List<CustomerSummary> customerSummaries;
    List<CategorySummary> categorySummaries;

    public GoldResult(List<CustomerSummary> customerSummaries, List<CategorySummary> categorySummaries) {
        this.customerSummaries = List.copyOf(customerSummaries);
        this.categorySummaries = List.copyOf(categorySummaries);
    }
}
