package com.example.cardpipeline.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Minimally parsed transaction data as landed by the raw reader. Immutable once built.
 */
@Getter
@ToString(exclude = "records")
public final class BronzeTable {

    private final List<String> columns;
    private final List<BronzeRecord> records;
    private final String sourceFile;
    private final String sourceSystem;
    private final Instant ingestedAt;

    public BronzeTable(List<String> columns, List<BronzeRecord> records,
                       String sourceFile, String sourceSystem, Instant ingestedAt) {
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
        this.sourceFile = sourceFile;
        this.sourceSystem = sourceSystem;
        this.ingestedAt = ingestedAt;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return records.size();
    }
}
