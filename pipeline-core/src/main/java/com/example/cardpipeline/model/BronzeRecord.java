package com.example.cardpipeline.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw row of the Bronze table. Values are kept exactly as read; blank values are stored as {@code null}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BronzeRecord {

    private final long rowNumber;
    private final Map<String, String> values;

    public BronzeRecord(long rowNumber, Map<String, String> values) {
        this.rowNumber = rowNumber;
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((column, value) -> copy.put(column, normalize(value)));
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * @param column logical column name
     * @return the trimmed value, or {@code null} when the column is absent or blank
     */
    public String get(String column) {
        return values.get(column);
    }

    public boolean isPresent(String column) {
        return values.get(column) != null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
