package com.example.cardpipeline.model;

import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the Silver stage: the valid and rejected partitions of one Bronze table.
 */
@Value
public class SilverResult {

    Instant processedAt;
    List<Transaction> valid;
    List<RejectedTransaction> rejected;

    public SilverResult(Instant processedAt, List<Transaction> valid, List<RejectedTransaction> rejected) {
        this.processedAt = processedAt;
        this.valid = List.copyOf(valid);
        this.rejected = List.copyOf(rejected);
    }

    public int getTotalCount() {
        return valid.size() + rejected.size();
    }

    public int getValidCount() {
        return valid.size();
    }

    public int getRejectedCount() {
        return rejected.size();
    }

    /**
     * Number of rejected rows per reason. A row with two reasons counts once under each.
     */
    public Map<RejectionReason, Long> getReasonCounts() {
        Map<RejectionReason, Long> counts = new EnumMap<>(RejectionReason.class);
        for (RejectedTransaction rejectedTransaction : rejected) {
            for (RejectionReason reason : rejectedTransaction.getReasons()) {
                counts.merge(reason, 1L, Long::sum);
            }
        }
        return counts;
    }
}
