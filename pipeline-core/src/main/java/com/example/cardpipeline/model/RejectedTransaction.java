package com.example.cardpipeline.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A Bronze row that failed at least one Silver rule, kept with all of its original fields.
 */
@Value
public class RejectedTransaction {

    BronzeRecord record;
    Set<RejectionReason> reasons;

    public RejectedTransaction(BronzeRecord record, Set<RejectionReason> reasons) {
        if (reasons.isEmpty()) {
            throw new IllegalArgumentException("A rejected transaction needs at least one reason (row " + record.getRowNumber() + ")");
        }
        this.record = record;
        this.reasons = Collections.unmodifiableSet(EnumSet.copyOf(reasons));
    }

    public boolean hasReason(RejectionReason reason) {
        return reasons.contains(reason);
    }

    /**
     * @return reason codes in declaration order, joined with {@code |}
     */
    public String reasonCodes() {
        return reasons.stream().map(RejectionReason::getCode).collect(Collectors.joining("|"));
    }
}
