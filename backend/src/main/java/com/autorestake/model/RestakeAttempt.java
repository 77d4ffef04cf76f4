package com.autorestake.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigInteger;

/**
 * One try inside a run. {@code txId} is set once the transaction was broadcast,
 * {@code amount} only on success.
 */
@Value
@Builder
@With
public class RestakeAttempt {
    /** 0-based. */
    int index;
    AttemptOutcome outcome;
    String txId;
    BigInteger amount;
    String error;

    public static RestakeAttempt pending(int index) {
        return RestakeAttempt.builder().index(index).outcome(AttemptOutcome.PENDING).build();
    }
}
