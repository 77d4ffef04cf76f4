package com.autorestake.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * Terminal outcome of one scheduled run: either success with amount and tx id,
 * or failure with the last error. Produced once per tick and never persisted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RestakeResult {
    boolean success;
    BigInteger amount;
    String txId;
    String lastError;
    int attemptsMade;
    List<RestakeAttempt> attempts;

    public static RestakeResult success(BigInteger amount, String txId, List<RestakeAttempt> attempts) {
        return new RestakeResult(true, amount, txId, null, attempts.size(), List.copyOf(attempts));
    }

    public static RestakeResult failure(String lastError, List<RestakeAttempt> attempts) {
        return new RestakeResult(false, null, null, lastError, attempts.size(), List.copyOf(attempts));
    }
}
