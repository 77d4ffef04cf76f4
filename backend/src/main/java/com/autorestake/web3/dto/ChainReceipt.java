package com.autorestake.web3.dto;

import java.util.List;

/**
 * Terminal record of a transaction: status and emitted events.
 */
public record ChainReceipt(String txId, Status status, List<ChainEvent> events) {

    public enum Status { ACCEPTED, REJECTED }

    public ChainReceipt {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
