package com.autorestake.web3.dto;

import java.util.List;

/**
 * Event emitted in a receipt: ordered key fields (log topics) and ordered data fields
 * (the log data split into 32-byte words), all 0x-prefixed hex.
 */
public record ChainEvent(List<String> keys, List<String> data) {

    public ChainEvent {
        keys = keys == null ? List.of() : List.copyOf(keys);
        data = data == null ? List.of() : List.copyOf(data);
    }

    public boolean hasSelector(String selector) {
        return !keys.isEmpty() && keys.get(0).equalsIgnoreCase(selector);
    }
}
