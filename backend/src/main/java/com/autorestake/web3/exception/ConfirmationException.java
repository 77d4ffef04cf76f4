package com.autorestake.web3.exception;

/**
 * Waiting for finality failed (timeout, RPC error). The transaction may still land later,
 * so {@link #getTxId()} is kept for a receipt re-check before resubmitting.
 */
public class ConfirmationException extends RestakeException {
    private final String txId;

    public ConfirmationException(String txId, String message) {
        super(message);
        this.txId = txId;
    }

    public ConfirmationException(String txId, String message, Throwable cause) {
        super(message, cause);
        this.txId = txId;
    }

    public String getTxId() {
        return txId;
    }
}
