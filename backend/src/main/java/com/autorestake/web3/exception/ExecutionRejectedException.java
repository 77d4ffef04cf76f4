package com.autorestake.web3.exception;

/** The transaction reached finality with a non-accepted status (reverted). */
public class ExecutionRejectedException extends ConfirmationException {
    private final String status;

    public ExecutionRejectedException(String txId, String status) {
        super(txId, "Transaction " + txId + " failed with status: " + status);
        this.status = status;
    }

    public String getStatus() {
        return status;
    }
}
