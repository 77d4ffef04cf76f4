package com.autorestake.web3.exception;

/** Transient failure of a restake attempt; the executor retries these up to the configured bound. */
public abstract class RestakeException extends RuntimeException {
    protected RestakeException(String message) { super(message); }
    protected RestakeException(String message, Throwable cause) { super(message, cause); }
}
