package com.autorestake.web3.exception;

/** The transaction could not be built, signed or broadcast. */
public class SubmissionException extends RestakeException {
    public SubmissionException(String message) { super(message); }
    public SubmissionException(String message, Throwable cause) { super(message, cause); }
}
