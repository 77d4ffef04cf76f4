package com.autorestake.service;

import com.autorestake.config.RunConfig;
import com.autorestake.model.AttemptOutcome;
import com.autorestake.model.RestakeAttempt;
import com.autorestake.model.RestakeResult;
import com.autorestake.notify.Notifier;
import com.autorestake.util.AmountUtil;
import com.autorestake.web3.ChainClient;
import com.autorestake.web3.dto.CallDescriptor;
import com.autorestake.web3.dto.ChainReceipt;
import com.autorestake.web3.exception.ConfirmationException;
import com.autorestake.web3.exception.ExecutionRejectedException;
import com.autorestake.web3.exception.RestakeException;
import com.autorestake.web3.exception.SubmissionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Submits executeAutoRestake(), waits for finality and reads the restaked amount from the receipt.
 *
 * Failed attempts are retried after a fixed delay, at most {@code maxRetries} times.
 * When a previous attempt broadcast a transaction whose confirmation could not be observed,
 * its receipt is looked up again before anything new is sent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RestakeExecutor {

    static final String FUNCTION = "executeAutoRestake";

    private final RunConfig config;
    private final Notifier notifier;
    private final Sleeper sleeper;

    public RestakeResult execute(ChainClient chain) {
        final int total = config.maxRetries() + 1;
        final CallDescriptor call = CallDescriptor.of(config.contractAddress(), FUNCTION, List.of(), List.of());

        List<RestakeAttempt> attempts = new ArrayList<>(total);
        String lastError = null;
        String unconfirmedTx = null;

        for (int i = 0; i < total; i++) {
            if (i > 0) {
                log.info("[restake] Retrying in {} seconds...", config.retryDelay().toSeconds());
                try {
                    sleeper.sleep(config.retryDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = "interrupted while waiting to retry (" + lastError + ")";
                    log.warn("[restake] {}", lastError);
                    break;
                }
            }

            RestakeAttempt attempt = RestakeAttempt.pending(i);
            try {
                ChainReceipt receipt = unconfirmedTx == null ? null : landedReceipt(chain, unconfirmedTx).orElse(null);
                unconfirmedTx = null;

                if (receipt != null) {
                    attempt = attempt.withTxId(receipt.txId());
                } else {
                    log.info("[restake] Executing auto-restake (attempt {}/{})", i + 1, total);
                    String txId = submit(chain, call);
                    attempt = attempt.withTxId(txId);
                    log.info("[restake] Transaction submitted: {}", txId);
                    receipt = awaitFinality(chain, txId);
                }

                if (!receipt.isAccepted()) {
                    throw new ExecutionRejectedException(attempt.getTxId(), receipt.status().name());
                }

                return succeed(attempt, receipt, attempts);

            } catch (RestakeException e) {
                lastError = e.getMessage();
                attempts.add(attempt.withOutcome(AttemptOutcome.FAILURE).withError(lastError));
                if (e instanceof ConfirmationException ce && !(e instanceof ExecutionRejectedException)) {
                    unconfirmedTx = ce.getTxId();
                }
                log.error("[restake] Auto-restake failed (attempt {}/{}): {}", i + 1, total, lastError);
            }
        }

        // the last attempt's transaction may have landed while we were giving up on it
        if (unconfirmedTx != null && !Thread.currentThread().isInterrupted()) {
            Optional<ChainReceipt> late = landedReceipt(chain, unconfirmedTx);
            if (late.isPresent()) {
                RestakeAttempt last = attempts.remove(attempts.size() - 1);
                return succeed(last.withError(null), late.get(), attempts);
            }
        }

        RestakeResult result = RestakeResult.failure(lastError, attempts);
        String message = "Auto-restake failed after " + result.getAttemptsMade() + " attempts: " + lastError;
        log.error("[restake] {}", message);
        notifier.notify(message, true);
        return result;
    }

    private RestakeResult succeed(RestakeAttempt attempt, ChainReceipt receipt, List<RestakeAttempt> attempts) {
        BigInteger amount = RestakeEvents.amountOf(receipt);
        attempts.add(attempt.withOutcome(AttemptOutcome.SUCCESS).withAmount(amount));

        String message = "Auto-restake successful! Amount restaked: "
                + AmountUtil.toDisplay(amount, config.tokenDecimals(), config.displayScale())
                + " (" + amount + " wei), tx " + attempt.getTxId();
        log.info("[restake] {}", message);
        notifier.notify(message, false);
        return RestakeResult.success(amount, attempt.getTxId(), attempts);
    }

    private String submit(ChainClient chain, CallDescriptor call) {
        try {
            return chain.submit(call);
        } catch (RestakeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SubmissionException("submit failed: " + e.getMessage(), e);
        }
    }

    private ChainReceipt awaitFinality(ChainClient chain, String txId) {
        try {
            return chain.waitForFinality(txId);
        } catch (RestakeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfirmationException(txId, "wait for " + txId + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * A transaction from an earlier attempt that has since been accepted completes the run.
     * Lookup errors only mean we resubmit (or give up, after the last attempt).
     */
    private Optional<ChainReceipt> landedReceipt(ChainClient chain, String txId) {
        try {
            Optional<ChainReceipt> receipt = chain.findReceipt(txId);
            if (receipt.isPresent() && receipt.get().isAccepted()) {
                log.info("[restake] Earlier transaction {} was accepted after all, not resubmitting", txId);
                return receipt;
            }
            log.info("[restake] Earlier transaction {} not accepted ({}), resubmitting", txId,
                    receipt.map(r -> r.status().name()).orElse("no receipt"));
        } catch (RuntimeException e) {
            log.warn("[restake] Receipt re-check for {} failed: {}", txId, e.getMessage());
        }
        return Optional.empty();
    }
}
