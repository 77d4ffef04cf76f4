package com.autorestake.web3;

import com.autorestake.config.RunConfig;
import com.autorestake.web3.dto.CallDescriptor;
import com.autorestake.web3.dto.ChainEvent;
import com.autorestake.web3.dto.ChainReceipt;
import com.autorestake.web3.exception.ConfirmationException;
import com.autorestake.web3.exception.RetryableRpcException;
import com.autorestake.web3.exception.SubmissionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * web3j-backed {@link ChainClient}.
 *
 * Transactions are signed once and the same raw bytes are broadcast through the failover factory,
 * so switching endpoints after a transport error can never produce a second transaction.
 */
@Component
@Slf4j
public class Web3ChainClient implements ChainClient {

    private static final int WORD_HEX = 64;

    private final Web3ClientFactory factory;
    private final RunConfig config;
    private final Credentials credentials;

    public Web3ChainClient(Web3ClientFactory factory, RunConfig config) {
        this.factory = factory;
        this.config = config;
        this.credentials = Credentials.create(config.privateKey());
    }

    @Override
    public String submit(CallDescriptor call) {
        String data = FunctionEncoder.encode(call.function());
        String to = call.contractAddress();
        try {
            RawTransaction raw = factory.executeWithFailover(web3 -> buildTransaction(web3, to, data));
            String signed = Numeric.toHexString(TransactionEncoder.signMessage(raw, config.chainId(), credentials));
            String expectedHash = Hash.sha3(signed);

            return factory.executeWithFailover(web3 -> {
                EthSendTransaction sent = send(() -> web3.ethSendRawTransaction(signed).send(), "eth_sendRawTransaction");
                if (sent.hasError()) {
                    String msg = sent.getError().getMessage();
                    // a failover rebroadcast of the same bytes
                    if (msg != null && msg.toLowerCase(Locale.ROOT).contains("already known")) {
                        return expectedHash;
                    }
                    if (Web3ClientFactory.isRateLimited(msg)) {
                        throw new RetryableRpcException("rate-limited on eth_sendRawTransaction: " + msg);
                    }
                    throw new SubmissionException("Transaction rejected by node: " + msg);
                }
                String hash = sent.getTransactionHash();
                return hash != null ? hash : expectedHash;
            });
        } catch (SubmissionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SubmissionException(call.name() + " submission failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ChainReceipt waitForFinality(String txId) {
        long intervalMs = config.receiptPollInterval().toMillis();
        int attempts = config.receiptPollAttempts();
        for (int i = 0; i < attempts; i++) {
            Optional<ChainReceipt> receipt;
            try {
                receipt = findReceipt(txId);
            } catch (RuntimeException e) {
                throw new ConfirmationException(txId, "Receipt lookup failed for " + txId + ": " + e.getMessage(), e);
            }
            if (receipt.isPresent()) return receipt.get();

            if (i < attempts - 1) {
                try {
                    Thread.sleep(intervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConfirmationException(txId, "Interrupted while waiting for " + txId, e);
                }
            }
        }
        throw new ConfirmationException(txId,
                "Transaction " + txId + " not final after " + attempts + " polls of " + intervalMs + "ms");
    }

    @Override
    public Optional<ChainReceipt> findReceipt(String txId) {
        return factory.executeWithFailover(web3 -> {
            EthGetTransactionReceipt resp = send(() -> web3.ethGetTransactionReceipt(txId).send(), "eth_getTransactionReceipt");
            checkError(resp, "eth_getTransactionReceipt");
            return resp.getTransactionReceipt().map(Web3ChainClient::toReceipt);
        });
    }

    @Override
    public List<Type> call(CallDescriptor call) {
        String data = FunctionEncoder.encode(call.function());
        return factory.executeWithFailover(web3 -> {
            EthCall resp = send(() -> web3.ethCall(
                    Transaction.createEthCallTransaction(credentials.getAddress(), call.contractAddress(), data),
                    DefaultBlockParameterName.LATEST).send(), call.name());
            if (resp.hasError() && Web3ClientFactory.isRateLimited(resp.getError().getMessage())) {
                throw new RetryableRpcException("rate-limited on " + call.name() + ": " + resp.getError().getMessage());
            }
            if (resp.isReverted() || resp.hasError()) {
                throw new IllegalStateException(call.name() + " reverted on " + call.contractAddress()
                        + (resp.hasError() ? ": " + resp.getError().getMessage() : ""));
            }
            return FunctionReturnDecoder.decode(resp.getValue(), call.function().getOutputParameters());
        });
    }

    // ---------------------------- Internals ----------------------------

    private RawTransaction buildTransaction(Web3j web3, String to, String data) {
        EthGetTransactionCount count = send(() -> web3.ethGetTransactionCount(
                credentials.getAddress(), DefaultBlockParameterName.PENDING).send(), "eth_getTransactionCount");
        checkError(count, "eth_getTransactionCount");

        EthGasPrice gasPrice = send(() -> web3.ethGasPrice().send(), "eth_gasPrice");
        checkError(gasPrice, "eth_gasPrice");

        BigInteger gasLimit = estimateGas(web3, to, data);
        log.debug("[web3] nonce={} gasPrice={} gasLimit={}", count.getTransactionCount(), gasPrice.getGasPrice(), gasLimit);
        return RawTransaction.createTransaction(
                count.getTransactionCount(), gasPrice.getGasPrice(), gasLimit, to, BigInteger.ZERO, data);
    }

    private BigInteger estimateGas(Web3j web3, String to, String data) {
        EthEstimateGas est = send(() -> web3.ethEstimateGas(
                Transaction.createEthCallTransaction(credentials.getAddress(), to, data)).send(), "eth_estimateGas");
        if (est.hasError()) {
            if (Web3ClientFactory.isRateLimited(est.getError().getMessage())) {
                throw new RetryableRpcException("rate-limited on eth_estimateGas: " + est.getError().getMessage());
            }
            log.warn("[web3] eth_estimateGas failed ({}), using fallback gas limit {}",
                    est.getError().getMessage(), config.fallbackGasLimit());
            return BigInteger.valueOf(config.fallbackGasLimit());
        }
        return new BigDecimal(est.getAmountUsed())
                .multiply(BigDecimal.valueOf(config.gasLimitMultiplier()))
                .toBigInteger();
    }

    private static ChainReceipt toReceipt(TransactionReceipt r) {
        List<ChainEvent> events = new ArrayList<>();
        if (r.getLogs() != null) {
            for (Log l : r.getLogs()) events.add(new ChainEvent(l.getTopics(), splitWords(l.getData())));
        }
        ChainReceipt.Status status = r.isStatusOK() ? ChainReceipt.Status.ACCEPTED : ChainReceipt.Status.REJECTED;
        return new ChainReceipt(r.getTransactionHash(), status, events);
    }

    /** Log data is a concatenation of 32-byte ABI words. */
    static List<String> splitWords(String data) {
        String hex = Numeric.cleanHexPrefix(data == null ? "" : data);
        List<String> words = new ArrayList<>(hex.length() / WORD_HEX);
        for (int i = 0; i + WORD_HEX <= hex.length(); i += WORD_HEX) {
            words.add("0x" + hex.substring(i, i + WORD_HEX));
        }
        return words;
    }

    private static void checkError(Response<?> resp, String method) {
        if (!resp.hasError()) return;
        String msg = resp.getError().getMessage();
        if (Web3ClientFactory.isRateLimited(msg)) {
            throw new RetryableRpcException("rate-limited on " + method + ": " + msg);
        }
        throw new IllegalStateException(method + " error: " + msg);
    }

    @FunctionalInterface
    private interface RpcCall<T> {
        T send() throws IOException;
    }

    private static <T> T send(RpcCall<T> call, String method) {
        try {
            return call.send();
        } catch (IOException e) {
            throw Web3ClientFactory.io(method, e);
        }
    }
}
