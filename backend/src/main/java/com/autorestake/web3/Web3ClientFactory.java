package com.autorestake.web3;

import com.autorestake.config.RunConfig;
import com.autorestake.web3.exception.RetryableRpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Builds one Web3j client per configured RPC url and fails over
 * between them on rate-limit or IO errors.
 */
@Component
@Slf4j
public class Web3ClientFactory implements DisposableBean {

    /**
     * Endpoint state with simple penalty window (circuit half-open).
     */
    private static class Endpoint {
        final String url;
        final Web3j web3j;
        volatile Instant penaltyUntil = Instant.EPOCH;

        Endpoint(String url) {
            this.url = url;
            this.web3j = Web3j.build(new HttpService(url));
        }

        boolean isAvailable() {
            return Instant.now().isAfter(penaltyUntil);
        }

        void penalize(Duration d) {
            penaltyUntil = Instant.now().plus(d);
        }
    }

    private static final Duration BASE_BACKOFF = Duration.ofMillis(400);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(5);
    private static final Duration PENALTY = Duration.ofSeconds(20);

    private final List<Endpoint> ring;
    /** Index of the endpoint that answered last; next call starts there. */
    private final AtomicInteger preferred = new AtomicInteger();

    public Web3ClientFactory(RunConfig config) {
        List<Endpoint> list = new ArrayList<>(config.rpcUrls().size());
        for (String u : config.rpcUrls()) list.add(new Endpoint(u));
        this.ring = List.copyOf(list);
        log.info("Initialized {} RPC endpoints: {}", ring.size(), config.rpcUrls());
    }

    /**
     * Execute a function against Web3j with RPC failover.
     * IO failures must surface as {@link UncheckedIOException}; logical rate-limit answers as
     * {@link RetryableRpcException}. Anything else is treated as non-retryable and rethrown as is.
     *
     * @param fn  function to execute against one endpoint
     * @param <T> return type
     */
    public <T> T executeWithFailover(Function<Web3j, T> fn) {
        if (ring.isEmpty()) throw new IllegalStateException("No RPC URLs configured");

        final int total = ring.size();
        final int start = preferred.get();
        // when every endpoint is penalized we still try them all rather than fail outright
        final boolean anyAvailable = ring.stream().anyMatch(Endpoint::isAvailable);

        RuntimeException last = null;
        for (int tried = 0; tried < total; tried++) {
            int idx = (start + tried) % total;
            Endpoint ep = ring.get(idx);

            if (anyAvailable && !ep.isAvailable()) continue;

            if (tried > 0 && last != null) backoff(tried);

            try {
                T out = fn.apply(ep.web3j);
                preferred.set(idx);
                return out;
            } catch (RetryableRpcException ex) {
                last = ex;
                log.warn("[web3 failover] Retryable on {}: {}", ep.url, ex.getMessage());
                ep.penalize(PENALTY);
            } catch (RuntimeException ex) {
                if (!isRetryableTransport(ex)) {
                    // non-retryable (e.g. contract revert, rejected tx) -> fail fast
                    log.debug("[web3 failover] Non-retryable on {}: {}", ep.url, ex.toString());
                    throw ex;
                }
                last = ex;
                log.warn("[web3 failover] Transport retryable on {}: {}", ep.url, ex.toString());
                ep.penalize(PENALTY);
            }
        }

        if (last != null) throw last;
        throw new IllegalStateException("All RPC endpoints failed");
    }

    /** Primary client; used only where failover makes no sense. */
    public Web3j primary() {
        return ring.get(0).web3j;
    }

    public static UncheckedIOException io(String what, IOException e) {
        return new UncheckedIOException(what + ": " + e.getMessage(), e);
    }

    static boolean isRateLimited(String msg) {
        if (msg == null) return false;
        String m = msg.toLowerCase(Locale.ROOT);
        return m.contains("429") ||
                m.contains("rate limit") ||
                m.contains("over rate") ||
                m.contains("1015") ||            // Cloudflare code used by some RPCs
                m.contains("too many requests");
    }

    private boolean isRetryableTransport(RuntimeException ex) {
        if (ex instanceof UncheckedIOException) return true;
        String msg = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        return isRateLimited(msg) ||
                msg.contains("timeout") ||
                msg.contains("connection") ||
                msg.contains("refused") ||
                msg.contains("unexpected end of stream");
    }

    private void backoff(int tried) {
        long pow = Math.min(tried - 1, 4);
        long delay = Math.min(BASE_BACKOFF.toMillis() * (1L << pow), MAX_BACKOFF.toMillis());
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during RPC failover", e);
        }
    }

    @Override
    public void destroy() {
        ring.forEach(ep -> ep.web3j.shutdown());
    }
}
