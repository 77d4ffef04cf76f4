package com.autorestake.config;

import com.autorestake.util.AddressUtil;
import org.springframework.scheduling.support.CronExpression;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, validated keeper configuration. Built once at startup and passed to every component.
 */
public record RunConfig(
        List<String> rpcUrls,
        long chainId,
        String contractAddress,
        String accountAddress,
        String privateKey,
        String cron,
        boolean runOnStartup,
        BigInteger minRewardThreshold,
        boolean enforceThreshold,
        int maxRetries,
        Duration retryDelay,
        String webhookUrl,
        Duration notificationTimeout,
        Duration receiptPollInterval,
        int receiptPollAttempts,
        long fallbackGasLimit,
        double gasLimitMultiplier,
        int tokenDecimals,
        int displayScale
) {

    public RunConfig {
        rpcUrls = List.copyOf(rpcUrls);
    }

    /**
     * Validates raw properties.
     *
     * @throws ConfigurationException listing every missing required field, or the first malformed one
     */
    public static RunConfig from(KeeperProperties p) {
        List<String> missing = new ArrayList<>();
        if (isBlank(p.getContractAddress())) missing.add("keeper.contract-address");
        if (isBlank(p.getAccount().getAddress())) missing.add("keeper.account.address");
        if (isBlank(p.getAccount().getPrivateKey())) missing.add("keeper.account.private-key");
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required configuration: " + String.join(", ", missing));
        }

        List<String> urls = p.getRpc().getUrls() == null ? List.of() : p.getRpc().getUrls().stream()
                .filter(u -> !isBlank(u))
                .map(String::trim)
                .toList();
        if (urls.isEmpty()) throw new ConfigurationException("At least one RPC url is required (keeper.rpc.urls)");

        String contract = address("keeper.contract-address", p.getContractAddress());
        String account = address("keeper.account.address", p.getAccount().getAddress());

        String derived;
        try {
            derived = Credentials.create(p.getAccount().getPrivateKey().trim()).getAddress();
        } catch (RuntimeException e) {
            throw new ConfigurationException("keeper.account.private-key is not a valid secp256k1 key", e);
        }
        if (!derived.equalsIgnoreCase(account)) {
            throw new ConfigurationException("keeper.account.private-key does not belong to account " + account);
        }

        String cron = normalizeCron(p.getSchedule().getCron());
        if (isBlank(cron) || !CronExpression.isValidExpression(cron)) {
            throw new ConfigurationException("Invalid cron expression: " + p.getSchedule().getCron());
        }

        var retry = p.getRetry();
        if (retry.getMaxRetries() < 0) throw new ConfigurationException("keeper.retry.max-retries must be >= 0");
        if (retry.getDelay() == null || retry.getDelay().isNegative()) {
            throw new ConfigurationException("keeper.retry.delay must be a non-negative duration");
        }

        BigInteger threshold = p.getGate().getMinRewardThreshold();
        if (threshold == null || threshold.signum() < 0) {
            throw new ConfigurationException("keeper.gate.min-reward-threshold must be >= 0");
        }

        var rpc = p.getRpc();
        if (rpc.getReceiptPollAttempts() < 1) throw new ConfigurationException("keeper.rpc.receipt-poll-attempts must be >= 1");

        return new RunConfig(
                urls,
                rpc.getChainId(),
                contract,
                account,
                p.getAccount().getPrivateKey().trim(),
                cron,
                p.getSchedule().isRunOnStartup(),
                threshold,
                p.getGate().isEnforceThreshold(),
                retry.getMaxRetries(),
                retry.getDelay(),
                isBlank(p.getNotification().getWebhookUrl()) ? null : p.getNotification().getWebhookUrl().trim(),
                p.getNotification().getTimeout(),
                rpc.getReceiptPollInterval(),
                rpc.getReceiptPollAttempts(),
                rpc.getFallbackGasLimit(),
                rpc.getGasLimitMultiplier(),
                p.getToken().getDecimals(),
                p.getToken().getDisplayScale()
        );
    }

    public boolean hasWebhook() {
        return webhookUrl != null;
    }

    /** Keeps the signing key out of logs. */
    @Override
    public String toString() {
        return "RunConfig[rpcUrls=" + rpcUrls + ", chainId=" + chainId + ", contract=" + contractAddress
                + ", account=" + accountAddress + ", cron=" + cron + ", maxRetries=" + maxRetries
                + ", retryDelay=" + retryDelay + ", webhook=" + (hasWebhook() ? "set" : "none") + "]";
    }

    /**
     * Accepts classic 5-field crontab lines (minute first) by pinning seconds to 0.
     * 6-field expressions are returned trimmed.
     */
    static String normalizeCron(String cron) {
        if (isBlank(cron)) return cron;
        String trimmed = cron.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    private static String address(String name, String value) {
        try {
            return AddressUtil.normalize(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + ": " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
