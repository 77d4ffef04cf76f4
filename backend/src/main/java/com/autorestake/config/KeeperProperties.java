package com.autorestake.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw keeper settings bound from application.yml / environment.
 * Never handed to components directly: {@link RunConfig#from(KeeperProperties)} validates it first.
 */
@ConfigurationProperties(prefix = "keeper")
@Data
public class KeeperProperties {
    private Rpc rpc = new Rpc();
    private Account account = new Account();
    private Schedule schedule = new Schedule();
    private Retry retry = new Retry();
    private Gate gate = new Gate();
    private Notification notification = new Notification();
    private Token token = new Token();

    /** Restake contract that exposes executeAutoRestake() and getConfig(). */
    private String contractAddress;

    @Data
    public static class Rpc {
        /** First entry is the primary endpoint, the rest are failover targets. */
        private List<String> urls = new ArrayList<>();
        private long chainId = 1;
        /** Receipt polling: interval * attempts is the effective finality timeout. */
        private Duration receiptPollInterval = Duration.ofSeconds(5);
        private int receiptPollAttempts = 120;
        /** Used when eth_estimateGas fails. */
        private long fallbackGasLimit = 500_000L;
        private double gasLimitMultiplier = 1.25;
    }

    @Data
    public static class Account {
        private String address;
        private String privateKey;
    }

    @Data
    public static class Schedule {
        /** Spring 6-field cron; every 12 hours by default. */
        private String cron = "0 0 */12 * * *";
        private boolean runOnStartup = true;
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private Duration delay = Duration.ofMinutes(1);
    }

    @Data
    public static class Gate {
        /** 1 token with 18 decimals. */
        private BigInteger minRewardThreshold = new BigInteger("1000000000000000000");
        private boolean enforceThreshold = false;
    }

    @Data
    public static class Notification {
        private String webhookUrl;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Token {
        private int decimals = 18;
        private int displayScale = 4;
    }
}
