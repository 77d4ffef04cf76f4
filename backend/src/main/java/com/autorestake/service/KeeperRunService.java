package com.autorestake.service;

import com.autorestake.config.RunConfig;
import com.autorestake.model.RestakeResult;
import com.autorestake.notify.Notifier;
import com.autorestake.web3.ChainClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * One keeper tick: reward gate, then the restake executor. Never throws;
 * unexpected failures are logged and notified so the schedule keeps going.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KeeperRunService {

    private final ChainClient chainClient;
    private final RewardGate rewardGate;
    private final RestakeExecutor executor;
    private final Notifier notifier;
    private final RunConfig config;

    /**
     * @return the run's result, or empty when the gate skipped it or the run crashed
     */
    public Optional<RestakeResult> runKeeper() {
        log.info("[keeper] Starting keeper run...");
        try {
            if (!rewardGate.shouldRun(chainClient, config.minRewardThreshold())) {
                log.info("[keeper] Run skipped by reward gate");
                return Optional.empty();
            }

            RestakeResult result = executor.execute(chainClient);
            if (result.isSuccess()) {
                log.info("[keeper] Keeper run completed successfully: amount={} tx={} attempts={}",
                        result.getAmount(), result.getTxId(), result.getAttemptsMade());
            } else {
                log.warn("[keeper] Keeper run finished with failure after {} attempts: {}",
                        result.getAttemptsMade(), result.getLastError());
            }
            return Optional.of(result);
        } catch (RuntimeException e) {
            log.error("[keeper] Keeper run failed", e);
            notifier.notify("Keeper run failed: " + e.getMessage(), true);
            return Optional.empty();
        }
    }
}
