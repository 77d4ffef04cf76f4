package com.autorestake.service;

import com.autorestake.config.RunConfig;
import com.autorestake.web3.ChainClient;
import com.autorestake.web3.dto.CallDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;

/**
 * Decides whether a tick should restake.
 * With threshold enforcement off (default) every tick proceeds; the contract config is still read and logged.
 * With it on, the run is skipped while the staker's pending rewards are below the threshold.
 * Read failures never block a run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardGate {

    static final String GET_CONFIG = "getConfig";
    static final String PENDING_REWARDS = "pendingRewards";

    private final RunConfig config;

    public boolean shouldRun(ChainClient chain, BigInteger threshold) {
        log.info("[gate] Checking pending rewards...");
        RestakeContractConfig contractConfig;
        try {
            contractConfig = readConfig(chain);
            log.info("[gate] staking={} token={} staker={}",
                    contractConfig.stakingContract(), contractConfig.rewardToken(), contractConfig.staker());
        } catch (RuntimeException e) {
            log.warn("[gate] Failed to read restake contract config, proceeding: {}", e.getMessage());
            return true;
        }

        if (!config.enforceThreshold()) {
            log.debug("[gate] threshold enforcement disabled, proceeding");
            return true;
        }

        try {
            BigInteger pending = pendingRewards(chain, contractConfig);
            if (pending.compareTo(threshold) < 0) {
                log.info("[gate] Pending rewards {} below threshold {}. Skipping this run.", pending, threshold);
                return false;
            }
            log.info("[gate] Pending rewards {} >= threshold {}", pending, threshold);
            return true;
        } catch (RuntimeException e) {
            log.warn("[gate] Failed to read pending rewards, proceeding: {}", e.getMessage());
            return true;
        }
    }

    RestakeContractConfig readConfig(ChainClient chain) {
        List<Type> out = chain.call(CallDescriptor.of(config.contractAddress(), GET_CONFIG, List.of(), List.of(
                new TypeReference<Address>() {},
                new TypeReference<Address>() {},
                new TypeReference<Address>() {})));
        if (out.size() < 3) throw new IllegalStateException(GET_CONFIG + " returned " + out.size() + " values");
        return new RestakeContractConfig(
                (String) out.get(0).getValue(),
                (String) out.get(1).getValue(),
                (String) out.get(2).getValue());
    }

    private BigInteger pendingRewards(ChainClient chain, RestakeContractConfig cc) {
        List<Type> out = chain.call(CallDescriptor.of(cc.stakingContract(), PENDING_REWARDS,
                List.of(new Address(cc.staker())),
                List.of(new TypeReference<Uint256>() {})));
        if (out.isEmpty()) throw new IllegalStateException(PENDING_REWARDS + " returned nothing");
        return (BigInteger) out.get(0).getValue();
    }

    /** Values returned by the restake contract's getConfig(). */
    record RestakeContractConfig(String stakingContract, String rewardToken, String staker) {}
}
