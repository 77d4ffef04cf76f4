package com.autorestake.service;

import com.autorestake.util.AmountUtil;
import com.autorestake.web3.dto.ChainEvent;
import com.autorestake.web3.dto.ChainReceipt;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Decoding of the RestakeExecuted(staker, pool, amount) event emitted by the restake contract.
 * All three fields are non-indexed, so the amount is data word 2.
 */
@Slf4j
public final class RestakeEvents {

    public static final Event RESTAKE_EXECUTED = new Event("RestakeExecuted", Arrays.asList(
            new TypeReference<Address>() {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {}));

    /** keccak256 of the event signature, i.e. topic 0. */
    public static final String SELECTOR = EventEncoder.encode(RESTAKE_EXECUTED);

    static final int AMOUNT_INDEX = 2;

    private RestakeEvents() {}

    /**
     * Restaked amount from the first matching event, or zero when the event is absent or malformed.
     */
    public static BigInteger amountOf(ChainReceipt receipt) {
        for (ChainEvent event : receipt.events()) {
            if (!event.hasSelector(SELECTOR)) continue;
            if (event.data().size() <= AMOUNT_INDEX) {
                log.warn("[restake] RestakeExecuted in {} has {} data fields, expected at least {}",
                        receipt.txId(), event.data().size(), AMOUNT_INDEX + 1);
                return BigInteger.ZERO;
            }
            try {
                return AmountUtil.parseHex(event.data().get(AMOUNT_INDEX));
            } catch (NumberFormatException e) {
                log.warn("[restake] unreadable amount '{}' in {}", event.data().get(AMOUNT_INDEX), receipt.txId());
                return BigInteger.ZERO;
            }
        }
        log.warn("[restake] no RestakeExecuted event in {}, amount unknown", receipt.txId());
        return BigInteger.ZERO;
    }
}
