package com.autorestake.web3;

import com.autorestake.web3.dto.CallDescriptor;
import com.autorestake.web3.dto.ChainReceipt;
import com.autorestake.web3.exception.ConfirmationException;
import com.autorestake.web3.exception.SubmissionException;
import org.web3j.abi.datatypes.Type;

import java.util.List;
import java.util.Optional;

/**
 * Boundary to the chain SDK. The keeper only needs to send one transaction, wait for it,
 * and read a couple of view functions.
 */
public interface ChainClient {

    /**
     * Sign and broadcast a state-changing call.
     *
     * @return transaction id (hash)
     * @throws SubmissionException when the call cannot be built or sent
     */
    String submit(CallDescriptor call);

    /**
     * Block until the transaction reaches a terminal status.
     *
     * @throws ConfirmationException when the wait itself fails or times out
     */
    ChainReceipt waitForFinality(String txId);

    /**
     * One-shot receipt lookup. Empty when the transaction is not (yet) included.
     */
    Optional<ChainReceipt> findReceipt(String txId);

    /**
     * Read-only eth_call; decoded outputs in declaration order.
     */
    List<Type> call(CallDescriptor call);
}
