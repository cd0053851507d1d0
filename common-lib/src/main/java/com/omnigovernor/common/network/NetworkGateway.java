package com.omnigovernor.common.network;

import com.omnigovernor.common.model.ConfirmationStatus;
import com.omnigovernor.common.model.FeeData;
import com.omnigovernor.common.model.SimulationResult;
import com.omnigovernor.common.model.StrikeAction;
import com.omnigovernor.common.model.SubmissionHandle;
import reactor.core.publisher.Mono;

import java.math.BigInteger;

/**
 * Capability surface the governor consumes per network.
 *
 * <p>Current implementation: {@code JsonRpcNetworkGateway}, Ethereum-style JSON-RPC over
 * WebClient. The governor depends only on this interface, so other transports plug in
 * without touching the planner or the orchestrator.
 *
 * <p>Implementations MUST be non-blocking. No {@code .block()} is permitted inside any
 * implementation.
 */
public interface NetworkGateway {

    /** Native balance of {@code address}, in wei. */
    Mono<BigInteger> getBalance(String address);

    /** Current fee conditions. */
    Mono<FeeData> getFeeData();

    /**
     * Dry-runs {@code action} against the latest state.
     * A revert completes with {@link SimulationResult#reverted(String)}; transport failures error.
     */
    Mono<SimulationResult> simulate(StrikeAction action);

    /**
     * Signs and broadcasts {@code action}.
     * Errors with {@link com.omnigovernor.common.exception.InsufficientFundsException}
     * when the node rejects it for lack of funds.
     */
    Mono<SubmissionHandle> submit(StrikeAction action);

    /** Waits until the submission has {@code confirmations} confirmations and reports its status. */
    Mono<ConfirmationStatus> awaitConfirmation(SubmissionHandle handle, int confirmations);
}
