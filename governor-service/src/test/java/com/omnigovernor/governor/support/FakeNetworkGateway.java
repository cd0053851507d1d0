package com.omnigovernor.governor.support;

import com.omnigovernor.common.model.ConfirmationStatus;
import com.omnigovernor.common.model.FeeData;
import com.omnigovernor.common.model.SimulationResult;
import com.omnigovernor.common.model.StrikeAction;
import com.omnigovernor.common.model.SubmissionHandle;
import com.omnigovernor.common.network.NetworkGateway;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory {@link NetworkGateway} with scripted responses and call recording.
 */
public class FakeNetworkGateway implements NetworkGateway {

    private final String network;

    private Supplier<Mono<BigInteger>> balance = () -> Mono.just(BigInteger.ZERO);
    private Supplier<Mono<FeeData>> feeData = () -> Mono.just(GovernorFixtures.TEN_GWEI);
    private Supplier<Mono<SimulationResult>> simulation = () -> Mono.just(SimulationResult.passed());
    private Supplier<Mono<SubmissionHandle>> submission;
    private Supplier<Mono<ConfirmationStatus>> confirmation = () -> Mono.just(ConfirmationStatus.ACCEPTED);

    private final AtomicInteger simulateCalls = new AtomicInteger();
    private final AtomicInteger confirmationCalls = new AtomicInteger();
    private final List<StrikeAction> submitted = new CopyOnWriteArrayList<>();

    public FakeNetworkGateway(String network) {
        this.network    = network;
        this.submission = () -> Mono.just(new SubmissionHandle(network, "0xabc" + submitted.size()));
    }

    public FakeNetworkGateway balance(BigInteger wei)                 { this.balance = () -> Mono.just(wei); return this; }
    public FakeNetworkGateway balanceAfter(BigInteger wei, Duration delay) {
        this.balance = () -> Mono.delay(delay).thenReturn(wei);
        return this;
    }
    public FakeNetworkGateway balanceError(RuntimeException e)        { this.balance = () -> Mono.error(e); return this; }
    public FakeNetworkGateway feeData(FeeData fee)                    { this.feeData = () -> Mono.just(fee); return this; }
    public FakeNetworkGateway simulation(SimulationResult result)     { this.simulation = () -> Mono.just(result); return this; }
    public FakeNetworkGateway simulationError(RuntimeException e)     { this.simulation = () -> Mono.error(e); return this; }
    public FakeNetworkGateway submissionError(RuntimeException e)     { this.submission = () -> Mono.error(e); return this; }
    public FakeNetworkGateway confirmation(ConfirmationStatus status) { this.confirmation = () -> Mono.just(status); return this; }
    public FakeNetworkGateway confirmationError(RuntimeException e)   { this.confirmation = () -> Mono.error(e); return this; }
    public FakeNetworkGateway confirmationAfter(ConfirmationStatus status, Duration delay) {
        this.confirmation = () -> Mono.delay(delay).thenReturn(status);
        return this;
    }
    public FakeNetworkGateway confirmationNever()                     { this.confirmation = Mono::never; return this; }

    @Override
    public Mono<BigInteger> getBalance(String address) {
        return Mono.defer(balance);
    }

    @Override
    public Mono<FeeData> getFeeData() {
        return Mono.defer(feeData);
    }

    @Override
    public Mono<SimulationResult> simulate(StrikeAction action) {
        return Mono.defer(() -> {
            simulateCalls.incrementAndGet();
            return simulation.get();
        });
    }

    @Override
    public Mono<SubmissionHandle> submit(StrikeAction action) {
        return Mono.defer(() -> submission.get().doOnNext(h -> submitted.add(action)));
    }

    @Override
    public Mono<ConfirmationStatus> awaitConfirmation(SubmissionHandle handle, int confirmations) {
        return Mono.defer(() -> {
            confirmationCalls.incrementAndGet();
            return confirmation.get();
        });
    }

    public String network()              { return network; }
    public int simulateCalls()           { return simulateCalls.get(); }
    public int confirmationCalls()       { return confirmationCalls.get(); }
    public List<StrikeAction> submitted() { return submitted; }
}
