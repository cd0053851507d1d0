package com.omnigovernor.governor.execution;

import com.omnigovernor.common.exception.InsufficientFundsException;
import com.omnigovernor.common.model.Outcome;
import com.omnigovernor.common.model.SimulationResult;
import com.omnigovernor.common.model.StrikeAction;
import com.omnigovernor.common.model.StrikePlan;
import com.omnigovernor.common.model.SubmissionHandle;
import com.omnigovernor.common.trust.TrustUpdateRule;
import com.omnigovernor.common.unit.Units;
import com.omnigovernor.governor.config.GovernorProperties;
import com.omnigovernor.governor.planner.StrikePlanner;
import com.omnigovernor.governor.registry.NetworkRegistry;
import com.omnigovernor.governor.registry.NetworkSession;
import com.omnigovernor.governor.trust.TrustLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one strike attempt through its hard gates.
 *
 * <h3>Gate order</h3>
 * <ol>
 *   <li>Armed session for the network</li>
 *   <li>Plan from {@link StrikePlanner}</li>
 *   <li>Trust gate: source score must exceed {@link TrustUpdateRule#GATE_THRESHOLD}</li>
 *   <li>Simulation against current state</li>
 *   <li>Submission</li>
 *   <li>Detached confirmation wait feeding {@link TrustLedger#update}</li>
 * </ol>
 *
 * <p>The returned Mono never errors and completes once submission has settled. The confirmation
 * wait is subscribed separately so it can outlive the tick that started it. Only a submitted
 * action is ever scored: simulation and submission failures leave trust untouched.
 */
@Service
public class StrikeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StrikeOrchestrator.class);

    static final int REQUIRED_CONFIRMATIONS = 1;

    private final NetworkRegistry registry;
    private final StrikePlanner strikePlanner;
    private final TrustLedger trustLedger;
    private final StrikeFlowLogger flowLogger;
    private final String executorAddress;
    private final Duration confirmationTimeout;
    private final Scheduler learningScheduler;

    @Autowired
    public StrikeOrchestrator(NetworkRegistry registry, StrikePlanner strikePlanner, TrustLedger trustLedger,
                              StrikeFlowLogger flowLogger, GovernorProperties properties) {
        this(registry, strikePlanner, trustLedger, flowLogger, properties, Schedulers.boundedElastic());
    }

    /**
     * @param learningScheduler where trust updates run once a confirmation wait settles
     */
    public StrikeOrchestrator(NetworkRegistry registry, StrikePlanner strikePlanner, TrustLedger trustLedger,
                              StrikeFlowLogger flowLogger, GovernorProperties properties,
                              Scheduler learningScheduler) {
        this.registry            = registry;
        this.strikePlanner       = strikePlanner;
        this.trustLedger         = trustLedger;
        this.flowLogger          = flowLogger;
        this.executorAddress     = properties.executorAddress();
        this.confirmationTimeout = properties.confirmationTimeout();
        this.learningScheduler   = learningScheduler;
    }

    /**
     * @param network registry name of the target network
     * @param ticker  signal ticker, used for logging only
     * @param source  signal source whose trust gates and learns from this attempt
     */
    public Mono<AttemptResult> attempt(String network, String ticker, String source) {
        String attemptId = UUID.randomUUID().toString();

        return Mono.defer(() -> {
            Optional<NetworkSession> session = registry.find(network).filter(NetworkSession::isArmed);
            if (session.isEmpty()) {
                return Mono.just(AttemptResult.NO_SESSION);
            }
            flowLogger.stage(StrikeFlowLogger.ATTEMPT_STARTED, network, attemptId);
            return strikePlanner.plan(session.get())
                .flatMap(plan -> gateAndExecute(session.get(), plan, ticker, source, attemptId))
                .defaultIfEmpty(AttemptResult.NO_PLAN);
        });
    }

    private Mono<AttemptResult> gateAndExecute(NetworkSession session, StrikePlan plan,
                                               String ticker, String source, String attemptId) {
        String network = session.name();
        flowLogger.stage(StrikeFlowLogger.PLAN_COMPUTED, network, attemptId);

        // Lock-free read: an update in flight for the same source may land right after.
        double trust = trustLedger.get(source);
        if (!TrustUpdateRule.passesGate(trust)) {
            log.debug("[{}] Trust gate rejected. source={} trust={} attemptId={}",
                      network, source, String.format("%.4f", trust), attemptId);
            return Mono.just(AttemptResult.TRUST_REJECTED);
        }
        flowLogger.stage(StrikeFlowLogger.TRUST_GATE_PASSED, network, attemptId);

        StrikeAction action = StrikeAction.fromPlan(executorAddress, plan);
        log.info("[{}] STRIKING {} | Loan: {} ETH source={} trust={} attemptId={}",
                 network, ticker, Units.formatEther(plan.loanAmount()), source,
                 String.format("%.4f", trust), attemptId);

        return session.gateway().simulate(action)
            .onErrorResume(e -> Mono.just(SimulationResult.reverted(e.getMessage())))
            .flatMap(simulation -> {
                if (!simulation.ok()) {
                    log.info("[{}] Simulation reverted; strike dropped. reason={} attemptId={}",
                             network, simulation.revertReason(), attemptId);
                    return Mono.just(AttemptResult.SIMULATION_REVERTED);
                }
                flowLogger.stage(StrikeFlowLogger.SIMULATION_PASSED, network, attemptId);
                return submit(session, action, source, attemptId);
            });
    }

    private Mono<AttemptResult> submit(NetworkSession session, StrikeAction action,
                                       String source, String attemptId) {
        String network = session.name();
        return session.gateway().submit(action)
            .map(handle -> {
                log.info("[{}] SUCCESS: {} attemptId={}", network, handle.transactionHash(), attemptId);
                flowLogger.stage(StrikeFlowLogger.SUBMITTED, network, attemptId);
                verifyAndLearn(session, handle, source, attemptId)
                    .subscribe(
                        score -> flowLogger.stage(StrikeFlowLogger.LEARNED, network, attemptId),
                        err   -> log.error("[{}] Learning failed. source={} attemptId={}",
                                           network, source, attemptId, err)
                    );
                return AttemptResult.SUBMITTED;
            })
            .onErrorResume(e -> {
                if (e instanceof InsufficientFundsException || InsufficientFundsException.matches(e.getMessage())) {
                    log.debug("[{}] Submission skipped: insufficient funds. attemptId={}", network, attemptId);
                    return Mono.just(AttemptResult.INSUFFICIENT_FUNDS);
                }
                log.warn("[{}] Strike Aborted: {} attemptId={}", network, e.getMessage(), attemptId);
                return Mono.just(AttemptResult.SUBMISSION_FAILED);
            });
    }

    /**
     * Waits for one confirmation and reports the outcome to the ledger. A failed or timed-out
     * wait counts as an unsuccessful outcome.
     *
     * @return the source's new trust score
     */
    Mono<Double> verifyAndLearn(NetworkSession session, SubmissionHandle handle,
                                String source, String attemptId) {
        return session.gateway().awaitConfirmation(handle, REQUIRED_CONFIRMATIONS)
            .timeout(confirmationTimeout)
            .map(Outcome::from)
            .defaultIfEmpty(Outcome.failed())
            .onErrorResume(e -> {
                log.warn("[{}] Confirmation wait failed; scoring as failure. tx={} reason={} attemptId={}",
                         session.name(), handle.transactionHash(), e.getMessage(), attemptId);
                return Mono.just(Outcome.failed());
            })
            .publishOn(learningScheduler)
            .map(outcome -> trustLedger.update(source, outcome.success()));
    }
}
