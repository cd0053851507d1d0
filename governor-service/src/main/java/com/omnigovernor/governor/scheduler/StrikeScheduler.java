package com.omnigovernor.governor.scheduler;

import com.omnigovernor.common.model.Signal;
import com.omnigovernor.governor.config.GovernorProperties;
import com.omnigovernor.governor.execution.AttemptResult;
import com.omnigovernor.governor.execution.StrikeOrchestrator;
import com.omnigovernor.governor.registry.NetworkRegistry;
import com.omnigovernor.governor.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Duration;
import java.util.List;

/**
 * Drives the unbounded tick loop.
 *
 * <pre>
 *   collect signals → fan out attempts (concurrent) → join all → delay(tickInterval) → repeat
 * </pre>
 *
 * <p>Each tick is a fresh {@link Mono} pipeline whose terminal {@code .subscribe()} schedules
 * the next tick. {@code Mono.delay()} releases the thread during the wait.
 *
 * <p>Attempts are joined with all-settle semantics: each one is isolated by
 * {@code onErrorResume}, so a failing attempt never cancels a sibling. Once started the loop
 * runs until shutdown; the only halting condition is the credential precondition checked
 * before the first tick. An empty or failed signal collection is a signal-free tick, and a tick that
 * settles with no report still schedules its successor.
 */
@Component
public class StrikeScheduler {

    private static final Logger log = LoggerFactory.getLogger(StrikeScheduler.class);

    private final SignalSource signalSource;
    private final NetworkRegistry registry;
    private final StrikeOrchestrator orchestrator;
    private final GovernorProperties properties;
    private final LoopState loopState = new LoopState();

    private volatile Disposable pendingTick;
    private volatile boolean stopped;

    @Value("${governor.loop.enabled:true}")
    private boolean loopEnabled = true;

    public StrikeScheduler(SignalSource signalSource, NetworkRegistry registry,
                           StrikeOrchestrator orchestrator, GovernorProperties properties) {
        this.signalSource = signalSource;
        this.registry     = registry;
        this.orchestrator = orchestrator;
        this.properties   = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startLoop() {
        if (!loopEnabled) {
            log.info("Strike loop disabled by configuration.");
            return;
        }
        if (!checkPreconditions()) {
            return;
        }
        log.info("Strike loop started. networks={} armed={} tickIntervalMs={}",
                 registry.networkNames(), registry.armedCount(), properties.tickInterval().toMillis());
        loopState.start();
        scheduleNextTick(Duration.ZERO);
    }

    /**
     * Required secrets must be present before the first tick.
     *
     * @return {@code false} when the loop must never start
     */
    boolean checkPreconditions() {
        if (!properties.credentialsConfigured()) {
            log.error("CRITICAL FAIL: PRIVATE_KEY or EXECUTOR_ADDRESS missing. Strike loop will not start.");
            loopState.halt("PRIVATE_KEY or EXECUTOR_ADDRESS missing");
            return false;
        }
        return true;
    }

    @PreDestroy
    public void stopLoop() {
        stopped = true;
        Disposable pending = pendingTick;
        if (pending != null) {
            pending.dispose();
        }
    }

    private void scheduleNextTick(Duration delay) {
        if (stopped) {
            return;
        }
        Disposable next = Mono.delay(delay)
            .then(Mono.defer(this::runTick))
            .doOnNext(loopState::recordTick)
            .doOnError(err -> log.error("Tick failed; rescheduling.", err))
            .onErrorResume(err -> Mono.empty())
            .doFinally(signal -> {
                if (signal != SignalType.CANCEL) {
                    scheduleNextTick(properties.tickInterval());
                }
            })
            .subscribe();
        pendingTick = next;
        if (stopped) {
            next.dispose();
        }
    }

    /**
     * One tick: collect signals once, dispatch every task concurrently, settle all.
     */
    public Mono<TickReport> runTick() {
        return Mono.defer(signalSource::collect)
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("Signal collection failed; treating tick as signal-free. reason={}", e.getMessage());
                return Mono.just(List.<Signal>of());
            })
            .flatMap(signals -> {
                List<StrikeTask> tasks = TickDispatchStrategy.plan(registry.networkNames(), signals);
                return Flux.fromIterable(tasks)
                    .flatMapSequential(this::dispatch)
                    .collectList()
                    .map(results -> new TickReport(signals.size(), tasks, results));
            })
            .doOnNext(report -> log.debug("Tick settled. signals={} attempts={} results={}",
                                          report.signalCount(), report.tasks().size(), report.countsByResult()));
    }

    private Mono<AttemptResult> dispatch(StrikeTask task) {
        return Mono.defer(() -> orchestrator.attempt(task.network(), task.ticker(), task.source()))
            .defaultIfEmpty(AttemptResult.ERRORED)
            .onErrorResume(e -> {
                log.warn("[{}] Attempt failed unexpectedly. ticker={} source={}",
                         task.network(), task.ticker(), task.source(), e);
                return Mono.just(AttemptResult.ERRORED);
            });
    }

    public LoopState getLoopState() {
        return loopState;
    }
}
