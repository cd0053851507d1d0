package com.omnigovernor.governor.controller;

import com.omnigovernor.governor.config.GovernorProperties;
import com.omnigovernor.governor.execution.AttemptResult;
import com.omnigovernor.governor.execution.StrikeFlowLogger;
import com.omnigovernor.governor.execution.StrikeOrchestrator;
import com.omnigovernor.governor.planner.StrikePlanner;
import com.omnigovernor.governor.registry.NetworkRegistry;
import com.omnigovernor.governor.scheduler.StrikeScheduler;
import com.omnigovernor.governor.scheduler.StrikeTask;
import com.omnigovernor.governor.scheduler.TickReport;
import com.omnigovernor.governor.support.FakeNetworkGateway;
import com.omnigovernor.governor.support.GovernorFixtures;
import com.omnigovernor.governor.trust.TrustLedger;
import com.omnigovernor.governor.trust.TrustStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.List;

class HealthControllerTest {

    @TempDir
    Path dir;

    private StrikeScheduler scheduler;

    private WebTestClient client(String privateKey) {
        GovernorProperties properties = GovernorFixtures.properties(dir.resolve("trust_scores.json"), privateKey,
                                                                    GovernorFixtures.networks("BASE", "POLYGON"));
        NetworkRegistry registry = new NetworkRegistry(properties,
            (config, credentials) -> new FakeNetworkGateway(config.name()));
        TrustLedger ledger = new TrustLedger(new TrustStore(properties, GovernorFixtures.objectMapper()), properties);
        StrikeOrchestrator orchestrator = new StrikeOrchestrator(
            registry, new StrikePlanner(), ledger, new StrikeFlowLogger(), properties, Schedulers.immediate());
        scheduler = new StrikeScheduler(() -> Mono.just(List.of()), registry, orchestrator, properties);
        return WebTestClient.bindToController(new HealthController(properties, registry, scheduler, ledger)).build();
    }

    @Test
    @DisplayName("any path answers 200 with the fixed status object")
    void anyPath() {
        client(GovernorFixtures.TEST_KEY).get().uri("/some/random/path")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.engine").isEqualTo("OMNI_GOVERNOR")
            .jsonPath("$.keys_detected").isEqualTo(true)
            .jsonPath("$.ai_active").isEqualTo(true)
            .jsonPath("$.reinforcement_learning").isEqualTo("ENABLED")
            .jsonPath("$.loop_status").isEqualTo("IDLE")
            .jsonPath("$.armed_networks").isEqualTo(2)
            .jsonPath("$.trust_scores.WEB_AI").isEqualTo(0.85)
            .jsonPath("$.trust_scores.DISCOVERY").isEqualTo(0.7);
    }

    @Test
    @DisplayName("any method answers too; missing key reports keys_detected=false")
    void anyMethodNoKey() {
        client(null).post().uri("/")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.keys_detected").isEqualTo(false)
            .jsonPath("$.armed_networks").isEqualTo(0);
    }

    @Test
    @DisplayName("halted loop reports its reason")
    void haltReason() {
        WebTestClient client = client(null);
        scheduler.startLoop();

        client.get().uri("/")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.loop_status").isEqualTo("HALTED")
            .jsonPath("$.halt_reason").isEqualTo("PRIVATE_KEY or EXECUTOR_ADDRESS missing")
            .jsonPath("$.ticks_completed").isEqualTo(0);
    }

    @Test
    @DisplayName("loop progress counters are reported")
    void progressCounters() {
        WebTestClient client = client(GovernorFixtures.TEST_KEY);
        scheduler.getLoopState().recordTick(new TickReport(0,
            List.of(new StrikeTask("BASE", "DISCOVERY", "DISCOVERY"), new StrikeTask("POLYGON", "DISCOVERY", "DISCOVERY")),
            List.of(AttemptResult.SUBMITTED, AttemptResult.NO_PLAN)));

        client.get().uri("/")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.ticks_completed").isEqualTo(1)
            .jsonPath("$.attempts_dispatched").isEqualTo(2)
            .jsonPath("$.attempts_submitted").isEqualTo(1)
            .jsonPath("$.last_tick_at").isNotEmpty();
    }
}
