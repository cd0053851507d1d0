package com.omnigovernor.governor.controller;

import com.omnigovernor.governor.config.GovernorProperties;
import com.omnigovernor.governor.registry.NetworkRegistry;
import com.omnigovernor.governor.scheduler.LoopState;
import com.omnigovernor.governor.scheduler.StrikeScheduler;
import com.omnigovernor.governor.trust.TrustLedger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness responder: any path, any method, fixed status object.
 * Served on the Netty event loop, independent of the strike loop.
 */
@RestController
public class HealthController {

    static final String ENGINE = "OMNI_GOVERNOR";

    @Value("${spring.application.version:1.0.0}")
    private String version = "1.0.0";

    private final GovernorProperties properties;
    private final NetworkRegistry registry;
    private final StrikeScheduler scheduler;
    private final TrustLedger trustLedger;

    public HealthController(GovernorProperties properties, NetworkRegistry registry,
                            StrikeScheduler scheduler, TrustLedger trustLedger) {
        this.properties  = properties;
        this.registry    = registry;
        this.scheduler   = scheduler;
        this.trustLedger = trustLedger;
    }

    @RequestMapping("/**")
    public ResponseEntity<Map<String, Object>> status() {
        LoopState loop = scheduler.getLoopState();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("engine", ENGINE);
        body.put("version", version);
        body.put("keys_detected", properties.credentialsConfigured());
        body.put("ai_active", true);
        body.put("reinforcement_learning", "ENABLED");
        body.put("loop_status", loop.getStatus().name());
        body.put("halt_reason", loop.getHaltReason());
        body.put("ticks_completed", loop.getTicksCompleted());
        body.put("attempts_dispatched", loop.getAttemptsDispatched());
        body.put("attempts_submitted", loop.getAttemptsSubmitted());
        body.put("last_tick_at", loop.getLastTickAt() != null ? loop.getLastTickAt().toString() : null);
        body.put("armed_networks", registry.armedCount());
        body.put("trust_scores", trustLedger.snapshot());
        return ResponseEntity.ok(body);
    }
}
