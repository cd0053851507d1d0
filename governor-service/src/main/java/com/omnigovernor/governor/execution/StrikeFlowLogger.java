package com.omnigovernor.governor.execution;

import com.omnigovernor.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each stage of a strike attempt. Pure side effects, no business logic.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #ATTEMPT_STARTED}</li>
 *   <li>{@link #PLAN_COMPUTED}</li>
 *   <li>{@link #TRUST_GATE_PASSED}</li>
 *   <li>{@link #SIMULATION_PASSED}</li>
 *   <li>{@link #SUBMITTED}</li>
 *   <li>{@link #LEARNED}, possibly ticks later</li>
 * </ol>
 */
@Component
public class StrikeFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(StrikeFlowLogger.class);

    public static final String ATTEMPT_STARTED   = "ATTEMPT_STARTED";
    public static final String PLAN_COMPUTED     = "PLAN_COMPUTED";
    public static final String TRUST_GATE_PASSED = "TRUST_GATE_PASSED";
    public static final String SIMULATION_PASSED = "SIMULATION_PASSED";
    public static final String SUBMITTED         = "SUBMITTED";
    public static final String LEARNED           = "LEARNED";

    public void stage(String stageName, String network, String attemptId) {
        TraceContextUtil.withMdc(attemptId, () ->
            log.debug("[StrikeFlow] stage={} network={} attemptId={}", stageName, network, attemptId)
        );
    }
}
