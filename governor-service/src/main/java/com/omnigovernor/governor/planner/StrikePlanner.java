package com.omnigovernor.governor.planner;

import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.model.StrikePlan;
import com.omnigovernor.common.network.NetworkGateway;
import com.omnigovernor.common.sizing.StrikeSizingEngine;
import com.omnigovernor.common.unit.Units;
import com.omnigovernor.governor.registry.NetworkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Sizes a strike from the session's live balance and fee conditions.
 *
 * <p>Balance and fee data are read concurrently. Insufficient headroom and any read failure
 * both complete empty: planning problems skip the network for this tick and never propagate.
 */
@Component
public class StrikePlanner {

    private static final Logger log = LoggerFactory.getLogger(StrikePlanner.class);

    /**
     * @return the plan, or empty when the session is unarmed, headroom is insufficient,
     *         or the network could not be read
     */
    public Mono<StrikePlan> plan(NetworkSession session) {
        if (!session.isArmed()) {
            return Mono.empty();
        }
        NetworkConfig config   = session.config();
        NetworkGateway gateway = session.gateway();

        return Mono.zip(gateway.getBalance(session.signerAddress()), gateway.getFeeData())
            .flatMap(state -> {
                Optional<StrikePlan> plan = StrikeSizingEngine.compute(state.getT1(), state.getT2(), config);
                if (plan.isEmpty()) {
                    log.debug("[{}] SKIP: Needs +{} ETH", config.name(),
                              Units.formatEther(StrikeSizingEngine.shortfall(state.getT1(), state.getT2(), config)));
                }
                return Mono.justOrEmpty(plan);
            })
            .onErrorResume(e -> {
                log.debug("[{}] Planning read failed; skipping this tick. reason={}", config.name(), e.getMessage());
                return Mono.empty();
            });
    }
}
