package com.omnigovernor.governor.scheduler;

import com.omnigovernor.common.model.Signal;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans a tick's signals out over the configured networks.
 *
 * <ul>
 *   <li>signals present → one task per (network, signal), tagged {@link #WEB_SOURCE}</li>
 *   <li>no signals      → one task per network, ticker and tag {@link #DISCOVERY_SOURCE}</li>
 * </ul>
 *
 * Fallback attempts are scored under their own trust bucket.
 */
public final class TickDispatchStrategy {

    public static final String WEB_SOURCE       = "WEB_AI";
    public static final String DISCOVERY_SOURCE = "DISCOVERY";

    private TickDispatchStrategy() {}

    public static List<StrikeTask> plan(List<String> networks, List<Signal> signals) {
        List<StrikeTask> tasks = new ArrayList<>();
        for (String network : networks) {
            if (signals.isEmpty()) {
                tasks.add(new StrikeTask(network, DISCOVERY_SOURCE, DISCOVERY_SOURCE));
                continue;
            }
            for (Signal signal : signals) {
                tasks.add(new StrikeTask(network, signal.ticker(), WEB_SOURCE));
            }
        }
        return tasks;
    }
}
