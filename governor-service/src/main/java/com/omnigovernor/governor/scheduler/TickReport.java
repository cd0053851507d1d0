package com.omnigovernor.governor.scheduler;

import com.omnigovernor.governor.execution.AttemptResult;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Settled results of one tick, index-aligned with {@code tasks}.
 */
public record TickReport(int signalCount, List<StrikeTask> tasks, List<AttemptResult> results) {

    public Map<AttemptResult, Long> countsByResult() {
        return results.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }
}
