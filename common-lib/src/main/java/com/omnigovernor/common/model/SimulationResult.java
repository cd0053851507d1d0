package com.omnigovernor.common.model;

/**
 * Outcome of a dry-run call against current network state.
 * A revert is a value, not an error.
 */
public record SimulationResult(boolean ok, String revertReason) {

    public static SimulationResult passed() {
        return new SimulationResult(true, null);
    }

    public static SimulationResult reverted(String reason) {
        return new SimulationResult(false, reason);
    }
}
