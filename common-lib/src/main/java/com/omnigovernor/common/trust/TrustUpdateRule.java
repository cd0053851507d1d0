package com.omnigovernor.common.trust;

/**
 * Exponential trust learning rule.
 *
 * <pre>
 *   success → min(0.99, score * 1.05)
 *   failure → max(0.10, score * 0.90)
 * </pre>
 *
 * Scores never leave [{@link #FLOOR}, {@link #CEILING}].
 */
public final class TrustUpdateRule {

    public static final double FLOOR         = 0.1;
    public static final double CEILING       = 0.99;
    public static final double DEFAULT_SCORE = 0.5;
    /** Sources scoring at or below this value never trigger execution. */
    public static final double GATE_THRESHOLD = 0.4;

    private static final double REWARD  = 1.05;
    private static final double PENALTY = 0.90;

    private TrustUpdateRule() {}

    public static double apply(double current, boolean success) {
        return success
            ? Math.min(CEILING, current * REWARD)
            : Math.max(FLOOR, current * PENALTY);
    }

    /** Brings persisted or seeded values into range; non-finite values fall back to the default. */
    public static double clamp(double value) {
        if (!Double.isFinite(value)) return DEFAULT_SCORE;
        return Math.max(FLOOR, Math.min(CEILING, value));
    }

    public static boolean passesGate(double score) {
        return score > GATE_THRESHOLD;
    }
}
