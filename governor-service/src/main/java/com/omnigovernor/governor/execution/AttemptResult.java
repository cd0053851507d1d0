package com.omnigovernor.governor.execution;

/**
 * Which gate ended a strike attempt.
 *
 * <ul>
 *   <li>{@link #NO_SESSION}: network unavailable or read-only.</li>
 *   <li>{@link #NO_PLAN}: insufficient headroom or unreadable network state.</li>
 *   <li>{@link #TRUST_REJECTED}: source trust at or below the gate threshold.</li>
 *   <li>{@link #SIMULATION_REVERTED}: dry run failed; nothing left the process.</li>
 *   <li>{@link #INSUFFICIENT_FUNDS}: submission raced a stale plan.</li>
 *   <li>{@link #SUBMISSION_FAILED}: any other submission failure.</li>
 *   <li>{@link #SUBMITTED}: broadcast; learning continues asynchronously.</li>
 *   <li>{@link #ERRORED}: unexpected failure absorbed by the scheduler.</li>
 * </ul>
 *
 * Only {@link #SUBMITTED} ever leads to a trust update.
 */
public enum AttemptResult {
    NO_SESSION,
    NO_PLAN,
    TRUST_REJECTED,
    SIMULATION_REVERTED,
    INSUFFICIENT_FUNDS,
    SUBMISSION_FAILED,
    SUBMITTED,
    ERRORED
}
