package com.omnigovernor.governor.scheduler;

import com.omnigovernor.governor.execution.AttemptResult;

import java.time.Instant;

/**
 * Mutable loop progress, written by {@link StrikeScheduler} and read by the liveness endpoint.
 *
 * <p>Only the scheduling chain writes, one tick at a time, so volatile visibility suffices.
 */
public class LoopState {

    public enum Status { IDLE, RUNNING, HALTED }

    private volatile Status  status            = Status.IDLE;
    private volatile long    ticksCompleted;
    private volatile long    attemptsDispatched;
    private volatile long    attemptsSubmitted;
    private volatile Instant lastTickAt;
    private volatile String  haltReason;

    public void start() { this.status = Status.RUNNING; }

    public void halt(String reason) {
        this.haltReason = reason;
        this.status     = Status.HALTED;
    }

    public void recordTick(TickReport report) {
        this.ticksCompleted++;
        this.attemptsDispatched += report.tasks().size();
        this.attemptsSubmitted  += report.countsByResult()
            .getOrDefault(AttemptResult.SUBMITTED, 0L);
        this.lastTickAt = Instant.now();
    }

    public Status  getStatus()             { return status; }
    public long    getTicksCompleted()     { return ticksCompleted; }
    public long    getAttemptsDispatched() { return attemptsDispatched; }
    public long    getAttemptsSubmitted()  { return attemptsSubmitted; }
    public Instant getLastTickAt()         { return lastTickAt; }
    public String  getHaltReason()         { return haltReason; }
}
