package com.omnigovernor.governor.scheduler;

/**
 * One scheduled attempt within a tick.
 */
public record StrikeTask(String network, String ticker, String source) {}
