package com.omnigovernor.common.trace;

import org.slf4j.MDC;

/**
 * Bridges a strike attempt's id into MDC for the duration of a single log statement.
 *
 * <p>Attempt pipelines run on whichever Reactor thread emits, so MDC is never left set
 * between statements.
 */
public final class TraceContextUtil {

    public static final String ATTEMPT_ID_KEY = "attemptId";

    private TraceContextUtil() {}

    public static void withMdc(String attemptId, Runnable logAction) {
        MDC.put(ATTEMPT_ID_KEY, attemptId);
        try {
            logAction.run();
        } finally {
            MDC.remove(ATTEMPT_ID_KEY);
        }
    }
}
