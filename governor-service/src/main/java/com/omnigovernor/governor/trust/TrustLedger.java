package com.omnigovernor.governor.trust;

import com.omnigovernor.common.trust.TrustUpdateRule;
import com.omnigovernor.governor.config.GovernorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learned reliability weight per signal source, in [0.1, 0.99].
 *
 * <p>The map is never exposed for mutation. {@link #update} is globally serialized:
 * read-modify-write and the durable rewrite happen under one lock, so concurrent outcome
 * reports never lose an update. {@link #get} is lock-free and may observe a value that an
 * in-flight update is about to replace.
 */
@Component
public class TrustLedger {

    private static final Logger log = LoggerFactory.getLogger(TrustLedger.class);

    private final TrustStore store;
    private final ConcurrentHashMap<String, Double> scores = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public TrustLedger(TrustStore store, GovernorProperties properties) {
        this.store = store;
        Map<String, Double> initial = store.read()
            .filter(m -> !m.isEmpty())
            .orElse(properties.trust().seed());
        initial.forEach((source, score) -> {
            if (source != null && score != null) {
                scores.put(source, TrustUpdateRule.clamp(score));
            }
        });
        log.info("Trust ledger loaded. sources={}", new TreeMap<>(scores));
    }

    /** Stored score, or {@link TrustUpdateRule#DEFAULT_SCORE} for an unseen source. */
    public double get(String source) {
        return scores.getOrDefault(source, TrustUpdateRule.DEFAULT_SCORE);
    }

    /**
     * Applies one outcome and persists the full map before returning.
     *
     * <p>A persistence failure is logged; the in-memory score still advances.
     *
     * @return the new score
     */
    public double update(String source, boolean success) {
        synchronized (writeLock) {
            double previous = get(source);
            double next     = TrustUpdateRule.apply(previous, success);
            scores.put(source, next);
            try {
                store.write(new TreeMap<>(scores));
            } catch (UncheckedIOException e) {
                log.error("Trust persistence failed. source={} score={}", source, next, e);
            }
            log.info("TRUST_UPDATED source={} success={} previous={} next={}",
                     source, success, String.format("%.4f", previous), String.format("%.4f", next));
            return next;
        }
    }

    /** Read-only copy for diagnostics. */
    public Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(scores));
    }
}
