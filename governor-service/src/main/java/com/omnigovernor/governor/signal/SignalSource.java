package com.omnigovernor.governor.signal;

import com.omnigovernor.common.model.Signal;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Produces the signals for one tick.
 *
 * <p>Implementations never fail as a whole: a provider that errors contributes nothing,
 * and no qualifying text yields an empty list.
 */
public interface SignalSource {

    Mono<List<Signal>> collect();
}
