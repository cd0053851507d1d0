package com.omnigovernor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Externally derived hint produced fresh each tick.
 *
 * @param ticker   symbol extracted from the provider text, without the {@code $} prefix
 * @param strength comparative sentiment score of the text that produced it
 */
public record Signal(
    @JsonProperty("ticker")   String ticker,
    @JsonProperty("strength") double strength
) {}
