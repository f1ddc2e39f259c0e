package com.openforge.streamkit.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token usage of one sampling iteration.
 *
 * kind is "compaction" or "message" today; other values are passed through.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageIteration(
        @JsonProperty("type")          String kind,
        @JsonProperty("input_tokens")  long   inputTokens,
        @JsonProperty("output_tokens") long   outputTokens
) {}
