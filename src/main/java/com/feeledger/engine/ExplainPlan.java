package com.feeledger.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * How a result was reached: which components ran in which order and why the
 * others were dropped.
 *
 * @param discarded           component id to discard reason, in evaluation order
 * @param lineCoverage        component id to the number of lines it was allocated over
 */
public record ExplainPlan(
    @JsonProperty("evaluation_order") List<String> evaluationOrder,
    @JsonProperty("eligible_count") int eligibleCount,
    @JsonProperty("discarded") Map<String, String> discarded,
    @JsonProperty("cap_targeting") boolean capTargeting,
    @JsonProperty("component_line_coverage") Map<String, Integer> lineCoverage
) {
}
