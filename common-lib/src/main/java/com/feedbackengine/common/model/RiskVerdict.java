package com.feedbackengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of the risk pipeline. Always returned, never thrown.
 *
 * @param triggeredRule rule that denied the decision; {@code null} when allowed
 * @param warnings      non-blocking notes (e.g. weekend low liquidity)
 * @param correlationFactor size multiplier in [0.5, 1.0] from the correlation step
 */
public record RiskVerdict(
    @JsonProperty("allow")             boolean allow,
    @JsonProperty("reason")            String reason,
    @JsonProperty("triggeredRule")     RiskRule triggeredRule,
    @JsonProperty("warnings")          List<String> warnings,
    @JsonProperty("correlationFactor") double correlationFactor
) {

    public RiskVerdict {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RiskVerdict allow(String reason, List<String> warnings, double correlationFactor) {
        return new RiskVerdict(true, reason, null, warnings, correlationFactor);
    }

    public static RiskVerdict deny(RiskRule rule, String reason, List<String> warnings) {
        return new RiskVerdict(false, reason, rule, warnings, 1.0);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
