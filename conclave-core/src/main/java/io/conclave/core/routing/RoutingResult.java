package io.conclave.core.routing;

import io.conclave.core.agent.Agent;
import java.util.Objects;

/// Outcome of routing one task.
///
/// @param agent selected agent as it was when selected, not null
/// @param confidence selection quality in [0.3, 1.0]; exactly
///     {@link TaskRouter#DEGRADED_CONFIDENCE}
///     when every candidate was at or over capacity
/// @param degraded whether the selection fell back to the least overloaded agent
/// @param reasoning short human-readable explanation, never null
public record RoutingResult(Agent agent, double confidence, boolean degraded, String reasoning) {

    public RoutingResult {
        Objects.requireNonNull(agent, "agent must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        reasoning = reasoning != null ? reasoning : "";
    }

    public String agentId() {
        return agent.id();
    }
}
