package io.conclave.core.routing;

import java.time.Instant;

/// Historical entry recorded for every routed task.
public record RoutingDecision(
        String taskId,
        String taskType,
        String agentId,
        double confidence,
        boolean degraded,
        Instant routedAt) {}
