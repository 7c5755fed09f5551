package io.conclave.core.routing;

import java.util.List;

/// Snapshot of load across the registered agents.
///
/// @param totalAgents number of registered agents
/// @param averageUtilization mean of `workload / capacity`, 0 when no agents exist
/// @param overloaded ids of agents above {@link TaskRouter#OVERLOAD_THRESHOLD}
/// @param underutilized ids of agents below {@link TaskRouter#UNDERUTILIZED_THRESHOLD}
public record LoadReport(
        int totalAgents,
        double averageUtilization,
        List<String> overloaded,
        List<String> underutilized) {

    public LoadReport {
        overloaded = List.copyOf(overloaded);
        underutilized = List.copyOf(underutilized);
    }
}
