package io.conclave.core.routing;

/// Relative weights of the three routing signals.
///
/// Weights are normalized by their sum, so only their ratio matters.
///
/// @param expertise weight of the expertise match, >= 0
/// @param capacity weight of the spare capacity ratio, >= 0
/// @param priority weight of the priority alignment, >= 0
public record RoutingWeights(double expertise, double capacity, double priority) {

    public static final RoutingWeights DEFAULT = new RoutingWeights(0.5, 0.3, 0.2);

    public RoutingWeights {
        if (expertise < 0 || capacity < 0 || priority < 0) {
            throw new IllegalArgumentException("Routing weights must be >= 0");
        }
        if (expertise + capacity + priority <= 0) {
            throw new IllegalArgumentException("At least one routing weight must be positive");
        }
    }

    double total() {
        return expertise + capacity + priority;
    }
}
