package io.conclave.core.agent;

/// Urgency of a task. Higher priorities prefer less utilized agents more strongly.
public enum TaskPriority {
    LOW(0.0),
    MEDIUM(0.5),
    HIGH(1.0);

    private final double loadSensitivity;

    TaskPriority(double loadSensitivity) {
        this.loadSensitivity = loadSensitivity;
    }

    /// Returns how strongly agent utilization counts against a candidate, in [0, 1].
    public double loadSensitivity() {
        return loadSensitivity;
    }
}
