package io.conclave.core;

import java.util.Properties;

/// Configuration options for a coordination environment.
///
/// Use the {@link Builder} for fluent configuration, the setters for mutable configuration,
/// or {@link #fromProperties(Properties)} to read `conclave.*` keys.
///
/// ### Default Values
/// | Property key                                  | Default |
/// |-----------------------------------------------|---------|
/// | `conclave.workflow.max-iterations`            | `100`   |
/// | `conclave.routing.expertise-weight`           | `0.5`   |
/// | `conclave.routing.capacity-weight`            | `0.3`   |
/// | `conclave.routing.priority-weight`            | `0.2`   |
/// | `conclave.routing.history-limit`              | `100`   |
/// | `conclave.voting.supermajority-threshold`     | `0.6`   |
/// | `conclave.handshake.protocol-version`         | `1.0`   |
/// | `conclave.handshake.enabled`                  | `true`  |
/// | `conclave.handshake.state-sync-enabled`       | `true`  |
/// | `conclave.handshake.task-negotiation-enabled` | `true`  |
/// | `conclave.handshake.max-active`               | `10`    |
/// | `conclave.handoff.compression-level`          | `6`     |
/// | `conclave.events.async`                       | `false` |
/// | `conclave.thread-pool-size`                   | `4`     |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link ConclaveFactory} and
/// do not modify afterwards.
///
/// @see ConclaveFactory#createEnvironment(ConclaveConfig)
public class ConclaveConfig {

    public static final String PREFIX = "conclave.";

    private int maxIterations = 100;
    private double expertiseWeight = 0.5;
    private double capacityWeight = 0.3;
    private double priorityWeight = 0.2;
    private int routingHistoryLimit = 100;
    private double supermajorityThreshold = 0.6;
    private String protocolVersion = "1.0";
    private boolean handshakeEnabled = true;
    private boolean stateSyncEnabled = true;
    private boolean taskNegotiationEnabled = true;
    private int maxActiveHandshakes = 10;
    private int compressionLevel = 6;
    private boolean asyncEvents = false;
    private int threadPoolSize = 4;

    /// Creates a configuration with default values.
    public ConclaveConfig() {}

    /// Reads a configuration from properties, keeping defaults for missing keys.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static ConclaveConfig fromProperties(Properties properties) {
        ConclaveConfig config = new ConclaveConfig();
        config.maxIterations =
                intValue(properties, "workflow.max-iterations", config.maxIterations);
        config.expertiseWeight =
                doubleValue(properties, "routing.expertise-weight", config.expertiseWeight);
        config.capacityWeight =
                doubleValue(properties, "routing.capacity-weight", config.capacityWeight);
        config.priorityWeight =
                doubleValue(properties, "routing.priority-weight", config.priorityWeight);
        config.routingHistoryLimit =
                intValue(properties, "routing.history-limit", config.routingHistoryLimit);
        config.supermajorityThreshold =
                doubleValue(
                        properties,
                        "voting.supermajority-threshold",
                        config.supermajorityThreshold);
        config.protocolVersion =
                properties.getProperty(
                        PREFIX + "handshake.protocol-version", config.protocolVersion);
        config.handshakeEnabled =
                booleanValue(properties, "handshake.enabled", config.handshakeEnabled);
        config.stateSyncEnabled =
                booleanValue(properties, "handshake.state-sync-enabled", config.stateSyncEnabled);
        config.taskNegotiationEnabled =
                booleanValue(
                        properties,
                        "handshake.task-negotiation-enabled",
                        config.taskNegotiationEnabled);
        config.maxActiveHandshakes =
                intValue(properties, "handshake.max-active", config.maxActiveHandshakes);
        config.compressionLevel =
                intValue(properties, "handoff.compression-level", config.compressionLevel);
        config.asyncEvents = booleanValue(properties, "events.async", config.asyncEvents);
        config.threadPoolSize = intValue(properties, "thread-pool-size", config.threadPoolSize);
        return config;
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(PREFIX + key);
        return value == null ? fallback : Boolean.parseBoolean(value.trim());
    }

    /// Returns the cap on node visits per workflow execution.
    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getExpertiseWeight() {
        return expertiseWeight;
    }

    public void setExpertiseWeight(double expertiseWeight) {
        this.expertiseWeight = expertiseWeight;
    }

    public double getCapacityWeight() {
        return capacityWeight;
    }

    public void setCapacityWeight(double capacityWeight) {
        this.capacityWeight = capacityWeight;
    }

    public double getPriorityWeight() {
        return priorityWeight;
    }

    public void setPriorityWeight(double priorityWeight) {
        this.priorityWeight = priorityWeight;
    }

    public int getRoutingHistoryLimit() {
        return routingHistoryLimit;
    }

    public void setRoutingHistoryLimit(int routingHistoryLimit) {
        this.routingHistoryLimit = routingHistoryLimit;
    }

    /// Returns the leading share a supermajority close requires when the caller passes none.
    public double getSupermajorityThreshold() {
        return supermajorityThreshold;
    }

    public void setSupermajorityThreshold(double supermajorityThreshold) {
        this.supermajorityThreshold = supermajorityThreshold;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public void setProtocolVersion(String protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    public boolean isHandshakeEnabled() {
        return handshakeEnabled;
    }

    public void setHandshakeEnabled(boolean handshakeEnabled) {
        this.handshakeEnabled = handshakeEnabled;
    }

    public boolean isStateSyncEnabled() {
        return stateSyncEnabled;
    }

    public void setStateSyncEnabled(boolean stateSyncEnabled) {
        this.stateSyncEnabled = stateSyncEnabled;
    }

    public boolean isTaskNegotiationEnabled() {
        return taskNegotiationEnabled;
    }

    public void setTaskNegotiationEnabled(boolean taskNegotiationEnabled) {
        this.taskNegotiationEnabled = taskNegotiationEnabled;
    }

    public int getMaxActiveHandshakes() {
        return maxActiveHandshakes;
    }

    public void setMaxActiveHandshakes(int maxActiveHandshakes) {
        this.maxActiveHandshakes = maxActiveHandshakes;
    }

    /// Returns the GZIP deflate level, 1 to 9.
    public int getCompressionLevel() {
        return compressionLevel;
    }

    public void setCompressionLevel(int compressionLevel) {
        this.compressionLevel = compressionLevel;
    }

    /// Returns whether the event bus delivers on the environment's thread pool.
    public boolean isAsyncEvents() {
        return asyncEvents;
    }

    public void setAsyncEvents(boolean asyncEvents) {
        this.asyncEvents = asyncEvents;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ConclaveConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final ConclaveConfig config = new ConclaveConfig();

        public Builder maxIterations(int maxIterations) {
            config.maxIterations = maxIterations;
            return this;
        }

        public Builder routingWeights(double expertise, double capacity, double priority) {
            config.expertiseWeight = expertise;
            config.capacityWeight = capacity;
            config.priorityWeight = priority;
            return this;
        }

        public Builder routingHistoryLimit(int routingHistoryLimit) {
            config.routingHistoryLimit = routingHistoryLimit;
            return this;
        }

        public Builder supermajorityThreshold(double supermajorityThreshold) {
            config.supermajorityThreshold = supermajorityThreshold;
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            config.protocolVersion = protocolVersion;
            return this;
        }

        public Builder handshakeEnabled(boolean handshakeEnabled) {
            config.handshakeEnabled = handshakeEnabled;
            return this;
        }

        public Builder stateSyncEnabled(boolean stateSyncEnabled) {
            config.stateSyncEnabled = stateSyncEnabled;
            return this;
        }

        public Builder taskNegotiationEnabled(boolean taskNegotiationEnabled) {
            config.taskNegotiationEnabled = taskNegotiationEnabled;
            return this;
        }

        public Builder maxActiveHandshakes(int maxActiveHandshakes) {
            config.maxActiveHandshakes = maxActiveHandshakes;
            return this;
        }

        public Builder compressionLevel(int compressionLevel) {
            config.compressionLevel = compressionLevel;
            return this;
        }

        public Builder asyncEvents(boolean asyncEvents) {
            config.asyncEvents = asyncEvents;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        /// Returns the configured instance.
        ///
        /// @return configuration, never null
        public ConclaveConfig build() {
            return config;
        }
    }
}
