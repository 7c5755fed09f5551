package io.conclave.core;

import io.conclave.core.agent.AgentRegistry;
import io.conclave.core.agent.InMemoryAgentRegistry;
import io.conclave.core.capability.ContextTransfer;
import io.conclave.core.compression.CompressionProvider;
import io.conclave.core.compression.GzipCompressionProvider;
import io.conclave.core.event.EventBus;
import io.conclave.core.execution.AgentExecutionEngine;
import io.conclave.core.execution.StubAgentExecutionEngine;
import io.conclave.core.handoff.ContextHandoffManager;
import io.conclave.core.handoff.ContextSerializer;
import io.conclave.core.handoff.HandoffContextTransfer;
import io.conclave.core.handoff.HandoffRepository;
import io.conclave.core.handoff.InMemoryHandoffRepository;
import io.conclave.core.handshake.HandshakeMediator;
import io.conclave.core.handshake.HandshakeSettings;
import io.conclave.core.routing.CompatibilityTable;
import io.conclave.core.routing.RoutingAgentInvoker;
import io.conclave.core.routing.RoutingWeights;
import io.conclave.core.routing.TaskRouter;
import io.conclave.core.voting.VotingEngine;
import java.util.Iterator;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating fully-wired {@link ConclaveEnvironment} instances.
///
/// Every component of an environment shares one {@link AgentRegistry} and one
/// {@link EventBus}. The handoff manager is exposed to the router's invoker and to the
/// handshake mediator through a single {@link ContextTransfer}.
///
/// ### Usage
/// {@snippet :
/// ConclaveEnvironment env = ConclaveFactory.builder()
///     .config(ConclaveConfig.builder().maxIterations(50).build())
///     .executionEngine(engine)
///     .build();
/// }
///
/// @implNote Without an explicit {@link ContextSerializer} the factory looks one up through
/// {@link ServiceLoader}. The `conclave-serialization` module registers a JSON implementation.
///
/// @see ConclaveEnvironment
public final class ConclaveFactory {

    private static final Logger logger = Logger.getLogger(ConclaveFactory.class.getName());

    private ConclaveFactory() {}

    /// Creates an environment with default configuration.
    ///
    /// @return new environment, never null
    /// @throws IllegalStateException if no {@link ContextSerializer} is on the classpath
    public static ConclaveEnvironment createEnvironment() {
        return builder().build();
    }

    /// Creates an environment with the given configuration.
    ///
    /// @param config configuration, not null
    /// @return new environment, never null
    /// @throws IllegalStateException if no {@link ContextSerializer} is on the classpath
    public static ConclaveEnvironment createEnvironment(ConclaveConfig config) {
        return builder().config(config).build();
    }

    /// Finds the first {@link ContextSerializer} registered via `META-INF/services`.
    ///
    /// @return discovered serializer, never null
    /// @throws IllegalStateException if none is registered
    public static ContextSerializer discoverContextSerializer() {
        Iterator<ContextSerializer> found =
                ServiceLoader.load(ContextSerializer.class).iterator();
        if (!found.hasNext()) {
            throw new IllegalStateException(
                    "No ContextSerializer found. Add conclave-serialization to the classpath"
                            + " or pass one to ConclaveFactory.Builder#contextSerializer");
        }
        ContextSerializer serializer = found.next();
        logger.fine("Using context serializer: " + serializer.getClass().getName());
        return serializer;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ConclaveEnvironment}.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration before
    /// calling {@link #build()}.
    public static class Builder {
        private ConclaveConfig config = new ConclaveConfig();
        private ContextSerializer contextSerializer;
        private CompressionProvider compressionProvider;
        private AgentExecutionEngine executionEngine;
        private HandoffRepository handoffRepository;
        private CompatibilityTable compatibilityTable;
        private ExecutorService executorService;

        public Builder config(ConclaveConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the context codec, skipping {@link ServiceLoader} discovery.
        public Builder contextSerializer(ContextSerializer contextSerializer) {
            this.contextSerializer = contextSerializer;
            return this;
        }

        public Builder compressionProvider(CompressionProvider compressionProvider) {
            this.compressionProvider = compressionProvider;
            return this;
        }

        /// Sets the collaborator that performs routed tasks.
        ///
        /// @param executionEngine execution engine, may be null for a
        ///     {@link StubAgentExecutionEngine}
        /// @return this builder for chaining, never null
        public Builder executionEngine(AgentExecutionEngine executionEngine) {
            this.executionEngine = executionEngine;
            return this;
        }

        public Builder handoffRepository(HandoffRepository handoffRepository) {
            this.handoffRepository = handoffRepository;
            return this;
        }

        public Builder compatibilityTable(CompatibilityTable compatibilityTable) {
            this.compatibilityTable = compatibilityTable;
            return this;
        }

        /// Sets a custom thread pool for async events and async workflow execution.
        ///
        /// @param executorService the thread pool, may be null for an auto-created pool
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Builds the environment.
        ///
        /// @apiNote **Side effects**:
        /// - Creates a fixed thread pool if none was provided
        /// - Looks up a {@link ContextSerializer} if none was provided
        ///
        /// @return the configured environment, never null
        /// @throws IllegalStateException if no serializer can be found
        /// @throws IllegalArgumentException if a configured value is out of range
        public ConclaveEnvironment build() {
            if (contextSerializer == null) {
                contextSerializer = discoverContextSerializer();
            }
            if (compressionProvider == null) {
                compressionProvider = new GzipCompressionProvider(config.getCompressionLevel());
            }
            if (executionEngine == null) {
                executionEngine = new StubAgentExecutionEngine();
            }
            if (handoffRepository == null) {
                handoffRepository = new InMemoryHandoffRepository();
            }
            if (compatibilityTable == null) {
                compatibilityTable = CompatibilityTable.defaults();
            }
            if (executorService == null) {
                executorService = Executors.newFixedThreadPool(config.getThreadPoolSize());
            }

            EventBus eventBus =
                    config.isAsyncEvents() ? new EventBus(executorService) : new EventBus();
            AgentRegistry registry = new InMemoryAgentRegistry(eventBus);
            TaskRouter router =
                    new TaskRouter(
                            registry,
                            eventBus,
                            new RoutingWeights(
                                    config.getExpertiseWeight(),
                                    config.getCapacityWeight(),
                                    config.getPriorityWeight()),
                            compatibilityTable,
                            config.getRoutingHistoryLimit());
            VotingEngine votingEngine =
                    new VotingEngine(registry, eventBus, config.getSupermajorityThreshold());
            ContextHandoffManager handoffManager =
                    new ContextHandoffManager(
                            eventBus, compressionProvider, contextSerializer, handoffRepository);
            ContextTransfer transfer = new HandoffContextTransfer(handoffManager);
            HandshakeMediator mediator =
                    new HandshakeMediator(
                            eventBus,
                            new HandshakeSettings(
                                    config.getProtocolVersion(),
                                    config.isHandshakeEnabled(),
                                    config.isStateSyncEnabled(),
                                    config.isTaskNegotiationEnabled(),
                                    config.getMaxActiveHandshakes()),
                            transfer);
            RoutingAgentInvoker invoker =
                    new RoutingAgentInvoker(
                            router, registry, executionEngine, compatibilityTable, transfer);

            logger.fine(
                    "Created coordination environment (asyncEvents="
                            + config.isAsyncEvents()
                            + ", threadPoolSize="
                            + config.getThreadPoolSize()
                            + ")");
            return new ConclaveEnvironment(
                    config,
                    eventBus,
                    registry,
                    router,
                    votingEngine,
                    handoffManager,
                    transfer,
                    mediator,
                    executionEngine,
                    invoker,
                    executorService);
        }
    }
}
