package io.conclave.core;

import io.conclave.core.agent.AgentRegistry;
import io.conclave.core.capability.AgentInvoker;
import io.conclave.core.capability.ContextTransfer;
import io.conclave.core.event.EventBus;
import io.conclave.core.execution.AgentExecutionEngine;
import io.conclave.core.handoff.ContextHandoffManager;
import io.conclave.core.handshake.HandshakeMediator;
import io.conclave.core.routing.TaskRouter;
import io.conclave.core.voting.VotingEngine;
import io.conclave.core.workflow.WorkflowDefinition;
import io.conclave.core.workflow.WorkflowOrchestrator;
import java.util.concurrent.ExecutorService;

/// Container holding the coordination components that share one agent registry and one
/// event bus.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Invariant**: The router, voting engine and invoker all read the same registry
///
/// @implNote Fields are final and set at construction time. The contained components carry
/// their own thread-safety guarantees.
///
/// @apiNote Create instances via {@link ConclaveFactory#createEnvironment()} or
/// {@link ConclaveFactory.Builder} rather than direct construction.
///
/// @see ConclaveFactory
public final class ConclaveEnvironment implements AutoCloseable {

    private final ConclaveConfig config;
    private final EventBus eventBus;
    private final AgentRegistry agentRegistry;
    private final TaskRouter taskRouter;
    private final VotingEngine votingEngine;
    private final ContextHandoffManager handoffManager;
    private final ContextTransfer contextTransfer;
    private final HandshakeMediator handshakeMediator;
    private final AgentExecutionEngine executionEngine;
    private final AgentInvoker agentInvoker;
    private final ExecutorService executorService;

    public ConclaveEnvironment(
            ConclaveConfig config,
            EventBus eventBus,
            AgentRegistry agentRegistry,
            TaskRouter taskRouter,
            VotingEngine votingEngine,
            ContextHandoffManager handoffManager,
            ContextTransfer contextTransfer,
            HandshakeMediator handshakeMediator,
            AgentExecutionEngine executionEngine,
            AgentInvoker agentInvoker,
            ExecutorService executorService) {
        this.config = config;
        this.eventBus = eventBus;
        this.agentRegistry = agentRegistry;
        this.taskRouter = taskRouter;
        this.votingEngine = votingEngine;
        this.handoffManager = handoffManager;
        this.contextTransfer = contextTransfer;
        this.handshakeMediator = handshakeMediator;
        this.executionEngine = executionEngine;
        this.agentInvoker = agentInvoker;
        this.executorService = executorService;
    }

    /// Creates an empty orchestrator wired to this environment's bus and invoker.
    ///
    /// @param initialNodeId id of the node execution starts from, not null
    /// @return new orchestrator, never null
    public WorkflowOrchestrator newOrchestrator(String initialNodeId) {
        return orchestratorBuilder(initialNodeId).build();
    }

    /// Creates an orchestrator loaded with every node and edge of a definition.
    ///
    /// @param definition workflow definition, not null
    /// @return new orchestrator, never null
    public WorkflowOrchestrator newOrchestrator(WorkflowDefinition definition) {
        WorkflowOrchestrator orchestrator = newOrchestrator(definition.initialNodeId());
        orchestrator.load(definition);
        return orchestrator;
    }

    /// Returns a builder pre-wired with this environment's components.
    ///
    /// Callers can still override the decision evaluator, listener or process steps.
    public WorkflowOrchestrator.Builder orchestratorBuilder(String initialNodeId) {
        return WorkflowOrchestrator.builder()
                .initialNodeId(initialNodeId)
                .eventBus(eventBus)
                .agentInvoker(agentInvoker)
                .maxIterations(config.getMaxIterations());
    }

    public ConclaveConfig getConfig() {
        return config;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public AgentRegistry getAgentRegistry() {
        return agentRegistry;
    }

    public TaskRouter getTaskRouter() {
        return taskRouter;
    }

    public VotingEngine getVotingEngine() {
        return votingEngine;
    }

    public ContextHandoffManager getHandoffManager() {
        return handoffManager;
    }

    /// Returns the handoff-backed transfer used by the invoker and the mediator.
    public ContextTransfer getContextTransfer() {
        return contextTransfer;
    }

    public HandshakeMediator getHandshakeMediator() {
        return handshakeMediator;
    }

    public AgentExecutionEngine getExecutionEngine() {
        return executionEngine;
    }

    public AgentInvoker getAgentInvoker() {
        return agentInvoker;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Shuts down the underlying executor service.
    ///
    /// @apiNote **Side effects**:
    /// - Previously submitted tasks continue to execute
    /// - No new tasks are accepted after this call
    @Override
    public void close() {
        executorService.shutdown();
    }
}
