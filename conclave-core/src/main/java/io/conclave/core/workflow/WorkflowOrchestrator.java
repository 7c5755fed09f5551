package io.conclave.core.workflow;

import io.conclave.core.capability.AgentInvoker;
import io.conclave.core.capability.DecisionEvaluator;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.CoordinationError;
import io.conclave.core.exception.CoordinationException;
import io.conclave.core.exception.ValidationException;
import io.conclave.core.workflow.node.WorkflowNode;
import io.conclave.core.workflow.processor.DefaultNodeProcessorRegistry;
import io.conclave.core.workflow.processor.NodeContext;
import io.conclave.core.workflow.processor.NodeOutput;
import io.conclave.core.workflow.processor.NodeProcessor;
import io.conclave.core.workflow.processor.NodeProcessorRegistry;
import io.conclave.core.workflow.processor.ProcessStep;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Executes a directed graph of workflow nodes as a sequential state machine.
///
/// ### Execution Loop
/// ```
/// current = initialNodeId
/// loop:
///   process current node by kind, merge output into context
///   append current to executionPath
///   no outbound edges -> success
///   otherwise follow the first outbound edge in insertion order
/// ```
///
/// Decision nodes compute an outcome (stored under `decision`) but do not branch on it:
/// like every other node, they continue along their first outbound edge.
///
/// ### Failure Handling
/// - Missing initial node: {@link ValidationException} thrown before anything runs
/// - Every other failure (processor error, unknown node type, dangling edge, iteration cap
///   `MaxIterationsExceeded`, cancellation) is captured into a failed {@link WorkflowResult}
///
/// The orchestrator keeps no state between executions beyond the graph itself. Each
/// execution works on a snapshot of the graph taken when it starts, so concurrent
/// {@link #addNode}/{@link #addEdge} calls never affect a running execution.
///
/// @implNote Thread-safe. Graph mutations are guarded by a monitor; executions own their
/// context and path.
///
/// @see NodeProcessorRegistry for per-kind processing
/// @see WorkflowListener for lifecycle callbacks
public class WorkflowOrchestrator {

    private static final Logger logger = Logger.getLogger(WorkflowOrchestrator.class.getName());
    private static final String SOURCE = "workflow-orchestrator";

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final String MAX_ITERATIONS_EXCEEDED = "MaxIterationsExceeded";
    public static final String CANCELLED = "Cancelled";

    private final String initialNodeId;
    private final EventBus eventBus;
    private final AgentInvoker agentInvoker;
    private final DecisionEvaluator decisionEvaluator;
    private final NodeProcessorRegistry processors;
    private final Map<String, ProcessStep> processSteps;
    private final int maxIterations;
    private final WorkflowListener listener;

    private final Object graphLock = new Object();
    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();

    private WorkflowOrchestrator(Builder builder) {
        this.initialNodeId = builder.initialNodeId;
        this.eventBus = builder.eventBus;
        this.agentInvoker = builder.agentInvoker;
        this.decisionEvaluator = builder.decisionEvaluator;
        this.processors = builder.processors;
        this.processSteps = Map.copyOf(builder.processSteps);
        this.maxIterations = builder.maxIterations;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Adds a node, replacing any node with the same id.
    ///
    /// @param node node to add, not null
    public void addNode(WorkflowNode node) {
        Objects.requireNonNull(node, "node must not be null");
        synchronized (graphLock) {
            if (nodes.put(node.id(), node) != null) {
                logger.warning("Node already exists: " + node.id() + ". Replacing...");
            }
        }
    }

    /// Adds an edge. Its endpoints are not checked until execution reaches it.
    ///
    /// @param edge edge to add, not null
    public void addEdge(GraphEdge edge) {
        Objects.requireNonNull(edge, "edge must not be null");
        synchronized (graphLock) {
            if (edges.put(edge.id(), edge) != null) {
                logger.warning("Edge already exists: " + edge.id() + ". Replacing...");
            }
        }
    }

    /// Adds every node and edge of a definition, in order.
    public void load(WorkflowDefinition definition) {
        definition.nodes().forEach(this::addNode);
        definition.edges().forEach(this::addEdge);
    }

    /// Returns the nodes in insertion order.
    public List<WorkflowNode> getNodes() {
        synchronized (graphLock) {
            return List.copyOf(nodes.values());
        }
    }

    /// Returns the edges in insertion order.
    public List<GraphEdge> getEdges() {
        synchronized (graphLock) {
            return List.copyOf(edges.values());
        }
    }

    /// Returns the edges leaving a node, in insertion order.
    ///
    /// @param nodeId source node id
    /// @return outbound edges, never null (may be empty)
    public List<GraphEdge> getOutboundEdges(String nodeId) {
        synchronized (graphLock) {
            return edges.values().stream().filter(e -> e.source().equals(nodeId)).toList();
        }
    }

    public String getInitialNodeId() {
        return initialNodeId;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /// Runs the workflow on the calling thread.
    ///
    /// @apiNote **Side effects**:
    /// - Publishes `workflow.started`, one `workflow.node.completed` per processed node, then
    ///   `workflow.completed` or `workflow.failed`
    /// - Invokes agent and decision capabilities for agent and decision nodes
    ///
    /// @param initialContext starting context, may be null for empty
    /// @return execution result, never null
    /// @throws ValidationException if the initial node does not exist
    public WorkflowResult executeWorkflow(Map<String, Object> initialContext) {
        Run run = start(initialContext, new AtomicBoolean(false));
        WorkflowResult result;
        do {
            result = run.step();
        } while (result == null);
        return result;
    }

    /// Runs the workflow on an executor, one node per task.
    ///
    /// Each node is processed in its own executor task, so the execution yields at every
    /// node boundary and can be cancelled there.
    ///
    /// @param initialContext starting context, may be null for empty
    /// @param executor executor running the node tasks, not null
    /// @return handle to the running execution, never null
    /// @throws ValidationException if the initial node does not exist
    public WorkflowExecution executeWorkflowAsync(
            Map<String, Object> initialContext, Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        Run run = start(initialContext, cancelRequested);
        CompletableFuture<WorkflowResult> future = new CompletableFuture<>();
        schedule(run, executor, future);
        return new WorkflowExecution(run.executionId, future, cancelRequested);
    }

    private void schedule(Run run, Executor executor, CompletableFuture<WorkflowResult> future) {
        try {
            executor.execute(
                    () -> {
                        try {
                            WorkflowResult result = run.step();
                            if (result != null) {
                                future.complete(result);
                            } else {
                                schedule(run, executor, future);
                            }
                        } catch (RuntimeException e) {
                            logger.log(
                                    Level.WARNING,
                                    "Workflow " + run.executionId + " aborted",
                                    e);
                            future.complete(
                                    run.finish(CoordinationError.internal(
                                            "Unexpected failure: " + e.getMessage())));
                        } catch (Error e) {
                            future.completeExceptionally(e);
                            throw e;
                        }
                    });
        } catch (RejectedExecutionException e) {
            future.complete(
                    run.finish(CoordinationError.internal("Executor rejected workflow step")));
        }
    }

    private Run start(Map<String, Object> initialContext, AtomicBoolean cancelRequested) {
        GraphSnapshot graph;
        synchronized (graphLock) {
            graph = GraphSnapshot.of(nodes, edges);
        }
        if (!graph.nodes().containsKey(initialNodeId)) {
            throw new ValidationException("Initial state node " + initialNodeId + " not found");
        }

        Run run = new Run(graph, initialContext, cancelRequested);
        logger.info("Starting workflow " + run.executionId + " at " + initialNodeId);
        notifyListener("onStart", () -> listener.onStart(run.executionId, initialNodeId));
        eventBus.publish(SOURCE, new EventPayload.WorkflowStarted(run.executionId, initialNodeId));
        return run;
    }

    @SuppressWarnings("unchecked")
    private <T extends WorkflowNode> NodeOutput process(T node, NodeContext context)
            throws Exception {
        Class<T> type = (Class<T>) node.getClass();
        NodeProcessor<T> processor =
                processors
                        .getProcessor(type)
                        .orElseThrow(
                                () ->
                                        new ValidationException(
                                                "Unknown node type: " + node.kind()
                                                        + " (node " + node.id() + ")"));
        return processor.process(node, context);
    }

    /// One execution's mutable state. Confined to one thread at a time.
    private final class Run {
        private final String executionId = "wf_" + UUID.randomUUID();
        private final GraphSnapshot graph;
        private final Map<String, Object> context;
        private final List<String> path = new ArrayList<>();
        private final AtomicBoolean cancelRequested;
        private String current = initialNodeId;
        private int iterations;
        private WorkflowResult result;

        private Run(
                GraphSnapshot graph,
                Map<String, Object> initialContext,
                AtomicBoolean cancelRequested) {
            this.graph = graph;
            this.context =
                    initialContext != null
                            ? new LinkedHashMap<>(initialContext)
                            : new LinkedHashMap<>();
            this.cancelRequested = cancelRequested;
        }

        /// Processes the current node.
        ///
        /// @return the final result once the execution ended, null while it continues
        private WorkflowResult step() {
            if (result != null) {
                return result;
            }
            if (cancelRequested.get()) {
                return finish(CoordinationError.internal(CANCELLED));
            }
            if (++iterations > maxIterations) {
                return finish(
                        CoordinationError.internal(
                                MAX_ITERATIONS_EXCEEDED
                                        + ": more than "
                                        + maxIterations
                                        + " node visits"));
            }

            WorkflowNode node = graph.nodes().get(current);
            if (node == null) {
                return finish(
                        CoordinationError.validation("Edge target node " + current + " not found"));
            }

            NodeOutput output;
            try {
                notifyListener("onNodeStart", () -> listener.onNodeStart(executionId, node));
                output =
                        process(
                                node,
                                new NodeContext(
                                        executionId,
                                        path.size() + 1,
                                        Collections.unmodifiableMap(context),
                                        agentInvoker,
                                        decisionEvaluator,
                                        processSteps));
            } catch (CoordinationException e) {
                logger.warning("Node " + node.id() + " failed: " + e.getMessage());
                return finish(e.toError());
            } catch (Exception e) {
                logger.log(Level.WARNING, "Node " + node.id() + " failed", e);
                return finish(
                        CoordinationError.internal(
                                "Node " + node.id() + " failed: " + e.getMessage()));
            }

            notifyListener(
                    "onNodeComplete", () -> listener.onNodeComplete(executionId, node, output));
            context.putAll(output.output());
            path.add(node.id());
            Map<String, Object> checkpoint = Collections.unmodifiableMap(context);
            notifyListener(
                    "onCheckpoint",
                    () -> listener.onCheckpoint(executionId, node.id(), checkpoint));
            eventBus.publish(
                    SOURCE,
                    new EventPayload.WorkflowNodeCompleted(
                            executionId, node.id(), node.kind().wireName(), path.size()));

            List<GraphEdge> outbound = graph.outbound().getOrDefault(node.id(), List.of());
            if (outbound.isEmpty()) {
                return finish(null);
            }
            GraphEdge next = outbound.get(0);
            if (output.decision() != null) {
                logger.fine(
                        "Decision " + node.id() + " evaluated " + output.decision()
                                + ", following first edge " + next.id());
            }
            current = next.target();
            return null;
        }

        private WorkflowResult finish(CoordinationError error) {
            result = new WorkflowResult(executionId, error == null, path, context, error);
            if (error == null) {
                logger.info("Workflow " + executionId + " completed: " + path);
                eventBus.publish(SOURCE, new EventPayload.WorkflowCompleted(executionId, path));
            } else {
                logger.warning("Workflow " + executionId + " failed after " + path + ": " + error);
                eventBus.publish(
                        SOURCE,
                        new EventPayload.WorkflowFailed(
                                executionId, path, error.kind().name(), error.message()));
            }
            WorkflowResult completed = result;
            notifyListener("onComplete", () -> listener.onComplete(completed));
            return result;
        }
    }

    /// Listener failures are logged and never change the outcome of an execution.
    private void notifyListener(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Workflow listener failed in " + callback, e);
        }
    }

    private record GraphSnapshot(
            Map<String, WorkflowNode> nodes, Map<String, List<GraphEdge>> outbound) {

        static GraphSnapshot of(Map<String, WorkflowNode> nodes, Map<String, GraphEdge> edges) {
            Map<String, List<GraphEdge>> outbound = new HashMap<>();
            for (GraphEdge edge : edges.values()) {
                outbound.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            }
            return new GraphSnapshot(new HashMap<>(nodes), outbound);
        }
    }

    public static final class Builder {
        private String initialNodeId;
        private EventBus eventBus;
        private AgentInvoker agentInvoker;
        private DecisionEvaluator decisionEvaluator = new ContextDecisionEvaluator();
        private NodeProcessorRegistry processors = new DefaultNodeProcessorRegistry();
        private final Map<String, ProcessStep> processSteps = new HashMap<>();
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private WorkflowListener listener = WorkflowListener.NOOP;

        private Builder() {}

        public Builder initialNodeId(String initialNodeId) {
            this.initialNodeId = initialNodeId;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder agentInvoker(AgentInvoker agentInvoker) {
            this.agentInvoker = agentInvoker;
            return this;
        }

        public Builder decisionEvaluator(DecisionEvaluator decisionEvaluator) {
            this.decisionEvaluator = decisionEvaluator;
            return this;
        }

        public Builder processorRegistry(NodeProcessorRegistry processors) {
            this.processors = processors;
            return this;
        }

        public Builder processStep(String processType, ProcessStep step) {
            this.processSteps.put(processType, step);
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder listener(WorkflowListener listener) {
            this.listener = listener;
            return this;
        }

        public WorkflowOrchestrator build() {
            if (initialNodeId == null || initialNodeId.isBlank()) {
                throw new IllegalStateException("Initial node id is required");
            }
            if (eventBus == null) {
                throw new IllegalStateException("Event bus is required");
            }
            if (decisionEvaluator == null || processors == null || listener == null) {
                throw new IllegalStateException("Collaborators must not be null");
            }
            if (maxIterations <= 0) {
                throw new IllegalStateException("maxIterations must be positive");
            }
            return new WorkflowOrchestrator(this);
        }
    }
}
