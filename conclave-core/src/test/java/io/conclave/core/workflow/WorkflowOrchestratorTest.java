package io.conclave.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.conclave.core.agent.AgentType;
import io.conclave.core.capability.AgentInvocation;
import io.conclave.core.capability.AgentInvoker;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventType;
import io.conclave.core.exception.ErrorKind;
import io.conclave.core.exception.ValidationException;
import io.conclave.core.workflow.node.AgentNode;
import io.conclave.core.workflow.node.DecisionNode;
import io.conclave.core.workflow.node.ProcessNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class WorkflowOrchestratorTest {

    private EventBus bus;
    private List<EventType> events;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        events = new ArrayList<>();
        bus.subscribeAll(event -> events.add(event.type()));
    }

    private WorkflowOrchestrator.Builder builder(String initial) {
        return WorkflowOrchestrator.builder().initialNodeId(initial).eventBus(bus);
    }

    @Nested
    class ExecuteTest {

        @Test
        void shouldFollowFirstEdgeOutOfDecision() {
            // Given
            WorkflowOrchestrator orchestrator = builder("start").build();
            orchestrator.addNode(ProcessNode.of("start", "Start"));
            orchestrator.addNode(new DecisionNode("decision", "Proceed?"));
            orchestrator.addNode(ProcessNode.of("pathA", "Path A"));
            orchestrator.addNode(ProcessNode.of("pathB", "Path B"));
            orchestrator.addEdge(GraphEdge.of("start", "decision"));
            orchestrator.addEdge(GraphEdge.of("decision", "pathA"));
            orchestrator.addEdge(GraphEdge.of("decision", "pathB"));

            // When
            WorkflowResult result = orchestrator.executeWorkflow(Map.of());

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.executionPath()).containsExactly("start", "decision", "pathA");
            assertThat(result.finalContext())
                    .containsEntry("decision", "positive")
                    .containsEntry("processedBy", "process:pathA");
            assertThat(events)
                    .startsWith(EventType.WORKFLOW_STARTED)
                    .endsWith(EventType.WORKFLOW_COMPLETED)
                    .filteredOn(t -> t == EventType.WORKFLOW_NODE_COMPLETED)
                    .hasSize(3);
        }

        @Test
        void shouldFollowFirstEdgeEvenForNegativeDecision() {
            // Given
            WorkflowOrchestrator orchestrator = builder("decision").build();
            orchestrator.addNode(new DecisionNode("decision", "Proceed?"));
            orchestrator.addNode(ProcessNode.of("pathA", "Path A"));
            orchestrator.addNode(ProcessNode.of("pathB", "Path B"));
            orchestrator.addEdge(GraphEdge.of("decision", "pathA"));
            orchestrator.addEdge(GraphEdge.of("decision", "pathB"));

            // When
            WorkflowResult result =
                    orchestrator.executeWorkflow(Map.of("decision.decision", "negative"));

            // Then
            assertThat(result.executionPath()).containsExactly("decision", "pathA");
            assertThat(result.finalContext()).containsEntry("decision", "negative");
        }

        @Test
        void shouldDelegateAgentNodesToInvoker() {
            // Given
            AgentInvoker invoker = mock(AgentInvoker.class);
            when(invoker.invoke(any(AgentInvocation.class)))
                    .thenReturn(Map.of("result", "code written", "processedBy", "coder-1"));
            WorkflowOrchestrator orchestrator = builder("code").agentInvoker(invoker).build();
            orchestrator.addNode(new AgentNode("code", "Write code", AgentType.CODER));

            // When
            WorkflowResult result = orchestrator.executeWorkflow(Map.of("ticket", "T-1"));

            // Then
            ArgumentCaptor<AgentInvocation> captor = ArgumentCaptor.forClass(AgentInvocation.class);
            verify(invoker).invoke(captor.capture());
            assertThat(captor.getValue().agentType()).isEqualTo(AgentType.CODER);
            assertThat(captor.getValue().context()).containsEntry("ticket", "T-1");
            assertThat(result.finalContext())
                    .containsEntry("result", "code written")
                    .containsEntry("ticket", "T-1");
        }

        @Test
        void shouldRunRegisteredProcessStep() {
            // Given
            WorkflowOrchestrator orchestrator =
                    builder("count")
                            .processStep(
                                    "increment",
                                    (node, context) ->
                                            Map.of(
                                                    "count",
                                                    (Integer) context.getOrDefault("count", 0) + 1))
                            .build();
            orchestrator.addNode(new ProcessNode("count", "Count", "increment"));

            // When
            WorkflowResult result = orchestrator.executeWorkflow(Map.of("count", 41));

            // Then
            assertThat(result.finalContext()).containsEntry("count", 42);
        }

        @Test
        void shouldSucceedWithSingleNode() {
            WorkflowOrchestrator orchestrator = builder("only").build();
            orchestrator.addNode(ProcessNode.of("only", "Only"));

            WorkflowResult result = orchestrator.executeWorkflow(null);

            assertThat(result.success()).isTrue();
            assertThat(result.executionPath()).containsExactly("only");
            assertThat(result.error()).isNull();
        }
    }

    @Nested
    class FailureTest {

        @Test
        void shouldThrowWhenInitialNodeMissing() {
            WorkflowOrchestrator orchestrator = builder("ghost").build();

            assertThatThrownBy(() -> orchestrator.executeWorkflow(Map.of()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Initial state node ghost not found");
            assertThat(events).isEmpty();
        }

        @Test
        void shouldFailOnDanglingEdge() {
            // Given
            WorkflowOrchestrator orchestrator = builder("start").build();
            orchestrator.addNode(ProcessNode.of("start", "Start"));
            orchestrator.addEdge(GraphEdge.of("start", "missing"));

            // When
            WorkflowResult result = orchestrator.executeWorkflow(Map.of());

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(result.error().message()).contains("missing");
            assertThat(result.executionPath()).containsExactly("start");
            assertThat(events).endsWith(EventType.WORKFLOW_FAILED);
        }

        @Test
        void shouldStopCyclesAtIterationLimit() {
            // Given
            WorkflowOrchestrator orchestrator = builder("a").maxIterations(5).build();
            orchestrator.addNode(ProcessNode.of("a", "A"));
            orchestrator.addNode(ProcessNode.of("b", "B"));
            orchestrator.addEdge(GraphEdge.of("a", "b"));
            orchestrator.addEdge(GraphEdge.of("b", "a"));

            // When
            WorkflowResult result = orchestrator.executeWorkflow(Map.of());

            // Then
            assertThat(result.success()).isFalse();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(result.error().message())
                    .startsWith(WorkflowOrchestrator.MAX_ITERATIONS_EXCEEDED);
            assertThat(result.executionPath()).hasSize(5);
        }

        @Test
        void shouldFailOnUnknownProcessType() {
            WorkflowOrchestrator orchestrator = builder("p").build();
            orchestrator.addNode(new ProcessNode("p", "P", "teleport"));

            WorkflowResult result = orchestrator.executeWorkflow(Map.of());

            assertThat(result.success()).isFalse();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(result.executionPath()).isEmpty();
        }

        @Test
        void shouldFailAgentNodeWithoutInvoker() {
            WorkflowOrchestrator orchestrator = builder("code").build();
            orchestrator.addNode(new AgentNode("code", "Write", AgentType.CODER));

            WorkflowResult result = orchestrator.executeWorkflow(Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.INTERNAL);
        }

        @Test
        void shouldCaptureStepExceptionAsInternalError() {
            // Given
            WorkflowOrchestrator orchestrator =
                    builder("p")
                            .processStep(
                                    "explode",
                                    (node, context) -> {
                                        throw new java.io.IOException("disk gone");
                                    })
                            .build();
            orchestrator.addNode(new ProcessNode("p", "P", "explode"));

            // When
            WorkflowResult result = orchestrator.executeWorkflow(Map.of());

            // Then
            assertThat(result.error().kind()).isEqualTo(ErrorKind.INTERNAL);
            assertThat(result.error().message()).contains("disk gone");
        }

        @Test
        void shouldRequireEventBus() {
            assertThatThrownBy(() -> WorkflowOrchestrator.builder().initialNodeId("a").build())
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class AsyncTest {

        @Test
        void shouldCompleteOnExecutor() throws Exception {
            // Given
            ExecutorService executor = Executors.newSingleThreadExecutor();
            WorkflowOrchestrator orchestrator = builder("a").build();
            orchestrator.addNode(ProcessNode.of("a", "A"));
            orchestrator.addNode(ProcessNode.of("b", "B"));
            orchestrator.addEdge(GraphEdge.of("a", "b"));

            // When
            WorkflowExecution execution = orchestrator.executeWorkflowAsync(Map.of(), executor);
            WorkflowResult result = execution.result().get(5, TimeUnit.SECONDS);

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.executionId()).isEqualTo(execution.getExecutionId());
            assertThat(result.executionPath()).containsExactly("a", "b");
            executor.shutdown();
        }

        @Test
        void shouldStopAtNodeBoundaryWhenCancelled() throws Exception {
            // Given
            ExecutorService executor = Executors.newSingleThreadExecutor();
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            WorkflowOrchestrator orchestrator =
                    builder("slow")
                            .processStep(
                                    "block",
                                    (node, context) -> {
                                        entered.countDown();
                                        release.await(5, TimeUnit.SECONDS);
                                        return Map.of();
                                    })
                            .build();
            orchestrator.addNode(new ProcessNode("slow", "Slow", "block"));
            orchestrator.addNode(ProcessNode.of("next", "Next"));
            orchestrator.addEdge(GraphEdge.of("slow", "next"));

            // When
            WorkflowExecution execution = orchestrator.executeWorkflowAsync(Map.of(), executor);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            execution.cancel();
            release.countDown();
            WorkflowResult result = execution.result().get(5, TimeUnit.SECONDS);

            // Then
            assertThat(execution.isCancelRequested()).isTrue();
            assertThat(result.success()).isFalse();
            assertThat(result.error().message()).isEqualTo(WorkflowOrchestrator.CANCELLED);
            assertThat(result.executionPath()).containsExactly("slow");
            executor.shutdown();
        }
    }

    @Nested
    class ListenerTest {

        @Test
        void shouldNotifyLifecycleInOrder() {
            // Given
            List<String> calls = new ArrayList<>();
            WorkflowListener listener =
                    new WorkflowListener() {
                        @Override
                        public void onStart(String executionId, String initialNodeId) {
                            calls.add("start:" + initialNodeId);
                        }

                        @Override
                        public void onCheckpoint(
                                String executionId, String nodeId, Map<String, Object> context) {
                            calls.add("checkpoint:" + nodeId);
                        }

                        @Override
                        public void onComplete(WorkflowResult result) {
                            calls.add("complete:" + result.success());
                        }
                    };
            WorkflowOrchestrator orchestrator = builder("a").listener(listener).build();
            orchestrator.addNode(ProcessNode.of("a", "A"));
            orchestrator.addNode(ProcessNode.of("b", "B"));
            orchestrator.addEdge(GraphEdge.of("a", "b"));

            // When
            orchestrator.executeWorkflow(Map.of());

            // Then
            assertThat(calls)
                    .containsExactly("start:a", "checkpoint:a", "checkpoint:b", "complete:true");
        }

        @Test
        void shouldIsolateFailingListener() {
            // Given
            WorkflowListener listener = mock(WorkflowListener.class);
            RuntimeException boom = new IllegalStateException("listener down");
            doThrow(boom).when(listener).onStart(any(), any());
            doThrow(boom).when(listener).onNodeStart(any(), any());
            doThrow(boom).when(listener).onNodeComplete(any(), any(), any());
            doThrow(boom).when(listener).onCheckpoint(any(), any(), any());
            doThrow(boom).when(listener).onComplete(any());
            WorkflowOrchestrator orchestrator = builder("a").listener(listener).build();
            orchestrator.addNode(ProcessNode.of("a", "A"));
            orchestrator.addNode(ProcessNode.of("b", "B"));
            orchestrator.addEdge(GraphEdge.of("a", "b"));

            // When
            WorkflowResult result = orchestrator.executeWorkflow(Map.of());

            // Then
            assertThat(result.success()).isTrue();
            assertThat(result.executionPath()).containsExactly("a", "b");
            verify(listener).onComplete(result);
            assertThat(events).contains(EventType.WORKFLOW_COMPLETED);
        }
    }
}
