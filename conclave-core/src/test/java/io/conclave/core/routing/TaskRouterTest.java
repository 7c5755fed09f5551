package io.conclave.core.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentType;
import io.conclave.core.agent.InMemoryAgentRegistry;
import io.conclave.core.agent.Task;
import io.conclave.core.agent.TaskPriority;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.CapacityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TaskRouterTest {

    private EventBus bus;
    private InMemoryAgentRegistry registry;
    private TaskRouter router;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        registry = new InMemoryAgentRegistry(bus);
        router = new TaskRouter(registry, bus);
    }

    @Nested
    class RouteTaskTest {

        @Test
        void shouldRouteCodeGenerationToCoder() {
            // Given
            router.registerAgent(Agent.of("coder-1", AgentType.CODER, 10));
            router.registerAgent(Agent.of("reviewer-1", AgentType.REVIEWER, 10));
            router.registerAgent(Agent.of("tester-1", AgentType.TESTER, 10));

            // When
            RoutingResult result =
                    router.routeTask(Task.of("t1", "code_generation", "Implement login"));

            // Then
            assertThat(result.agentId()).isEqualTo("coder-1");
            assertThat(result.agent().type()).isEqualTo(AgentType.CODER);
            assertThat(result.confidence()).isGreaterThan(0.3);
            assertThat(result.degraded()).isFalse();
        }

        @Test
        void shouldAlwaysSelectRegisteredAgent() {
            // Given
            router.registerAgent(Agent.of("a", AgentType.CODER, 2));
            router.registerAgent(Agent.of("b", AgentType.CODER, 2));
            router.registerAgent(Agent.of("c", AgentType.CODER, 2));

            for (int i = 0; i < 10; i++) {
                // When
                RoutingResult result = router.routeTask(Task.of("t" + i, "code_generation", "x"));
                registry.adjustWorkload(result.agentId(), 1);

                // Then
                assertThat(registry.hasAgent(result.agentId())).isTrue();
                assertThat(result.confidence()).isBetween(0.0, 1.0);
            }
        }

        @Test
        void shouldPreferExpertiseMatch() {
            // Given
            router.registerAgent(Agent.of("generalist", AgentType.CODER, 5, "python"));
            router.registerAgent(Agent.of("specialist", AgentType.CODER, 5, "java", "spring"));

            // When
            RoutingResult result =
                    router.routeTask(
                            Task.of("t1", "code_generation", "Write a Java Spring controller"));

            // Then
            assertThat(result.agentId()).isEqualTo("specialist");
        }

        @Test
        void shouldPreferSpareCapacity() {
            // Given
            router.registerAgent(Agent.of("busy", AgentType.CODER, 10));
            router.registerAgent(Agent.of("idle", AgentType.CODER, 10));
            router.updateAgentWorkload("busy", 8);

            // When
            RoutingResult result = router.routeTask(Task.of("t1", "code_generation", "x"));

            // Then
            assertThat(result.agentId()).isEqualTo("idle");
        }

        @Test
        void shouldBreakTiesById() {
            router.registerAgent(Agent.of("b", AgentType.CODER, 4));
            router.registerAgent(Agent.of("a", AgentType.CODER, 4));

            RoutingResult result = router.routeTask(Task.of("t1", "code_generation", "x"));

            assertThat(result.agentId()).isEqualTo("a");
        }

        @Test
        void shouldAcceptAnyAgentForUnknownTaskType() {
            router.registerAgent(Agent.of("r", AgentType.RESEARCHER, 1));

            RoutingResult result = router.routeTask(Task.of("t1", "translation", "x"));

            assertThat(result.agentId()).isEqualTo("r");
        }

        @Test
        void shouldPublishTaskRouted() {
            // Given
            List<EventPayload.TaskRouted> routed = new ArrayList<>();
            bus.subscribe(EventPayload.TaskRouted.class, event -> routed.add(event.payload()));
            router.registerAgent(Agent.of("coder-1", AgentType.CODER, 1));

            // When
            router.routeTask(Task.of("t1", "code_generation", "x"));

            // Then
            assertThat(routed).hasSize(1);
            assertThat(routed.get(0).taskId()).isEqualTo("t1");
            assertThat(routed.get(0).agentId()).isEqualTo("coder-1");
        }
    }

    @Nested
    class CapacityTest {

        @Test
        void shouldFailWhenNoAgentsRegistered() {
            assertThatThrownBy(() -> router.routeTask(Task.of("t1", "code_generation", "x")))
                    .isInstanceOf(CapacityException.class)
                    .hasMessageContaining("No agents registered");
        }

        @Test
        void shouldFailWhenNoAgentIsCompatible() {
            router.registerAgent(Agent.of("t", AgentType.TESTER, 3));

            assertThatThrownBy(() -> router.routeTask(Task.of("t1", "code_generation", "x")))
                    .isInstanceOf(CapacityException.class)
                    .hasMessageContaining("code_generation");
        }

        @Test
        void shouldDegradeWhenAllCompatibleAgentsAreFull() {
            // Given
            router.registerAgent(Agent.of("c1", AgentType.CODER, 2));
            router.registerAgent(Agent.of("c2", AgentType.CODER, 2));
            router.updateAgentWorkload("c1", 3);
            router.updateAgentWorkload("c2", 2);

            // When
            RoutingResult result = router.routeTask(Task.of("t1", "code_generation", "x"));

            // Then
            assertThat(result.degraded()).isTrue();
            assertThat(result.agentId()).isEqualTo("c2");
            assertThat(result.confidence()).isEqualTo(TaskRouter.DEGRADED_CONFIDENCE);
        }
    }

    @Nested
    class ScoringTest {

        @Test
        void shouldComputeExpertiseFraction() {
            Agent agent = Agent.of("a", AgentType.CODER, 1, "java", "kafka");

            assertThat(TaskRouter.expertiseMatch("Tune the JAVA client", agent)).isEqualTo(0.5);
            assertThat(TaskRouter.expertiseMatch("", agent)).isZero();
        }

        @Test
        void shouldPenalizeLoadedAgentsMoreForHighPriority() {
            // Given
            Agent loaded = Agent.of("a", AgentType.CODER, 4).withWorkload(2);
            Task low = new Task("t1", "x", "code_generation", TaskPriority.LOW, Map.of());
            Task high = new Task("t2", "x", "code_generation", TaskPriority.HIGH, Map.of());

            // When
            double lowScore = router.score(low, loaded);
            double highScore = router.score(high, loaded);

            // Then
            assertThat(lowScore).isGreaterThan(highScore);
            assertThat(lowScore).isCloseTo((0.3 * 0.5 + 0.2 * 1.0), within(1e-9));
        }
    }

    @Nested
    class HistoryAndLoadTest {

        @Test
        void shouldKeepBoundedHistory() {
            // Given
            router =
                    new TaskRouter(
                            registry,
                            bus,
                            RoutingWeights.DEFAULT,
                            CompatibilityTable.defaults(),
                            2);
            router.registerAgent(Agent.of("c", AgentType.CODER, 10));

            // When
            router.routeTask(Task.of("t1", "code_generation", "x"));
            router.routeTask(Task.of("t2", "code_generation", "x"));
            router.routeTask(Task.of("t3", "code_generation", "x"));

            // Then
            assertThat(router.getRoutingHistory())
                    .extracting(RoutingDecision::taskId)
                    .containsExactly("t2", "t3");
            assertThat(router.getRoutingHistory("c")).hasSize(2);
            assertThat(router.getRoutingHistory("other")).isEmpty();
        }

        @Test
        void shouldReportOverloadedAndUnderutilizedAgents() {
            // Given
            router.registerAgent(Agent.of("hot", AgentType.CODER, 10));
            router.registerAgent(Agent.of("cold", AgentType.CODER, 10));
            router.registerAgent(Agent.of("warm", AgentType.CODER, 10));
            router.updateAgentWorkload("hot", 10);
            router.updateAgentWorkload("cold", 1);
            router.updateAgentWorkload("warm", 5);

            // When
            LoadReport report = router.loadReport();

            // Then
            assertThat(report.totalAgents()).isEqualTo(3);
            assertThat(report.overloaded()).containsExactly("hot");
            assertThat(report.underutilized()).containsExactly("cold");
            assertThat(report.averageUtilization()).isCloseTo(16.0 / 30, within(1e-9));
        }
    }
}
