package io.conclave.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentType;
import io.conclave.core.event.CoordinationEvent;
import io.conclave.core.event.EventPayload;
import io.conclave.core.event.EventType;
import io.conclave.core.workflow.GraphEdge;
import io.conclave.core.workflow.WorkflowDefinition;
import io.conclave.core.workflow.node.AgentNode;
import io.conclave.core.workflow.node.DecisionNode;
import io.conclave.core.workflow.node.ProcessNode;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConclaveJsonTest {

    @Nested
    class WorkflowDefinitions {

        @Test
        void shouldReadDefinitionWithAllNodeKinds() {
            // Given
            String json =
                    """
                    {
                      "id": "review-loop",
                      "initialNodeId": "plan",
                      "nodes": [
                        {"id": "plan", "kind": "agent", "agentType": "planner"},
                        {"id": "prep", "kind": "process", "label": "Prepare",
                         "processType": "normalize"},
                        {"id": "gate", "type": "decision"}
                      ],
                      "edges": [
                        {"source": "plan", "target": "prep"},
                        {"id": "e2", "source": "prep", "target": "gate"}
                      ]
                    }
                    """;

            // When
            WorkflowDefinition definition = ConclaveJson.definitionFromJson(json);

            // Then
            assertThat(definition.id()).isEqualTo("review-loop");
            assertThat(definition.initialNodeId()).isEqualTo("plan");
            assertThat(definition.nodes())
                    .containsExactly(
                            new AgentNode("plan", "plan", AgentType.PLANNER),
                            new ProcessNode("prep", "Prepare", "normalize"),
                            new DecisionNode("gate", "gate"));
            assertThat(definition.edges())
                    .containsExactly(
                            new GraphEdge("plan->prep", "plan", "prep"),
                            new GraphEdge("e2", "prep", "gate"));
        }

        @Test
        void shouldPreserveDefinitionThroughWriteAndRead() {
            // Given
            WorkflowDefinition definition =
                    new WorkflowDefinition(
                            "wf",
                            "code",
                            List.of(
                                    new AgentNode("code", "Write code", AgentType.CODER),
                                    ProcessNode.of("done", "Done")),
                            List.of(GraphEdge.of("code", "done")));

            // When
            String json = ConclaveJson.definitionToJson(definition);

            // Then
            assertThat(json).contains("\"kind\" : \"agent\"").contains("\"agentType\" : \"coder\"");
            assertThat(ConclaveJson.definitionFromJson(json)).isEqualTo(definition);
        }

        @Test
        void shouldRejectUnknownNodeKind() {
            String json =
                    """
                    {"id": "wf", "initialNodeId": "a",
                     "nodes": [{"id": "a", "kind": "teleport"}]}
                    """;

            assertThatThrownBy(() -> ConclaveJson.definitionFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown node type: teleport");
        }

        @Test
        void shouldRejectAgentNodeWithoutAgentType() {
            String json =
                    """
                    {"id": "wf", "initialNodeId": "a",
                     "nodes": [{"id": "a", "kind": "agent"}]}
                    """;

            assertThatThrownBy(() -> ConclaveJson.definitionFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("agentType");
        }

        @Test
        void shouldRejectEdgeWithoutTarget() {
            String json =
                    """
                    {"id": "wf", "initialNodeId": "a",
                     "nodes": [{"id": "a", "kind": "decision"}],
                     "edges": [{"source": "a"}]}
                    """;

            assertThatThrownBy(() -> ConclaveJson.definitionFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("target");
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> ConclaveJson.definitionFromJson("{not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize workflow definition");
        }
    }

    @Nested
    class AgentRosters {

        @Test
        void shouldReadBareArrayAndWrappedRoster() {
            // Given
            String array =
                    """
                    [{"id": "c1", "type": "coder", "expertise": ["java", "sql"], "capacity": 3},
                     {"id": "r1", "type": "reviewer", "name": "Rita", "workload": 1,
                      "capacity": 2}]
                    """;
            String wrapped = "{\"agents\": " + array + "}";

            // When
            List<Agent> fromArray = ConclaveJson.agentsFromJson(array);
            List<Agent> fromObject = ConclaveJson.agentsFromJson(wrapped);

            // Then
            assertThat(fromArray).isEqualTo(fromObject);
            assertThat(fromArray)
                    .containsExactly(
                            new Agent("c1", AgentType.CODER, "c1", Set.of("java", "sql"),
                                    0, 3),
                            new Agent("r1", AgentType.REVIEWER, "Rita", Set.of(), 1, 2));
        }

        @Test
        void shouldWriteAgentTypeByWireNameWithoutDerivedFields() {
            // Given
            List<Agent> agents = List.of(Agent.of("t1", AgentType.TESTER, 4, "junit"));

            // When
            String json = ConclaveJson.agentsToJson(agents);

            // Then
            assertThat(json).contains("\"type\" : \"tester\"").doesNotContain("atCapacity");
            assertThat(ConclaveJson.agentsFromJson(json)).isEqualTo(agents);
        }

        @Test
        void shouldRejectUnknownAgentType() {
            assertThatThrownBy(
                            () -> ConclaveJson.agentsFromJson(
                                    "[{\"id\": \"x\", \"type\": \"wizard\", \"capacity\": 1}]"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("agent roster");
        }

        @Test
        void shouldRejectRosterWithoutAgentsArray() {
            assertThatThrownBy(() -> ConclaveJson.agentsFromJson("{\"team\": []}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("\"agents\" array");
        }
    }

    @Nested
    class Events {

        @Test
        void shouldWriteEnvelopeWithWireType() {
            // Given
            CoordinationEvent<EventPayload.TaskRouted> event =
                    CoordinationEvent.of(
                            "router", new EventPayload.TaskRouted("t1", "c1", 0.75, false));

            // When
            String json = ConclaveJson.eventToJson(event);

            // Then
            assertThat(json)
                    .contains("\"type\" : \"task.routed\"")
                    .contains("\"source\" : \"router\"")
                    .contains("\"confidence\" : 0.75");
        }

        @Test
        void shouldRestorePayloadRecordFromType() {
            // Given
            CoordinationEvent<EventPayload.VoteSessionClosed> event =
                    CoordinationEvent.of(
                            "voting",
                            new EventPayload.VoteSessionClosed(
                                    "s1", "A", true, Map.of("A", 2.0, "B", 1.0)));

            // When
            CoordinationEvent<?> restored =
                    ConclaveJson.eventFromJson(ConclaveJson.eventToJson(event));

            // Then
            assertThat(restored).isEqualTo(event);
            assertThat(restored.type()).isEqualTo(EventType.VOTE_SESSION_CLOSED);
            assertThat(restored.payload()).isInstanceOf(EventPayload.VoteSessionClosed.class);
        }

        @Test
        void shouldRejectUnknownEventType() {
            String json =
                    """
                    {"id": "e1", "type": "agent.teleported", "timestamp": 1,
                     "source": "x", "payload": {}}
                    """;

            assertThatThrownBy(() -> ConclaveJson.eventFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown event type: agent.teleported");
        }
    }

    @Nested
    class Contexts {

        @Test
        void shouldReadPlainJsonIntoMutableMap() {
            // When
            Map<String, Object> context =
                    ConclaveJson.contextFromJson("{\"task\":\"review\",\"attempts\":2}");
            context.put("extra", true);

            // Then
            assertThat(context)
                    .containsEntry("task", "review")
                    .containsEntry("attempts", 2)
                    .containsEntry("extra", true);
        }

        @Test
        void shouldWriteCompactJsonWithoutTypes() {
            String json = ConclaveJson.contextToJson(Map.of("startedAt", 5L));

            assertThat(json).isEqualTo("{\"startedAt\":5}");
        }

        @Test
        void shouldRejectNonObjectContext() {
            assertThatThrownBy(() -> ConclaveJson.contextFromJson("[1]"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize context");
        }
    }
}
