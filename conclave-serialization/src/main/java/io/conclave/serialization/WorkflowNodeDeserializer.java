package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conclave.core.agent.AgentType;
import io.conclave.core.exception.ValidationException;
import io.conclave.core.workflow.node.AgentNode;
import io.conclave.core.workflow.node.DecisionNode;
import io.conclave.core.workflow.node.NodeKind;
import io.conclave.core.workflow.node.ProcessNode;
import io.conclave.core.workflow.node.WorkflowNode;
import java.io.IOException;
import java.io.Serial;

/// Deserializes JSON to the {@link WorkflowNode} variant named by the `"kind"` field.
///
/// `"type"` is accepted as an alias of `"kind"`. A missing `label` defaults to the id.
///
/// @implNote Package-private. Registered by {@link ConclaveJacksonModule}.
/// @see WorkflowNodeSerializer for the inverse operation
class WorkflowNodeDeserializer extends StdDeserializer<WorkflowNode> {

    @Serial private static final long serialVersionUID = 2748836193003419224L;

    WorkflowNodeDeserializer() {
        super(WorkflowNode.class);
    }

    @Override
    public WorkflowNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);

        String id = textOrNull(root, "id");
        if (id == null) {
            return ctxt.reportInputMismatch(WorkflowNode.class, "Workflow node without \"id\"");
        }
        String kindName = textOrNull(root, "kind");
        if (kindName == null) {
            kindName = textOrNull(root, "type");
        }
        String label = textOrNull(root, "label");

        try {
            return switch (NodeKind.fromWireName(kindName)) {
                case AGENT -> new AgentNode(id, label, agentType(root, id));
                case PROCESS -> new ProcessNode(id, label, textOrNull(root, "processType"));
                case DECISION -> new DecisionNode(id, label);
            };
        } catch (ValidationException | IllegalArgumentException e) {
            return ctxt.reportInputMismatch(
                    WorkflowNode.class, "Node " + id + ": " + e.getMessage());
        }
    }

    private static AgentType agentType(JsonNode root, String id) {
        String value = textOrNull(root, "agentType");
        if (value == null) {
            throw new IllegalArgumentException("agent node " + id + " requires \"agentType\"");
        }
        return AgentType.fromWireName(value);
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
