package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.conclave.core.workflow.node.AgentNode;
import io.conclave.core.workflow.node.DecisionNode;
import io.conclave.core.workflow.node.ProcessNode;
import io.conclave.core.workflow.node.WorkflowNode;
import java.io.IOException;
import java.io.Serial;

/// Serializes all {@link WorkflowNode} variants with a `"kind"` discriminator field.
///
/// ```
/// kind       Additional fields
/// ───────────┼──────────────────
/// agent      │ agentType
/// process    │ processType (omitted when null)
/// decision   │ (none)
/// ```
///
/// @implNote Package-private. Registered by {@link ConclaveJacksonModule}.
/// @see WorkflowNodeDeserializer for the inverse operation
class WorkflowNodeSerializer extends StdSerializer<WorkflowNode> {

    @Serial private static final long serialVersionUID = -6021180383715390712L;

    WorkflowNodeSerializer() {
        super(WorkflowNode.class);
    }

    @Override
    public void serialize(WorkflowNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.id());
        gen.writeStringField("kind", node.kind().wireName());
        gen.writeStringField("label", node.label());

        if (node instanceof AgentNode agent) {
            gen.writeStringField("agentType", agent.agentType().wireName());
        } else if (node instanceof ProcessNode process) {
            if (process.processType() != null) {
                gen.writeStringField("processType", process.processType());
            }
        } else if (!(node instanceof DecisionNode)) {
            throw new IOException("Unknown node type: " + node.getClass().getSimpleName());
        }

        gen.writeEndObject();
    }
}
