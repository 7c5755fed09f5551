package io.conclave.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.conclave.core.agent.Agent;
import io.conclave.core.agent.AgentType;
import io.conclave.core.event.CoordinationEvent;
import io.conclave.core.workflow.GraphEdge;
import io.conclave.core.workflow.node.WorkflowNode;
import io.conclave.serialization.mixin.AgentMixin;
import io.conclave.serialization.mixin.AgentTypeMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all coordination serialization configuration in
/// one place.
///
/// **Custom serializer/deserializer pairs**:
/// - `WorkflowNode`: `WorkflowNodeSerializer` / `WorkflowNodeDeserializer`, discriminator
///   `"kind"`
/// - `CoordinationEvent`: `CoordinationEventSerializer` / `CoordinationEventDeserializer`,
///   discriminator `"type"` holding the event wire name
/// - `GraphEdge`: deserializer only, so that `id` may be omitted
///
/// **Mixins**:
/// - `AgentType` is written and read by wire name (`coder`, `reviewer`, ...)
/// - `Agent` hides its derived `atCapacity` flag
///
/// @implNote All registrations are explicit. No classpath scanning.
/// @see ConclaveJson for the convenience API
public class ConclaveJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127735530958135813L;

    @SuppressWarnings({"unchecked", "rawtypes"})
    public ConclaveJacksonModule() {
        super("ConclaveJacksonModule");

        addSerializer(WorkflowNode.class, new WorkflowNodeSerializer());
        addDeserializer(WorkflowNode.class, new WorkflowNodeDeserializer());

        addSerializer((Class) CoordinationEvent.class, new CoordinationEventSerializer());
        addDeserializer((Class) CoordinationEvent.class, new CoordinationEventDeserializer());

        addDeserializer(GraphEdge.class, new GraphEdgeDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(AgentType.class, AgentTypeMixin.class);
        context.setMixInAnnotations(Agent.class, AgentMixin.class);
    }
}
