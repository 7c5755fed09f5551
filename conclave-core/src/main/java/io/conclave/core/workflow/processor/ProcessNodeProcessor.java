package io.conclave.core.workflow.processor;

import io.conclave.core.exception.ValidationException;
import io.conclave.core.workflow.node.ProcessNode;
import java.util.LinkedHashMap;
import java.util.Map;

/// Applies a {@link ProcessNode}'s transform.
///
/// Nodes without a `processType` get the generic transform, which records who processed
/// the node and when. Nodes naming an unregistered type fail.
public class ProcessNodeProcessor implements NodeProcessor<ProcessNode> {

    @Override
    public Class<ProcessNode> getNodeType() {
        return ProcessNode.class;
    }

    @Override
    public NodeOutput process(ProcessNode node, NodeContext context) throws Exception {
        if (node.processType() == null) {
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("processedBy", "process:" + node.id());
            output.put("result", "Executed process " + node.label());
            output.put("timestamp", System.currentTimeMillis());
            return NodeOutput.of(output);
        }

        ProcessStep step = context.processSteps().get(node.processType());
        if (step == null) {
            throw new ValidationException(
                    "Unknown process type '" + node.processType() + "' on node " + node.id());
        }
        return NodeOutput.of(step.apply(node, context.context()));
    }
}
