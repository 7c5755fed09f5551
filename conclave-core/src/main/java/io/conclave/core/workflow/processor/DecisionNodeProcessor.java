package io.conclave.core.workflow.processor;

import io.conclave.core.workflow.node.DecisionNode;
import java.util.LinkedHashMap;
import java.util.Map;

/// Evaluates a {@link DecisionNode} with the configured decision capability.
public class DecisionNodeProcessor implements NodeProcessor<DecisionNode> {

    @Override
    public Class<DecisionNode> getNodeType() {
        return DecisionNode.class;
    }

    @Override
    public NodeOutput process(DecisionNode node, NodeContext context) {
        String outcome =
                context.decisionEvaluator().decide(node.id(), node.label(), context.context());
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("processedBy", "decision:" + node.id());
        output.put("decision", outcome);
        output.put("result", "Decision made: " + outcome);
        output.put("timestamp", System.currentTimeMillis());
        return new NodeOutput(output, outcome);
    }
}
