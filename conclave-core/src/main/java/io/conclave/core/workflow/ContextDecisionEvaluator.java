package io.conclave.core.workflow;

import io.conclave.core.capability.DecisionEvaluator;
import java.util.Map;

/// {@link DecisionEvaluator} that reads the outcome from the workflow context.
///
/// Looks up `decision.<nodeId>` first, then `decision`; falls back to `positive`.
public class ContextDecisionEvaluator implements DecisionEvaluator {

    public static final String DEFAULT_OUTCOME = "positive";

    @Override
    public String decide(String nodeId, String question, Map<String, Object> context) {
        Object value = context.get("decision." + nodeId);
        if (value == null) {
            value = context.get("decision");
        }
        return value != null ? value.toString() : DEFAULT_OUTCOME;
    }
}
