package io.conclave.core.workflow.processor;

import io.conclave.core.workflow.node.ProcessNode;
import java.util.Map;

/// Transform applied by a {@link ProcessNode} whose `processType` names it.
@FunctionalInterface
public interface ProcessStep {

    /// @param node node being processed, not null
    /// @param context unmodifiable workflow context, never null
    /// @return entries to merge into the context, never null
    /// @throws Exception if the step fails; the failure ends the execution
    Map<String, Object> apply(ProcessNode node, Map<String, Object> context) throws Exception;
}
