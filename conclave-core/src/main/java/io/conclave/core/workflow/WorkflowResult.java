package io.conclave.core.workflow;

import io.conclave.core.exception.CoordinationError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Outcome of one workflow execution.
///
/// @param executionId identifier of the execution, not null
/// @param success whether execution reached a node without outbound edges
/// @param executionPath processed node ids in order
/// @param finalContext context after the last processed node
/// @param error failure detail, null on success
public record WorkflowResult(
        String executionId,
        boolean success,
        List<String> executionPath,
        Map<String, Object> finalContext,
        CoordinationError error) {

    public WorkflowResult {
        executionPath = List.copyOf(executionPath);
        finalContext = Collections.unmodifiableMap(new LinkedHashMap<>(finalContext));
    }
}
