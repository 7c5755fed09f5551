package io.conclave.core.workflow.processor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Result of processing one node.
///
/// @param output entries merged into the workflow context, never null
/// @param decision outcome of a decision node, null for other kinds
public record NodeOutput(Map<String, Object> output, String decision) {

    public NodeOutput {
        output =
                output != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                        : Map.of();
    }

    public static NodeOutput of(Map<String, Object> output) {
        return new NodeOutput(output, null);
    }
}
