package io.conclave.core.workflow;

import io.conclave.core.workflow.node.WorkflowNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Static checks of a {@link WorkflowDefinition} before it runs.
///
/// ### Errors
/// - initial node missing
/// - duplicate node or edge ids
/// - edges whose source or target does not exist
/// - the first-edge path from the initial node revisits a node, so execution can only end
///   with `MaxIterationsExceeded`
///
/// ### Warnings
/// - nodes unreachable from the initial node
/// - cycles reachable from the initial node through edges other than the first
public class WorkflowGraphValidator {

    /// Outcome of a validation.
    ///
    /// @param errors problems that make execution fail
    /// @param warnings suspicious but runnable structure
    public record Report(List<String> errors, List<String> warnings) {

        public Report {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    public Report validate(WorkflowDefinition definition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> nodeIds = new HashSet<>();
        for (WorkflowNode node : definition.nodes()) {
            if (!nodeIds.add(node.id())) {
                errors.add("nodes." + node.id() + ": duplicate node id");
            }
        }
        if (!nodeIds.contains(definition.initialNodeId())) {
            errors.add("Initial state node " + definition.initialNodeId() + " not found");
        }

        Set<String> edgeIds = new HashSet<>();
        Map<String, List<String>> outbound = new HashMap<>();
        for (GraphEdge edge : definition.edges()) {
            if (!edgeIds.add(edge.id())) {
                errors.add("edges." + edge.id() + ": duplicate edge id");
            }
            if (!nodeIds.contains(edge.source())) {
                errors.add("edges." + edge.id() + ": source node " + edge.source() + " not found");
            }
            if (!nodeIds.contains(edge.target())) {
                errors.add("edges." + edge.id() + ": target node " + edge.target() + " not found");
            }
            outbound.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }

        if (nodeIds.contains(definition.initialNodeId())) {
            checkExecutionPath(definition.initialNodeId(), outbound, errors);
            Set<String> reachable = reachableFrom(definition.initialNodeId(), outbound);
            for (WorkflowNode node : definition.nodes()) {
                if (!reachable.contains(node.id())) {
                    warnings.add(
                            "nodes."
                                    + node.id()
                                    + ": unreachable from "
                                    + definition.initialNodeId());
                }
            }
            boolean loopReported = errors.stream().anyMatch(e -> e.startsWith("Execution path"));
            if (!loopReported && hasCycle(definition.initialNodeId(), outbound)) {
                warnings.add("Graph contains a cycle reachable from " + definition.initialNodeId());
            }
        }

        return new Report(errors, warnings);
    }

    private static void checkExecutionPath(
            String initial, Map<String, List<String>> outbound, List<String> errors) {
        Set<String> visited = new LinkedHashSet<>();
        String current = initial;
        while (current != null && visited.add(current)) {
            List<String> targets = outbound.get(current);
            current = targets == null || targets.isEmpty() ? null : targets.get(0);
        }
        if (current != null) {
            errors.add(
                    "Execution path "
                            + String.join(" -> ", visited)
                            + " -> "
                            + current
                            + " loops and will exceed the iteration limit");
        }
    }

    private static Set<String> reachableFrom(String initial, Map<String, List<String>> outbound) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(initial);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (seen.add(id)) {
                queue.addAll(outbound.getOrDefault(id, List.of()));
            }
        }
        return seen;
    }

    private static boolean hasCycle(String initial, Map<String, List<String>> outbound) {
        Set<String> done = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(initial, outbound.getOrDefault(initial, List.of())));
        onStack.add(initial);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.index < top.targets.size()) {
                String next = top.targets.get(top.index++);
                if (onStack.contains(next)) {
                    return true;
                }
                if (!done.contains(next)) {
                    onStack.add(next);
                    stack.push(new Frame(next, outbound.getOrDefault(next, List.of())));
                }
            } else {
                stack.pop();
                onStack.remove(top.node);
                done.add(top.node);
            }
        }
        return false;
    }

    private static final class Frame {
        private final String node;
        private final List<String> targets;
        private int index;

        private Frame(String node, List<String> targets) {
            this.node = node;
            this.targets = targets;
        }
    }
}
