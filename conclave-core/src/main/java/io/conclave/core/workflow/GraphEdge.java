package io.conclave.core.workflow;

import java.util.Objects;

/// Directed edge between two nodes.
///
/// Endpoints are not checked on insertion; an edge whose target does not exist fails the
/// execution that reaches it.
///
/// @param id edge id, unique within its graph, not null
/// @param source source node id, not null
/// @param target target node id, not null
public record GraphEdge(String id, String source, String target) {

    public GraphEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    /// Creates an edge with the id `source->target`.
    public static GraphEdge of(String source, String target) {
        return new GraphEdge(source + "->" + target, source, target);
    }
}
