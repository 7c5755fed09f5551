package io.conclave.core.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Unit of work routed to an agent.
///
/// The context is an opaque structured payload. It is copied on construction (null values
/// allowed) and is replaced wholesale on handoff, never mutated in place.
///
/// @param id unique identifier, not null
/// @param description free text used for expertise matching, never null
/// @param type task type such as `code_generation`, not null
/// @param priority urgency, defaults to {@link TaskPriority#MEDIUM}
/// @param context task payload, never null
public record Task(
        String id,
        String description,
        String type,
        TaskPriority priority,
        Map<String, Object> context) {

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        description = description != null ? description : "";
        priority = priority != null ? priority : TaskPriority.MEDIUM;
        context =
                context != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                        : Map.of();
    }

    public static Task of(String id, String type, String description) {
        return new Task(id, description, type, TaskPriority.MEDIUM, Map.of());
    }

    /// Returns a copy carrying a different context.
    public Task withContext(Map<String, Object> newContext) {
        return new Task(id, description, type, priority, newContext);
    }
}
