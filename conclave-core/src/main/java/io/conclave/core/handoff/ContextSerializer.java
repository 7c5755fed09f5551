package io.conclave.core.handoff;

import java.util.Map;

/// Converts a task context to text and back for transfer between agents.
///
/// Implementations are discovered through {@link java.util.ServiceLoader} when none is
/// supplied explicitly. Round trips must be deep-equal for maps of strings, numbers,
/// booleans, nulls, lists and nested maps.
public interface ContextSerializer {

    /// @throws IllegalArgumentException if the context holds values that cannot be written
    String serialize(Map<String, Object> context);

    /// @throws IllegalArgumentException if the text is not a serialized context
    Map<String, Object> deserialize(String text);
}
