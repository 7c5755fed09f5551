package io.conclave.core.event;

import java.util.Objects;
import java.util.UUID;

/// Immutable envelope published on the {@link EventBus}.
///
/// @param id unique event identifier, not null
/// @param timestamp epoch milliseconds at creation
/// @param source component or agent that produced the event, not null
/// @param payload type-specific content, not null
/// @param <P> payload record type
public record CoordinationEvent<P extends EventPayload>(
        String id, long timestamp, String source, P payload) {

    public CoordinationEvent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }

    /// Creates an event with a generated id and the current time.
    ///
    /// @param source producing component, not null
    /// @param payload event content, not null
    /// @param <P> payload record type
    /// @return new event, never null
    public static <P extends EventPayload> CoordinationEvent<P> of(String source, P payload) {
        return new CoordinationEvent<>(
                "evt_" + UUID.randomUUID(), System.currentTimeMillis(), source, payload);
    }

    /// Returns the event type derived from the payload.
    ///
    /// @return event type, never null
    public EventType type() {
        return payload.type();
    }
}
