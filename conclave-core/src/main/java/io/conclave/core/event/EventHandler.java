package io.conclave.core.event;

/// Callback invoked for each delivered event.
///
/// Exceptions thrown from {@link #handle} are caught and logged by the bus; they never
/// reach the publisher or other subscribers.
///
/// @param <P> payload record type the handler accepts
@FunctionalInterface
public interface EventHandler<P extends EventPayload> {

    void handle(CoordinationEvent<P> event);
}
