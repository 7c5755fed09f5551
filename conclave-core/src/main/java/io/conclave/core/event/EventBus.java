package io.conclave.core.event;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Typed publish/subscribe backbone shared by the coordination components.
///
/// Each bus is an explicitly constructed instance. Components receive it by reference,
/// so several independent coordination cores can live in one process without cross-talk.
///
/// ### Delivery
/// - A subscriber receives every published event whose payload is an instance of the
///   subscribed payload class and whose optional filter matches
/// - Per subscriber, events arrive in publish order
/// - A handler or filter that throws is logged and skipped; delivery to the remaining
///   subscribers continues and the publisher never sees the failure
///
/// ### Modes
/// - **Synchronous** (default): handlers run on the publishing thread before
///   {@link #publish} returns
/// - **Asynchronous**: each subscription drains its own serial queue on the supplied
///   {@link Executor}; a slow handler delays only its own subscription
///
/// No durability is offered. Events published while nobody listens are dropped.
///
/// @implNote Thread-safe. Subscriptions are held in a {@link CopyOnWriteArrayList};
/// publishing iterates a snapshot, so subscribing from inside a handler affects only
/// later events.
///
/// @see CoordinationEvent
/// @see EventPayload for the closed set of payloads
public class EventBus {

    private static final Logger logger = Logger.getLogger(EventBus.class.getName());

    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();
    private final Executor executor;

    /// Creates a synchronous bus.
    public EventBus() {
        this(null);
    }

    /// Creates a bus that delivers on the given executor.
    ///
    /// @param executor executor for asynchronous delivery, or null for synchronous delivery
    public EventBus(Executor executor) {
        this.executor = executor;
    }

    /// Publishes an event to all matching subscribers.
    ///
    /// @param event the event to deliver, not null
    /// @return number of subscriptions the event was handed to
    /// @throws NullPointerException if event is null
    public int publish(CoordinationEvent<?> event) {
        Objects.requireNonNull(event, "event must not be null");
        logger.fine("Publishing " + event.type() + " from " + event.source());

        int delivered = 0;
        for (Subscription<?> subscription : subscriptions) {
            if (subscription.offer(event)) {
                delivered++;
            }
        }
        return delivered;
    }

    /// Convenience for {@code publish(CoordinationEvent.of(source, payload))}.
    ///
    /// @param source producing component, not null
    /// @param payload event content, not null
    /// @return the published event, never null
    public <P extends EventPayload> CoordinationEvent<P> publish(String source, P payload) {
        CoordinationEvent<P> event = CoordinationEvent.of(source, payload);
        publish(event);
        return event;
    }

    /// Subscribes to every event carrying the given payload type.
    ///
    /// @param payloadType payload record class to receive, not null
    /// @param handler callback, not null
    /// @return subscription id for {@link #unsubscribe}, never null
    public <P extends EventPayload> String subscribe(
            Class<P> payloadType, EventHandler<P> handler) {
        return subscribe(payloadType, handler, null);
    }

    /// Subscribes to events of the given payload type that pass a filter.
    ///
    /// @param payloadType payload record class to receive, not null
    /// @param handler callback, not null
    /// @param filter predicate evaluated before delivery, may be null to accept all
    /// @return subscription id for {@link #unsubscribe}, never null
    public <P extends EventPayload> String subscribe(
            Class<P> payloadType, EventHandler<P> handler, Predicate<CoordinationEvent<P>> filter) {
        Objects.requireNonNull(payloadType, "payloadType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        Subscription<P> subscription =
                new Subscription<>(
                        "sub_" + UUID.randomUUID(), payloadType, handler, filter, executor);
        subscriptions.add(subscription);
        logger.fine("Subscribed " + subscription.id + " to " + payloadType.getSimpleName());
        return subscription.id;
    }

    /// Subscribes to every event regardless of type.
    ///
    /// @param handler callback, not null
    /// @return subscription id for {@link #unsubscribe}, never null
    public String subscribeAll(EventHandler<EventPayload> handler) {
        return subscribe(EventPayload.class, handler, null);
    }

    /// Removes a subscription. Events already queued for it are discarded.
    ///
    /// @param subscriptionId id returned by a subscribe call
    /// @return `true` if the subscription existed
    public boolean unsubscribe(String subscriptionId) {
        for (Subscription<?> subscription : subscriptions) {
            if (subscription.id.equals(subscriptionId)) {
                subscription.active.set(false);
                subscriptions.remove(subscription);
                logger.fine("Unsubscribed " + subscriptionId);
                return true;
            }
        }
        return false;
    }

    /// Removes all subscriptions.
    public void clear() {
        int count = subscriptions.size();
        subscriptions.forEach(s -> s.active.set(false));
        subscriptions.clear();
        logger.info("Cleared " + count + " subscriptions from event bus");
    }

    /// Returns the number of active subscriptions.
    ///
    /// @return subscription count, always non-negative
    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    /// Returns whether handlers run on an executor rather than the publishing thread.
    ///
    /// @return `true` in asynchronous mode
    public boolean isAsync() {
        return executor != null;
    }

    private static final class Subscription<P extends EventPayload> {

        private final String id;
        private final Class<P> payloadType;
        private final EventHandler<P> handler;
        private final Predicate<CoordinationEvent<P>> filter;
        private final Executor executor;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final Queue<CoordinationEvent<P>> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);

        private Subscription(
                String id,
                Class<P> payloadType,
                EventHandler<P> handler,
                Predicate<CoordinationEvent<P>> filter,
                Executor executor) {
            this.id = id;
            this.payloadType = payloadType;
            this.handler = handler;
            this.filter = filter;
            this.executor = executor;
        }

        @SuppressWarnings("unchecked")
        private boolean offer(CoordinationEvent<?> event) {
            if (!active.get() || !payloadType.isInstance(event.payload())) {
                return false;
            }
            CoordinationEvent<P> typed = (CoordinationEvent<P>) event;
            try {
                if (filter != null && !filter.test(typed)) {
                    return false;
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Filter of subscription " + id + " failed", e);
                return false;
            }

            if (executor == null) {
                deliver(typed);
            } else {
                pending.add(typed);
                scheduleDrain();
            }
            return true;
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                executor.execute(this::drain);
            }
        }

        private void drain() {
            CoordinationEvent<P> next;
            while ((next = pending.poll()) != null) {
                if (active.get()) {
                    deliver(next);
                }
            }
            draining.set(false);
            // An event may have been queued between the last poll and the flag reset
            if (!pending.isEmpty()) {
                scheduleDrain();
            }
        }

        private void deliver(CoordinationEvent<P> event) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Handler of subscription " + id + " failed on " + event.type(),
                        e);
            }
        }
    }
}
