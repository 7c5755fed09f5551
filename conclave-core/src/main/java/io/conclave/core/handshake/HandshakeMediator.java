package io.conclave.core.handshake;

import io.conclave.core.capability.ContextTransfer;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.CoordinationError;
import io.conclave.core.exception.CoordinationException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;

/// Pairwise capability negotiation and state sync between agents.
///
/// ### Handshake
/// The source's protocol version is compared with the target's advertised version
/// ({@link #registerEndpoint}); targets without an endpoint are assumed to speak
/// {@link HandshakeSettings#protocolVersion()}. Versions are compatible when their major
/// components are equal. Both outcomes are recorded; only accepted handshakes allow
/// {@link #syncState} and {@link #negotiateTask}.
///
/// Negotiated capabilities are the intersection of what the source requests and what the
/// target advertises. A target that advertises nothing accepts every requested capability.
///
/// ### State Sync
/// Each party of an accepted handshake has a view of shared state that the other party
/// writes to. `FULL` replaces the view; `INCREMENTAL` merges key by key.
///
/// ### Admission
/// At most {@link HandshakeSettings#maxActiveHandshakes()} requests are negotiated at the
/// same time. A slot is held only while {@link #initiateHandshake} runs; accepted sessions
/// stay open until {@link #closeHandshake} without counting against the limit.
///
/// All operations report failures in their response objects and never throw for a
/// rejected request.
///
/// @implNote Thread-safe. Records and views live in {@link ConcurrentHashMap}s; each view
/// is replaced atomically with {@link ConcurrentHashMap#compute}.
public class HandshakeMediator {

    private static final Logger logger = Logger.getLogger(HandshakeMediator.class.getName());
    private static final String SOURCE = "handshake-mediator";

    private final EventBus eventBus;
    private final HandshakeSettings settings;
    private final ContextTransfer contextTransfer;
    private final Map<String, AgentEndpoint> endpoints = new ConcurrentHashMap<>();
    private final Map<String, HandshakeRecord> handshakes = new ConcurrentHashMap<>();
    private final Set<String> established = ConcurrentHashMap.newKeySet();
    private final Map<String, Map<String, Object>> views = new ConcurrentHashMap<>();
    private final Semaphore inFlight;

    public HandshakeMediator(EventBus eventBus) {
        this(eventBus, HandshakeSettings.defaults(), null);
    }

    /// Creates a mediator.
    ///
    /// @param eventBus bus for handshake events, not null
    /// @param settings mediator configuration, not null
    /// @param contextTransfer transfer used to ship task context on negotiation, may be null
    public HandshakeMediator(
            EventBus eventBus, HandshakeSettings settings, ContextTransfer contextTransfer) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.contextTransfer = contextTransfer;
        this.inFlight = new Semaphore(settings.maxActiveHandshakes());
    }

    /// Declares the version and capabilities an agent accepts handshakes with.
    ///
    /// @param agentId agent identifier, not null
    /// @param protocolVersion `major.minor` version, not null
    /// @param capabilities advertised capabilities, may be empty
    /// @return the stored endpoint, never null
    public AgentEndpoint registerEndpoint(
            String agentId, String protocolVersion, Set<String> capabilities) {
        AgentEndpoint endpoint = new AgentEndpoint(agentId, protocolVersion, capabilities);
        endpoints.put(agentId, endpoint);
        logger.info("Registered endpoint " + agentId + " (protocol " + protocolVersion + ")");
        return endpoint;
    }

    public Optional<AgentEndpoint> getEndpoint(String agentId) {
        return Optional.ofNullable(endpoints.get(agentId));
    }

    /// Negotiates a collaboration between two agents.
    ///
    /// @apiNote **Side effects**:
    /// - Stores a {@link HandshakeRecord} for every processed request, accepted or not
    /// - Publishes `a2a.handshake.completed`
    ///
    /// @param request handshake request, not null
    /// @return outcome; `CAPACITY` when too many requests are being negotiated, never null
    public HandshakeResponse initiateHandshake(HandshakeRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        if (!settings.handshakeEnabled()) {
            return HandshakeResponse.failed(CoordinationError.protocol("Handshakes are disabled"));
        }
        if (request.sourceAgentId().equals(request.targetAgentId())) {
            return HandshakeResponse.failed(
                    CoordinationError.validation("An agent cannot handshake with itself"));
        }
        if (!inFlight.tryAcquire()) {
            logger.warning("Handshake limit reached (" + settings.maxActiveHandshakes() + ")");
            return HandshakeResponse.failed(
                    CoordinationError.capacity(
                            "Too many handshakes in flight: " + settings.maxActiveHandshakes()));
        }
        try {
            return negotiate(request);
        } finally {
            inFlight.release();
        }
    }

    private HandshakeResponse negotiate(HandshakeRequest request) {
        AgentEndpoint target =
                endpoints.getOrDefault(
                        request.targetAgentId(),
                        new AgentEndpoint(
                                request.targetAgentId(), settings.protocolVersion(), Set.of()));

        Optional<String> sourceMajor = majorVersion(request.protocolVersion());
        Optional<String> targetMajor = majorVersion(target.protocolVersion());
        if (sourceMajor.isEmpty()) {
            return HandshakeResponse.failed(
                    CoordinationError.validation(
                            "Malformed protocol version: " + request.protocolVersion()));
        }

        String handshakeId = newId("handshake", request.sourceAgentId(), request.targetAgentId());

        if (!sourceMajor.equals(targetMajor)) {
            HandshakeRecord rejected =
                    new HandshakeRecord(
                            handshakeId,
                            request.sourceAgentId(),
                            request.targetAgentId(),
                            Set.of(),
                            target.protocolVersion(),
                            false,
                            Instant.now());
            handshakes.put(handshakeId, rejected);
            logger.warning(
                    "Handshake "
                            + handshakeId
                            + " rejected: protocol "
                            + request.protocolVersion()
                            + " incompatible with "
                            + target.protocolVersion());
            publishCompleted(rejected);
            return new HandshakeResponse(
                    true,
                    false,
                    handshakeId,
                    target.protocolVersion(),
                    Set.of(),
                    CoordinationError.protocol(
                            "Protocol version mismatch: "
                                    + request.protocolVersion()
                                    + " vs "
                                    + target.protocolVersion()));
        }

        Set<String> negotiated = new HashSet<>(request.capabilities());
        if (!target.capabilities().isEmpty()) {
            negotiated.retainAll(target.capabilities());
        }

        HandshakeRecord accepted =
                new HandshakeRecord(
                        handshakeId,
                        request.sourceAgentId(),
                        request.targetAgentId(),
                        negotiated,
                        request.protocolVersion(),
                        true,
                        Instant.now());

        handshakes.put(handshakeId, accepted);
        established.add(handshakeId);

        logger.info(
                "Handshake "
                        + handshakeId
                        + " accepted between "
                        + request.sourceAgentId()
                        + " and "
                        + request.targetAgentId());
        publishCompleted(accepted);
        return new HandshakeResponse(
                true, true, handshakeId, accepted.protocolVersion(), negotiated, null);
    }

    /// Pushes state from one party of an accepted handshake to the other.
    ///
    /// @apiNote **Side effects**:
    /// - Replaces or merges the counterpart's view of shared state
    /// - Publishes `a2a.state.synced`
    ///
    /// @param request sync request, not null
    /// @return outcome; `VALIDATION` for an unknown handshake or a non-party sender,
    ///     `PROTOCOL` for a rejected or closed handshake or disabled sync, never null
    public StateSyncResponse syncState(StateSyncRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        if (!settings.stateSyncEnabled()) {
            return StateSyncResponse.failed(CoordinationError.protocol("State sync is disabled"));
        }
        HandshakeRecord record = handshakes.get(request.handshakeId());
        if (record == null) {
            return StateSyncResponse.failed(
                    CoordinationError.validation("Handshake not found: " + request.handshakeId()));
        }
        Optional<CoordinationError> unusable = checkUsable(record);
        if (unusable.isPresent()) {
            return StateSyncResponse.failed(unusable.get());
        }
        String receiver = record.counterpartOf(request.sourceAgentId());
        if (receiver == null) {
            return StateSyncResponse.failed(
                    CoordinationError.validation(
                            "Agent " + request.sourceAgentId() + " is not a party of "
                                    + request.handshakeId()));
        }

        views.compute(
                viewKey(record.handshakeId(), receiver),
                (key, current) -> apply(current, request.syncType(), request.state()));

        String syncId = newId("sync", request.sourceAgentId(), receiver);
        logger.fine(
                "Synced " + request.state().size() + " keys (" + request.syncType() + ") to "
                        + receiver + " over " + record.handshakeId());
        eventBus.publish(
                SOURCE,
                new EventPayload.StateSynced(
                        syncId,
                        record.handshakeId(),
                        request.syncType().name().toLowerCase(Locale.ROOT),
                        List.copyOf(request.state().keySet())));
        return new StateSyncResponse(true, syncId, null);
    }

    /// Proposes delegating a task over an accepted handshake.
    ///
    /// The partner accepts when the negotiated capabilities cover the required ones. On
    /// acceptance a non-empty task context is shipped through the configured
    /// {@link ContextTransfer}, when one exists. Estimated latency is
    /// `min(100 + 0.1 * descriptionLength, 1000)` milliseconds.
    ///
    /// @apiNote **Side effects**:
    /// - May create a pending handoff addressed to the partner
    /// - Publishes `a2a.task.negotiated`
    ///
    /// @param request negotiation request, not null
    /// @return outcome, never null
    public TaskNegotiationResponse negotiateTask(TaskNegotiationRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        if (!settings.taskNegotiationEnabled()) {
            return TaskNegotiationResponse.failed(
                    CoordinationError.protocol("Task negotiation is disabled"));
        }
        HandshakeRecord record = handshakes.get(request.handshakeId());
        if (record == null) {
            return TaskNegotiationResponse.failed(
                    CoordinationError.validation("Handshake not found: " + request.handshakeId()));
        }
        Optional<CoordinationError> unusable = checkUsable(record);
        if (unusable.isPresent()) {
            return TaskNegotiationResponse.failed(unusable.get());
        }

        String negotiationId =
                newId("negotiation", record.sourceAgentId(), record.targetAgentId());
        Set<String> missing = new HashSet<>(request.requiredCapabilities());
        missing.removeAll(record.capabilities());
        if (!missing.isEmpty()) {
            logger.info("Negotiation " + negotiationId + " declined, missing " + missing);
            publishNegotiated(negotiationId, record, request, false, 0);
            return new TaskNegotiationResponse(
                    true,
                    false,
                    negotiationId,
                    0,
                    null,
                    CoordinationError.capacity("Missing capabilities: " + missing));
        }

        long latency = estimateLatency(request.task().description());
        String handoffId = null;
        if (contextTransfer != null && !request.task().context().isEmpty()) {
            try {
                handoffId =
                        contextTransfer.send(
                                record.sourceAgentId(),
                                record.targetAgentId(),
                                request.task().id(),
                                request.task().context());
            } catch (CoordinationException e) {
                logger.warning("Negotiation " + negotiationId + " failed to ship context: "
                        + e.getMessage());
                return new TaskNegotiationResponse(
                        false, false, negotiationId, 0, null, e.toError());
            }
        }

        publishNegotiated(negotiationId, record, request, true, latency);
        return new TaskNegotiationResponse(true, true, negotiationId, latency, handoffId, null);
    }

    /// Returns an agent's view of the state shared over a handshake.
    ///
    /// @return unmodifiable copy, empty when nothing was synced
    public Map<String, Object> getSharedState(String handshakeId, String agentId) {
        Map<String, Object> view = views.get(viewKey(handshakeId, agentId));
        return view != null ? view : Map.of();
    }

    public Optional<HandshakeRecord> getHandshake(String handshakeId) {
        return Optional.ofNullable(handshakes.get(handshakeId));
    }

    /// Ends an accepted handshake and discards its shared state.
    ///
    /// The record is kept for inspection; later syncs and negotiations over it fail with
    /// a `PROTOCOL` error.
    ///
    /// @return `true` if the handshake was open
    public boolean closeHandshake(String handshakeId) {
        HandshakeRecord record = handshakes.get(handshakeId);
        if (record == null || !established.remove(handshakeId)) {
            return false;
        }
        views.remove(viewKey(handshakeId, record.sourceAgentId()));
        views.remove(viewKey(handshakeId, record.targetAgentId()));
        logger.info("Closed handshake " + handshakeId);
        return true;
    }

    /// Returns the number of accepted handshakes that have not been closed.
    public int getActiveHandshakeCount() {
        return established.size();
    }

    /// Returns the number of requests currently being negotiated.
    public int getInFlightHandshakeCount() {
        return settings.maxActiveHandshakes() - inFlight.availablePermits();
    }

    private Optional<CoordinationError> checkUsable(HandshakeRecord record) {
        if (!record.accepted()) {
            return Optional.of(
                    CoordinationError.protocol(
                            "Handshake " + record.handshakeId() + " was not accepted"));
        }
        if (!established.contains(record.handshakeId())) {
            return Optional.of(
                    CoordinationError.protocol("Handshake " + record.handshakeId() + " is closed"));
        }
        return Optional.empty();
    }

    static long estimateLatency(String description) {
        return Math.min(100L + Math.round(description.length() * 0.1), 1000L);
    }

    static Optional<String> majorVersion(String version) {
        if (version == null) {
            return Optional.empty();
        }
        String major = version.trim().split("\\.", -1)[0];
        return major.isEmpty() ? Optional.empty() : Optional.of(major);
    }

    private static Map<String, Object> apply(
            Map<String, Object> current, SyncType syncType, Map<String, Object> update) {
        Map<String, Object> next =
                syncType == SyncType.FULL || current == null
                        ? new LinkedHashMap<>()
                        : new LinkedHashMap<>(current);
        update.forEach(
                (key, value) -> {
                    if (value == null && syncType == SyncType.INCREMENTAL) {
                        next.remove(key);
                    } else {
                        next.put(key, value);
                    }
                });
        return Collections.unmodifiableMap(next);
    }

    private void publishCompleted(HandshakeRecord record) {
        eventBus.publish(
                SOURCE,
                new EventPayload.HandshakeCompleted(
                        record.handshakeId(),
                        record.sourceAgentId(),
                        record.targetAgentId(),
                        record.protocolVersion(),
                        record.accepted()));
    }

    private void publishNegotiated(
            String negotiationId,
            HandshakeRecord record,
            TaskNegotiationRequest request,
            boolean accepted,
            long latency) {
        eventBus.publish(
                SOURCE,
                new EventPayload.TaskNegotiated(
                        negotiationId,
                        record.handshakeId(),
                        request.task().id(),
                        accepted,
                        latency));
    }

    private static String viewKey(String handshakeId, String agentId) {
        return handshakeId + "/" + agentId;
    }

    private static String newId(String prefix, String source, String target) {
        return prefix
                + "_"
                + source
                + "_"
                + target
                + "_"
                + System.currentTimeMillis()
                + "_"
                + Integer.toString(ThreadLocalRandom.current().nextInt(1 << 24), 36);
    }
}
