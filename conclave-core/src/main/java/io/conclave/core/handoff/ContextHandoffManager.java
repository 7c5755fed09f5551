package io.conclave.core.handoff;

import io.conclave.core.compression.CompressionProvider;
import io.conclave.core.event.EventBus;
import io.conclave.core.event.EventPayload;
import io.conclave.core.exception.CompressionException;
import io.conclave.core.exception.ConflictException;
import io.conclave.core.exception.CoordinationError;
import io.conclave.core.exception.InternalException;
import io.conclave.core.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Transfers a task's accumulated context from one agent to another, exactly once.
///
/// ### Flow
/// ```
/// initiateHandoff:  context -> serialize -> compress -> save PENDING -> handoff.initiated
/// completeHandoff:  load -> check PENDING and target -> decompress -> deserialize
///                   -> save COMPLETED -> handoff.completed
/// ```
///
/// ### Contracts
/// - **Postcondition**: a failed initiation leaves no record behind
/// - **Postcondition**: `completeHandoff(initiateHandoff(ctx).handoffId(), target)` is
///   deep-equal to `ctx`
/// - **Invariant**: a handoff is consumed at most once; later attempts fail with
///   {@link ConflictException}
///
/// @implNote Thread-safe. Completion and cancellation of one handoff id are serialized
/// on a per-id monitor, so exactly one of several concurrent completions succeeds.
///
/// @see HandoffRepository for storage
/// @see CompressionProvider
/// @see ContextSerializer
public class ContextHandoffManager {

    private static final Logger logger = Logger.getLogger(ContextHandoffManager.class.getName());
    private static final String SOURCE = "handoff-manager";

    /// Failure reason recorded by {@link #cancelHandoff}.
    public static final String CANCELLED = "Cancelled";

    private final EventBus eventBus;
    private final CompressionProvider compression;
    private final ContextSerializer serializer;
    private final HandoffRepository repository;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    /// Creates a manager with in-memory storage.
    public ContextHandoffManager(
            EventBus eventBus, CompressionProvider compression, ContextSerializer serializer) {
        this(eventBus, compression, serializer, new InMemoryHandoffRepository());
    }

    /// Creates a manager.
    ///
    /// @param eventBus bus for handoff events, not null
    /// @param compression compression collaborator, not null
    /// @param serializer context text codec, not null
    /// @param repository record storage, not null
    public ContextHandoffManager(
            EventBus eventBus,
            CompressionProvider compression,
            ContextSerializer serializer,
            HandoffRepository repository) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.compression = Objects.requireNonNull(compression, "compression must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    /// Compresses a context and stores it as a pending handoff.
    ///
    /// Never throws for collaborator failures. Serialization or compression errors abort
    /// the initiation, publish `handoff.failed` and return a failed response.
    ///
    /// @apiNote **Side effects**:
    /// - Saves a {@link HandoffStatus#PENDING} record on success
    /// - Publishes `handoff.initiated` or `handoff.failed`
    ///
    /// @param request handoff request, not null
    /// @return response carrying the handoff id and sizes, or the failure, never null
    public HandoffResponse initiateHandoff(HandoffRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        if (request.sourceAgentId().equals(request.targetAgentId())) {
            return abort(request, CoordinationError.validation(
                    "Source and target agent must differ: " + request.sourceAgentId()));
        }

        String text;
        try {
            text = serializer.serialize(request.context());
        } catch (IllegalArgumentException e) {
            return abort(
                    request,
                    CoordinationError.validation(
                            "Context of task "
                                    + request.taskId()
                                    + " cannot be serialized: "
                                    + e.getMessage()));
        }

        byte[] payload;
        try {
            payload = compression.compress(text);
        } catch (CompressionException | RuntimeException e) {
            logger.log(Level.WARNING, "Compression failed for task " + request.taskId(), e);
            return abort(
                    request, CoordinationError.internal("Compression failed: " + e.getMessage()));
        }

        int originalSize = text.getBytes(StandardCharsets.UTF_8).length;
        String handoffId = newHandoffId(request);
        HandoffRecord record = HandoffRecord.pending(handoffId, request, payload, originalSize);
        repository.save(record);

        logger.info(
                "Initiated handoff "
                        + handoffId
                        + " ("
                        + originalSize
                        + " -> "
                        + payload.length
                        + " bytes)");
        eventBus.publish(
                SOURCE,
                new EventPayload.HandoffInitiated(
                        handoffId,
                        request.sourceAgentId(),
                        request.targetAgentId(),
                        request.taskId(),
                        originalSize,
                        payload.length));
        return HandoffResponse.ok(handoffId, originalSize, payload.length);
    }

    /// Consumes a pending handoff and returns its context.
    ///
    /// @apiNote **Side effects**:
    /// - Marks the record {@link HandoffStatus#COMPLETED}, or {@link HandoffStatus#FAILED}
    ///   when the payload cannot be restored
    /// - Publishes `handoff.completed` or `handoff.failed`
    ///
    /// @param handoffId handoff to consume, not null
    /// @param targetAgentId agent claiming the context, must match the record's target
    /// @return the original context, never null
    /// @throws ValidationException if the handoff is unknown or addressed to another agent
    /// @throws ConflictException if the handoff is already completed or failed
    /// @throws InternalException if the stored payload cannot be restored
    public Map<String, Object> completeHandoff(String handoffId, String targetAgentId) {
        Objects.requireNonNull(handoffId, "handoffId must not be null");
        Objects.requireNonNull(targetAgentId, "targetAgentId must not be null");

        if (repository.findById(handoffId).isEmpty()) {
            throw new ValidationException("Handoff not found: " + handoffId);
        }
        Object lock = locks.computeIfAbsent(handoffId, k -> new Object());
        synchronized (lock) {
            HandoffRecord record = repository.findById(handoffId).orElse(null);
            if (record == null) {
                locks.remove(handoffId);
                throw new ValidationException("Handoff not found: " + handoffId);
            }
            if (record.status() == HandoffStatus.COMPLETED) {
                locks.remove(handoffId);
                throw new ConflictException("AlreadyCompleted: handoff " + handoffId);
            }
            if (record.status() == HandoffStatus.FAILED) {
                locks.remove(handoffId);
                throw new ConflictException(
                        "Handoff " + handoffId + " already failed: " + record.failureReason());
            }
            if (!record.targetAgentId().equals(targetAgentId)) {
                logger.warning(
                        "Agent " + targetAgentId + " tried to complete handoff " + handoffId
                                + " addressed to " + record.targetAgentId());
                throw new ValidationException(
                        "Handoff " + handoffId + " is not addressed to agent " + targetAgentId);
            }

            Map<String, Object> context;
            try {
                context =
                        serializer.deserialize(compression.decompress(record.compressedPayload()));
            } catch (CompressionException | RuntimeException e) {
                markFailed(record, "Payload cannot be restored: " + e.getMessage());
                throw new InternalException("Failed to restore context of handoff " + handoffId, e);
            }

            repository.save(record.completed());
            locks.remove(handoffId);
            logger.info("Completed handoff " + handoffId + " by " + targetAgentId);
            eventBus.publish(SOURCE, new EventPayload.HandoffCompleted(handoffId, targetAgentId));
            return context;
        }
    }

    /// Abandons a pending handoff.
    ///
    /// @param handoffId handoff to cancel, not null
    /// @return `true` if a pending handoff was marked failed, `false` if it was unknown or
    ///     already terminal
    public boolean cancelHandoff(String handoffId) {
        Objects.requireNonNull(handoffId, "handoffId must not be null");
        if (repository.findById(handoffId).isEmpty()) {
            return false;
        }
        Object lock = locks.computeIfAbsent(handoffId, k -> new Object());
        synchronized (lock) {
            Optional<HandoffRecord> record = repository.findById(handoffId);
            if (record.isEmpty() || record.get().status().isTerminal()) {
                locks.remove(handoffId);
                return false;
            }
            markFailed(record.get(), CANCELLED);
            return true;
        }
    }

    /// Returns the status of a handoff.
    ///
    /// @param handoffId handoff identifier, not null
    /// @return current status, or empty if unknown
    public Optional<HandoffStatus> getHandoffStatus(String handoffId) {
        return repository.findById(handoffId).map(HandoffRecord::status);
    }

    public Optional<HandoffRecord> getHandoff(String handoffId) {
        return repository.findById(handoffId);
    }

    /// Returns handoffs waiting for an agent, oldest first.
    public List<HandoffRecord> getPendingHandoffs(String targetAgentId) {
        return repository.findPendingForTarget(targetAgentId);
    }

    int getLockCount() {
        return locks.size();
    }

    private void markFailed(HandoffRecord record, String why) {
        repository.save(record.failed(why));
        locks.remove(record.handoffId());
        logger.warning("Handoff " + record.handoffId() + " failed: " + why);
        eventBus.publish(
                SOURCE,
                new EventPayload.HandoffFailed(
                        record.handoffId(), record.sourceAgentId(), record.targetAgentId(), why));
    }

    private HandoffResponse abort(HandoffRequest request, CoordinationError error) {
        logger.warning("Handoff initiation aborted for task " + request.taskId() + ": " + error);
        eventBus.publish(
                SOURCE,
                new EventPayload.HandoffFailed(
                        null, request.sourceAgentId(), request.targetAgentId(), error.message()));
        return HandoffResponse.failed(error);
    }

    private static String newHandoffId(HandoffRequest request) {
        return "handoff_"
                + request.sourceAgentId()
                + "_"
                + request.targetAgentId()
                + "_"
                + System.currentTimeMillis()
                + "_"
                + Integer.toString(ThreadLocalRandom.current().nextInt(1 << 24), 36);
    }
}
