package io.conclave.core.handoff;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory handoff repository (default implementation).
///
/// Thread-safe, no external dependencies.
///
/// @see HandoffRepository for contract
public final class InMemoryHandoffRepository implements HandoffRepository {

    private final Map<String, HandoffRecord> storage = new ConcurrentHashMap<>();

    @Override
    public void save(HandoffRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        storage.put(record.handoffId(), record);
    }

    @Override
    public Optional<HandoffRecord> findById(String handoffId) {
        Objects.requireNonNull(handoffId, "handoffId must not be null");
        return Optional.ofNullable(storage.get(handoffId));
    }

    @Override
    public List<HandoffRecord> findPendingForTarget(String targetAgentId) {
        Objects.requireNonNull(targetAgentId, "targetAgentId must not be null");
        return storage.values().stream()
                .filter(r -> r.status() == HandoffStatus.PENDING)
                .filter(r -> targetAgentId.equals(r.targetAgentId()))
                .sorted(Comparator.comparing(HandoffRecord::createdAt))
                .toList();
    }

    @Override
    public List<HandoffRecord> findAll() {
        return storage.values().stream()
                .sorted(Comparator.comparing(HandoffRecord::createdAt))
                .toList();
    }

    @Override
    public boolean delete(String handoffId) {
        Objects.requireNonNull(handoffId, "handoffId must not be null");
        return storage.remove(handoffId) != null;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }

    public int size() {
        return storage.size();
    }
}
