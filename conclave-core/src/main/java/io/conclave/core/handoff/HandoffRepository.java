package io.conclave.core.handoff;

import java.util.List;
import java.util.Optional;

/// Storage for handoff records.
///
/// The default implementation keeps records in memory. A durable implementation lets
/// pending handoffs survive a restart; the manager does not depend on durability.
///
/// @see InMemoryHandoffRepository
public interface HandoffRepository {

    /// Inserts or replaces a record, keyed by its handoff id.
    void save(HandoffRecord record);

    Optional<HandoffRecord> findById(String handoffId);

    /// Returns pending handoffs addressed to an agent.
    List<HandoffRecord> findPendingForTarget(String targetAgentId);

    List<HandoffRecord> findAll();

    boolean delete(String handoffId);
}
