package io.conclave.core.capability;

import java.util.Map;

/// Moves task context from one agent to another.
///
/// `receive(send(from, to, task, ctx), to)` yields a context deep-equal to `ctx`.
public interface ContextTransfer {

    /// Packages a context for a recipient.
    ///
    /// @return transfer id to pass to {@link #receive}, never null
    /// @throws io.conclave.core.exception.CoordinationException if the context cannot be sent
    String send(
            String sourceAgentId, String targetAgentId, String taskId, Map<String, Object> context);

    /// Claims a context sent to the recipient. Each transfer can be received once.
    ///
    /// @throws io.conclave.core.exception.CoordinationException if the transfer is unknown,
    ///     addressed to another agent or already received
    Map<String, Object> receive(String transferId, String recipientAgentId);
}
