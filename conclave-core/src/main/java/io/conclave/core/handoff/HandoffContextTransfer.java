package io.conclave.core.handoff;

import io.conclave.core.capability.ContextTransfer;
import io.conclave.core.exception.CoordinationException;
import io.conclave.core.exception.ErrorKind;
import io.conclave.core.exception.InternalException;
import io.conclave.core.exception.ValidationException;
import java.util.Map;
import java.util.Objects;

/// {@link ContextTransfer} backed by a {@link ContextHandoffManager}.
///
/// A failed initiation is rethrown as the exception matching its error kind.
public class HandoffContextTransfer implements ContextTransfer {

    private final ContextHandoffManager manager;

    public HandoffContextTransfer(ContextHandoffManager manager) {
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
    }

    @Override
    public String send(
            String sourceAgentId,
            String targetAgentId,
            String taskId,
            Map<String, Object> context) {
        HandoffResponse response =
                manager.initiateHandoff(
                        HandoffRequest.of(sourceAgentId, targetAgentId, taskId, context));
        if (!response.success()) {
            throw toException(response);
        }
        return response.handoffId();
    }

    @Override
    public Map<String, Object> receive(String transferId, String recipientAgentId) {
        return manager.completeHandoff(transferId, recipientAgentId);
    }

    private static CoordinationException toException(HandoffResponse response) {
        String message = response.error() != null ? response.error().message() : "Handoff failed";
        if (response.error() != null && response.error().kind() == ErrorKind.VALIDATION) {
            return new ValidationException(message);
        }
        return new InternalException(message);
    }
}
