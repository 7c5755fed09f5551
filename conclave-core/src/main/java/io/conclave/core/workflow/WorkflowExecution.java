package io.conclave.core.workflow;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/// Handle to a workflow execution running on an executor.
///
/// Cancellation is cooperative: the execution stops at the next node boundary and its
/// result reports an `INTERNAL` error with the message {@value WorkflowOrchestrator#CANCELLED}.
public final class WorkflowExecution {

    private final String executionId;
    private final CompletableFuture<WorkflowResult> result;
    private final AtomicBoolean cancelRequested;

    WorkflowExecution(
            String executionId,
            CompletableFuture<WorkflowResult> result,
            AtomicBoolean cancelRequested) {
        this.executionId = executionId;
        this.result = result;
        this.cancelRequested = cancelRequested;
    }

    public String getExecutionId() {
        return executionId;
    }

    /// Returns the future completed with the execution's result. It never completes
    /// exceptionally for node failures; those are captured in the result.
    public CompletableFuture<WorkflowResult> result() {
        return result;
    }

    /// Requests cancellation at the next node boundary.
    ///
    /// @return `true` if the execution had not finished yet
    public boolean cancel() {
        cancelRequested.set(true);
        return !result.isDone();
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }
}
