package com.branchwork.core.coordinator;

import com.branchwork.core.result.Result;
import com.branchwork.core.security.OperationKind;

import java.util.Objects;
import java.util.Set;

/**
 * Caller-supplied business logic run against a sub-task assignment.
 * <p>
 * Receives the current assignment (including its branch) and returns the updated assignment,
 * typically carrying new branch events, or a failure. Long-running implementations should poll
 * {@link CancellationSignal#isCancelled()} or respond to thread interruption.
 */
@FunctionalInterface
public interface WorkFunction {

    Result<SubIssueAssignment> apply(SubIssueAssignment assignment, CancellationSignal signal) throws Exception;

    /**
     * Operations this work function performs, checked against the agent's permission level before it runs.
     */
    default Set<OperationKind> requiredOperations() {
        return Set.of(OperationKind.READ_ONLY);
    }

    static WorkFunction requiring(Set<OperationKind> operations, WorkFunction delegate) {
        Objects.requireNonNull(delegate, "delegate");
        Set<OperationKind> required = Set.copyOf(operations);
        return new WorkFunction() {
            @Override
            public Result<SubIssueAssignment> apply(SubIssueAssignment assignment, CancellationSignal signal)
                    throws Exception {
                return delegate.apply(assignment, signal);
            }

            @Override
            public Set<OperationKind> requiredOperations() {
                return required;
            }
        };
    }
}
