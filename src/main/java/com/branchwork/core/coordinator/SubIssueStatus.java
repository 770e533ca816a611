package com.branchwork.core.coordinator;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a sub-task assignment:
 * {@code PENDING -> BRANCH_CREATED -> IN_PROGRESS -> COMPLETED | FAILED}.
 * <p>
 * A sub-task may also fail before it starts (cancelled or denied), from {@code PENDING} or
 * {@code BRANCH_CREATED}. {@code COMPLETED} and {@code FAILED} are terminal; retrying means
 * replacing the assignment, never leaving a terminal state.
 */
public enum SubIssueStatus {
    PENDING,
    BRANCH_CREATED,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public Set<SubIssueStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(BRANCH_CREATED, FAILED);
            case BRANCH_CREATED -> EnumSet.of(IN_PROGRESS, FAILED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(SubIssueStatus.class);
        };
    }

    public boolean canTransitionTo(SubIssueStatus next) {
        return allowedTransitions().contains(next);
    }
}
