package com.branchwork.core.coordinator;

import com.branchwork.core.branch.ExecutionBranch;

import java.time.Instant;
import java.util.Objects;

/**
 * A sub-task bound to an agent and its own execution branch.
 * <p>
 * Values are immutable: every change goes through a {@code with...} copy that the coordinator
 * swaps into its table. A {@code FAILED} assignment always carries an error message and a
 * {@code COMPLETED} one always carries its completion time.
 *
 * @param assignedAgentId null while no agent has been assigned
 * @param branch          null until the branch is created ({@link SubIssueStatus#PENDING})
 */
public record SubIssueAssignment(
    String epicId,
    String subTaskId,
    String title,
    String description,
    String assignedAgentId,
    String branchName,
    ExecutionBranch branch,
    SubIssueStatus status,
    Instant createdAt,
    Instant completedAt,
    String errorMessage
) {

    public SubIssueAssignment {
        Objects.requireNonNull(epicId, "epicId");
        Objects.requireNonNull(subTaskId, "subTaskId");
        Objects.requireNonNull(branchName, "branchName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        if (status == SubIssueStatus.FAILED && errorMessage == null) {
            throw new IllegalArgumentException("FAILED assignment requires an error message");
        }
        if (status == SubIssueStatus.COMPLETED && completedAt == null) {
            throw new IllegalArgumentException("COMPLETED assignment requires completedAt");
        }
    }

    public boolean hasAgent() {
        return assignedAgentId != null;
    }

    public boolean hasBranch() {
        return branch != null;
    }

    public SubIssueAssignment withBranch(ExecutionBranch newBranch) {
        return new SubIssueAssignment(epicId, subTaskId, title, description, assignedAgentId, branchName,
                newBranch, status, createdAt, completedAt, errorMessage);
    }

    public SubIssueAssignment withAgent(String agentId) {
        return new SubIssueAssignment(epicId, subTaskId, title, description, agentId, branchName,
                branch, status, createdAt, completedAt, errorMessage);
    }

    /**
     * Copy with a new status. Completion time is stamped on {@code COMPLETED} if not already set;
     * the error message is replaced by {@code error} (cleared when null).
     */
    public SubIssueAssignment withStatus(SubIssueStatus newStatus, Instant now, String error) {
        Instant completed = newStatus == SubIssueStatus.COMPLETED && completedAt == null ? now : completedAt;
        return new SubIssueAssignment(epicId, subTaskId, title, description, assignedAgentId, branchName,
                branch, newStatus, createdAt, completed, error);
    }
}
