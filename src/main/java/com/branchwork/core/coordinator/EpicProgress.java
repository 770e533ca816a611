package com.branchwork.core.coordinator;

import java.util.Map;

/**
 * Completion summary of an epic's sub-tasks.
 *
 * @param statusCounts number of assignments per status
 * @param failures     error message per failed sub-task id
 */
public record EpicProgress(
    String epicId,
    int total,
    Map<SubIssueStatus, Integer> statusCounts,
    Map<String, String> failures
) {

    public int count(SubIssueStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }

    public double completionRatio() {
        return total == 0 ? 0.0 : (double) count(SubIssueStatus.COMPLETED) / total;
    }

    public boolean isFinished() {
        return count(SubIssueStatus.COMPLETED) + count(SubIssueStatus.FAILED) == total;
    }
}
