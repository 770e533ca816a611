package com.branchwork.core.coordinator;

import com.branchwork.core.security.PermissionLevel;

import java.util.Objects;

/**
 * Settings fixed for the lifetime of an {@link EpicCoordinator}.
 *
 * @param branchPrefix           prefix of branch names, {@code "{branchPrefix}-{epicId}/sub-task-{subTaskId}"}
 * @param agentPoolPrefix        prefix of agent names, {@code "{agentPoolPrefix}-{epicId}-{subTaskId}"}
 * @param autoCreateBranches     create each sub-task's branch at assignment time
 * @param autoAssignAgents       assign an agent to every sub-task when the epic is registered
 * @param maxConcurrentSubTasks  admission gate size for concurrent execution
 * @param defaultPermissionLevel level given to agents created by the coordinator
 * @param dataSourceLocation     data source referenced by newly created branches
 */
public record EpicCoordinatorConfig(
    String branchPrefix,
    String agentPoolPrefix,
    boolean autoCreateBranches,
    boolean autoAssignAgents,
    int maxConcurrentSubTasks,
    PermissionLevel defaultPermissionLevel,
    String dataSourceLocation
) {

    public EpicCoordinatorConfig {
        Objects.requireNonNull(branchPrefix, "branchPrefix");
        Objects.requireNonNull(agentPoolPrefix, "agentPoolPrefix");
        Objects.requireNonNull(defaultPermissionLevel, "defaultPermissionLevel");
        Objects.requireNonNull(dataSourceLocation, "dataSourceLocation");
        if (maxConcurrentSubTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentSubTasks must be >= 1, got " + maxConcurrentSubTasks);
        }
    }

    public static EpicCoordinatorConfig defaults() {
        return new EpicCoordinatorConfig("epic", "agent", true, true, 4, PermissionLevel.SANDBOXED, ".");
    }

    public EpicCoordinatorConfig withMaxConcurrentSubTasks(int max) {
        return new EpicCoordinatorConfig(branchPrefix, agentPoolPrefix, autoCreateBranches, autoAssignAgents,
                max, defaultPermissionLevel, dataSourceLocation);
    }

    public EpicCoordinatorConfig withAutoAssign(boolean assignAgents, boolean createBranches) {
        return new EpicCoordinatorConfig(branchPrefix, agentPoolPrefix, createBranches, assignAgents,
                maxConcurrentSubTasks, defaultPermissionLevel, dataSourceLocation);
    }

    public EpicCoordinatorConfig withDefaultPermissionLevel(PermissionLevel level) {
        return new EpicCoordinatorConfig(branchPrefix, agentPoolPrefix, autoCreateBranches, autoAssignAgents,
                maxConcurrentSubTasks, level, dataSourceLocation);
    }

    public String branchName(String epicId, String subTaskId) {
        return branchPrefix + "-" + epicId + "/sub-task-" + subTaskId;
    }

    public String agentName(String epicId, String subTaskId) {
        return agentPoolPrefix + "-" + epicId + "-" + subTaskId;
    }
}
