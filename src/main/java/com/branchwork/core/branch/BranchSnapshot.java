package com.branchwork.core.branch;

import java.util.List;

/**
 * Serializable capture of an {@link ExecutionBranch}, used to export a branch for audit or to
 * replay it elsewhere.
 */
public record BranchSnapshot(
    String name,
    ResourceRef retrievalStore,
    ResourceRef dataSource,
    List<BranchEvent> events
) {

    public BranchSnapshot {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static BranchSnapshot capture(ExecutionBranch branch) {
        return new BranchSnapshot(branch.name(), branch.retrievalStore(), branch.dataSource(), branch.events());
    }

    public ExecutionBranch restore() {
        return ExecutionBranch.withEvents(name, retrievalStore, dataSource, events);
    }
}
