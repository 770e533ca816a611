package com.branchwork.core.branch;

/**
 * Stage of a reasoning chain recorded on a branch.
 */
public enum ReasoningKind {
    THINKING,
    DRAFT,
    CRITIQUE,
    IMPROVE,
    FINAL_SPEC
}
