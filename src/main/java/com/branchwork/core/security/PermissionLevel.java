package com.branchwork.core.security;

/**
 * Coarse sandboxing tier assigned to an agent. Declared from least to most privileged.
 */
public enum PermissionLevel {
    /** Side-effect-free work only. */
    ISOLATED,
    /** Adds side effects confined to the agent's declared working scope. */
    SANDBOXED,
    /** No restrictions. */
    TRUSTED;

    public boolean atLeast(PermissionLevel other) {
        return compareTo(other) >= 0;
    }
}
