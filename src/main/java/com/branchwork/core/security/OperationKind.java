package com.branchwork.core.security;

/**
 * Category of operation a work function declares it will perform.
 */
public enum OperationKind {
    /** Read-only inspection with no side effects. */
    READ_ONLY,
    /** Writes confined to a declared working directory or resource scope. */
    SCOPED_WRITE,
    /** Anything else: processes, network, writes outside the scope. */
    UNRESTRICTED
}
