package com.branchwork.core.agent;

/**
 * Availability of an agent as seen by the registry at a point in time.
 */
public enum AgentStatus {
    /** Alive and not running any sub-task. */
    AVAILABLE,
    /** Alive and running at least one sub-task. */
    BUSY,
    /** Heartbeat older than the liveness timeout. */
    OFFLINE
}
