package com.branchwork.core.result;

/**
 * Typed failure reasons returned by the orchestration core.
 */
public enum ErrorCode {
    DUPLICATE_EPIC,
    DUPLICATE_AGENT,
    DUPLICATE_SUB_TASK,
    UNKNOWN_EPIC,
    UNKNOWN_SUB_TASK,
    UNKNOWN_ASSIGNMENT,
    UNKNOWN_AGENT,
    EMPTY_SUB_TASK_LIST,
    PERMISSION_DENIED,
    INVALID_STATUS_TRANSITION,
    CANCELLED,
    WORK_FUNCTION_FAILURE,
    AGENT_LIMIT_REACHED,
    INVALID_ARGUMENT
}
