package com.branchwork.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while epics are registered and sub-tasks execute.
 *
 * @param eventType  e.g. "epic.registered", "subtask.started", "subtask.failed", "agent.registered"
 * @param epicId     the epic this event belongs to (nullable for agent-level events)
 * @param subTaskId  the sub-task this event relates to (nullable for epic-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record OrchestrationEvent(
    String eventType,
    String epicId,
    String subTaskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
