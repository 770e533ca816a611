package com.branchwork.core.coordinator;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A named unit of work decomposed into independent sub-tasks. Immutable once registered.
 *
 * @param subTaskIds sub-task identifiers in registration order
 */
public record Epic(
    String epicId,
    String title,
    String description,
    List<String> subTaskIds,
    Instant createdAt
) {

    public Epic {
        Objects.requireNonNull(epicId, "epicId");
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        subTaskIds = List.copyOf(subTaskIds);
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean contains(String subTaskId) {
        return subTaskIds.contains(subTaskId);
    }
}
