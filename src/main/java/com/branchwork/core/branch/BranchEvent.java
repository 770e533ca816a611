package com.branchwork.core.branch;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable, timestamped entry in an {@link ExecutionBranch}. Once appended it is never removed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ReasoningStep.class, name = "reasoning"),
        @JsonSubTypes.Type(value = IngestEvent.class, name = "ingest")
})
public sealed interface BranchEvent permits ReasoningStep, IngestEvent {

    UUID id();

    Instant timestamp();

    /**
     * Folds this event into {@code state}. Each event kind implements its own step of the replay.
     */
    BranchState applyTo(BranchState state);
}
