package com.branchwork.core.branch;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A reasoning stage recorded on a branch, with the prompt that produced it.
 *
 * @param toolCalls tool executions made during the step; empty when none
 */
public record ReasoningStep(
    UUID id,
    ReasoningState state,
    Instant timestamp,
    String prompt,
    List<ToolExecution> toolCalls
) implements BranchEvent {

    public ReasoningStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(prompt, "prompt");
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    @JsonIgnore
    public ReasoningKind kind() {
        return state.kind();
    }

    @Override
    public BranchState applyTo(BranchState branchState) {
        return branchState.withReasoning(this);
    }
}
