package com.branchwork.core.branch;

import java.io.Serializable;
import java.util.Objects;

/**
 * Snapshot of a reasoning stage's output.
 *
 * @param kind the reasoning stage
 * @param text the content produced at that stage
 */
public record ReasoningState(ReasoningKind kind, String text) implements Serializable {

    public ReasoningState {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static ReasoningState draft(String text) {
        return new ReasoningState(ReasoningKind.DRAFT, text);
    }

    public static ReasoningState critique(String text) {
        return new ReasoningState(ReasoningKind.CRITIQUE, text);
    }

    public static ReasoningState improve(String text) {
        return new ReasoningState(ReasoningKind.IMPROVE, text);
    }

    public static ReasoningState finalSpec(String text) {
        return new ReasoningState(ReasoningKind.FINAL_SPEC, text);
    }
}
