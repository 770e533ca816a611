package com.branchwork.core.branch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State materialized by replaying a branch's events.
 *
 * @param branchName     name of the replayed branch
 * @param reasoningChain reasoning states in the order they were recorded
 * @param ingestedItems  distinct ingested item ids, in first-seen order
 * @param stepsByKind    number of reasoning steps per kind
 * @param toolCallCount  total tool executions across all reasoning steps
 * @param eventCount     number of events folded so far
 * @param firstEventAt   timestamp of the first event, null when empty
 * @param lastEventAt    timestamp of the last event, null when empty
 */
public record BranchState(
    String branchName,
    List<ReasoningState> reasoningChain,
    List<String> ingestedItems,
    Map<ReasoningKind, Integer> stepsByKind,
    int toolCallCount,
    int eventCount,
    Instant firstEventAt,
    Instant lastEventAt
) {

    public static BranchState initial(String branchName) {
        return new BranchState(branchName, List.of(), List.of(), Map.of(), 0, 0, null, null);
    }

    public Optional<ReasoningState> latestReasoning() {
        return reasoningChain.isEmpty()
                ? Optional.empty()
                : Optional.of(reasoningChain.get(reasoningChain.size() - 1));
    }

    public int stepsOf(ReasoningKind kind) {
        return stepsByKind.getOrDefault(kind, 0);
    }

    /**
     * Returns the state after applying one more event.
     */
    public BranchState apply(BranchEvent event) {
        return event.applyTo(this);
    }

    BranchState withReasoning(ReasoningStep step) {
        var chain = new ArrayList<>(reasoningChain);
        chain.add(step.state());
        var counts = new EnumMap<ReasoningKind, Integer>(ReasoningKind.class);
        counts.putAll(stepsByKind);
        counts.merge(step.kind(), 1, Integer::sum);
        return new BranchState(branchName, Collections.unmodifiableList(chain), ingestedItems,
                Collections.unmodifiableMap(counts), toolCallCount + step.toolCalls().size(),
                eventCount + 1, firstOr(step.timestamp()), step.timestamp());
    }

    BranchState withIngest(IngestEvent ingest) {
        var items = new LinkedHashSet<>(ingestedItems);
        items.addAll(ingest.items());
        return new BranchState(branchName, reasoningChain, List.copyOf(items), stepsByKind,
                toolCallCount, eventCount + 1, firstOr(ingest.timestamp()), ingest.timestamp());
    }

    private Instant firstOr(Instant at) {
        return firstEventAt == null ? at : firstEventAt;
    }
}
