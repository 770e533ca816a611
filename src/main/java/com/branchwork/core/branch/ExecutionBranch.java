package com.branchwork.core.branch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, append-only execution record of one sub-task.
 * <p>
 * Every {@code with...} operation returns a new branch whose events are this branch's events plus
 * one appended event; this instance is never modified. Two continuations built from the same
 * branch therefore share a common prefix and evolve independently (forking), and
 * {@link #replay()} reconstructs state deterministically from the event sequence.
 * <p>
 * The retrieval store and data source are {@link ResourceRef references} to externally owned
 * resources; the branch carries them along and never touches what they point to.
 */
public final class ExecutionBranch {

    private final String name;
    private final ResourceRef retrievalStore;
    private final ResourceRef dataSource;
    private final List<BranchEvent> events;

    private ExecutionBranch(String name, ResourceRef retrievalStore, ResourceRef dataSource,
                            List<BranchEvent> events) {
        this.name = Objects.requireNonNull(name, "name");
        this.retrievalStore = Objects.requireNonNull(retrievalStore, "retrievalStore");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.events = events;
    }

    /**
     * Creates an empty branch with an in-memory retrieval store and the current directory as source.
     */
    public static ExecutionBranch create(String name) {
        return create(name, ResourceRef.retrievalStore("memory:" + name), ResourceRef.dataSource("."));
    }

    public static ExecutionBranch create(String name, ResourceRef retrievalStore, ResourceRef dataSource) {
        return new ExecutionBranch(name, retrievalStore, dataSource, List.of());
    }

    /**
     * Rebuilds a branch from a previously recorded event sequence, e.g. when restoring a snapshot.
     */
    public static ExecutionBranch withEvents(String name, ResourceRef retrievalStore, ResourceRef dataSource,
                                             Collection<? extends BranchEvent> events) {
        for (BranchEvent event : events) {
            Objects.requireNonNull(event, "events must not contain null");
        }
        return new ExecutionBranch(name, retrievalStore, dataSource, List.copyOf(events));
    }

    public String name() {
        return name;
    }

    public ResourceRef retrievalStore() {
        return retrievalStore;
    }

    public ResourceRef dataSource() {
        return dataSource;
    }

    /**
     * Events in append order. The returned list is unmodifiable.
     */
    public List<BranchEvent> events() {
        return events;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public ExecutionBranch withEvent(BranchEvent event) {
        Objects.requireNonNull(event, "event");
        var appended = new ArrayList<BranchEvent>(events.size() + 1);
        appended.addAll(events);
        appended.add(event);
        return new ExecutionBranch(name, retrievalStore, dataSource, Collections.unmodifiableList(appended));
    }

    public ExecutionBranch withReasoningStep(ReasoningState state, String prompt) {
        return withReasoningStep(state, prompt, List.of());
    }

    public ExecutionBranch withReasoningStep(ReasoningState state, String prompt, List<ToolExecution> tools) {
        return withEvent(new ReasoningStep(UUID.randomUUID(), state, Instant.now(), prompt, tools));
    }

    public ExecutionBranch withIngestEvent(String source, Collection<String> itemIds) {
        Objects.requireNonNull(itemIds, "itemIds");
        return withEvent(new IngestEvent(UUID.randomUUID(), source, List.copyOf(itemIds), Instant.now()));
    }

    /**
     * Same events and store, different data source.
     */
    public ExecutionBranch withSource(ResourceRef source) {
        return new ExecutionBranch(name, retrievalStore, source, events);
    }

    /**
     * A new branch under {@code newName} that starts from this branch's events.
     */
    public ExecutionBranch fork(String newName) {
        return fork(newName, retrievalStore);
    }

    public ExecutionBranch fork(String newName, ResourceRef newStore) {
        return new ExecutionBranch(newName, newStore, dataSource, events);
    }

    /**
     * Folds the events left to right into a materialized state. Intended for inspection, not the hot path.
     */
    public BranchState replay() {
        BranchState state = BranchState.initial(name);
        for (BranchEvent event : events) {
            state = state.apply(event);
        }
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionBranch other)) return false;
        return name.equals(other.name)
                && retrievalStore.equals(other.retrievalStore)
                && dataSource.equals(other.dataSource)
                && events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, retrievalStore, dataSource, events);
    }

    @Override
    public String toString() {
        return "ExecutionBranch[" + name + ", events=" + events.size() + "]";
    }
}
