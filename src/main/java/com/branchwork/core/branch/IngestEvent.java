package com.branchwork.core.branch;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A batch of items ingested from a source into the branch's retrieval store.
 *
 * @param source identifier of where the items came from
 * @param items  ids of the ingested items, in ingestion order
 */
public record IngestEvent(
    UUID id,
    String source,
    List<String> items,
    Instant timestamp
) implements BranchEvent {

    public IngestEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(timestamp, "timestamp");
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public BranchState applyTo(BranchState state) {
        return state.withIngest(this);
    }
}
