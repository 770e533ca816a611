package com.branchwork.core.branch;

import java.io.Serializable;
import java.util.Objects;

/**
 * Opaque handle to a resource a branch references but does not own, such as a retrieval
 * store or a data source. The orchestration core stores and forwards it, never dereferences it.
 *
 * @param kind     what the resource is, e.g. "retrieval-store" or "data-source"
 * @param location where the owner can find it
 */
public record ResourceRef(String kind, String location) implements Serializable {

    public static final String RETRIEVAL_STORE = "retrieval-store";
    public static final String DATA_SOURCE = "data-source";

    public ResourceRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
    }

    public static ResourceRef retrievalStore(String location) {
        return new ResourceRef(RETRIEVAL_STORE, location);
    }

    public static ResourceRef dataSource(String location) {
        return new ResourceRef(DATA_SOURCE, location);
    }
}
