package com.branchwork.core.branch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;

/**
 * JSON encoding of {@link BranchSnapshot}s. Events keep their concrete type through a
 * {@code "type"} discriminator; instants are written as ISO-8601 strings.
 */
public class BranchSnapshotCodec {

    private final ObjectMapper objectMapper;

    public BranchSnapshotCodec() {
        this(new ObjectMapper());
    }

    public BranchSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(ExecutionBranch branch) {
        return toJson(BranchSnapshot.capture(branch));
    }

    public String toJson(BranchSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize branch " + snapshot.name(), e);
        }
    }

    public BranchSnapshot fromJson(String json) {
        try {
            return objectMapper.readValue(json, BranchSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse branch snapshot", e);
        }
    }
}
