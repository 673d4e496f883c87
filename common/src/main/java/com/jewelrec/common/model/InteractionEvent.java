package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One logged user interaction. The embedding is stored normalized.
 */
@Builder
public record InteractionEvent(
    @JsonProperty("type")
    InteractionType type,

    @JsonProperty("item_embedding")
    float[] itemEmbedding,

    @JsonProperty("weight")
    double weight,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("item_id")
    String itemId
) {
    @JsonCreator
    public InteractionEvent {
        if (type == null) {
            throw new IllegalArgumentException("Interaction type cannot be null");
        }
        if (itemEmbedding == null || itemEmbedding.length == 0) {
            throw new IllegalArgumentException("Item embedding cannot be null or empty");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("Weight must be non-negative");
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InteractionEvent other
            && type == other.type
            && Arrays.equals(itemEmbedding, other.itemEmbedding)
            && Double.compare(weight, other.weight) == 0
            && timestamp.equals(other.timestamp)
            && Objects.equals(itemId, other.itemId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, Arrays.hashCode(itemEmbedding), weight, timestamp, itemId);
    }
}
