package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A diamond, setting or catalog ring loaded into a pool.
 * The embedding is unit-normalized and never mutated after loading.
 */
public record JewelryItem(
    @JsonProperty("id")
    String id,

    @JsonIgnore
    int position,

    @JsonIgnore
    float[] embedding,

    @JsonProperty("metadata")
    ItemAttributes attributes
) {
    public JewelryItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Item id cannot be null or empty");
        }
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be null or empty");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Position cannot be negative");
        }
        if (attributes == null) {
            attributes = ItemAttributes.empty();
        }
    }

    public int dimension() {
        return embedding.length;
    }
}
