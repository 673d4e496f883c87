package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single search hit. Score is the inner product of two unit vectors.
 */
public record SearchResult(
    @JsonIgnore
    JewelryItem item,

    @JsonProperty("score")
    double score
) {
    public SearchResult {
        if (item == null) {
            throw new IllegalArgumentException("Item cannot be null");
        }
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Score cannot be NaN");
        }
    }

    @JsonProperty("id")
    public String id() {
        return item.id();
    }

    @JsonProperty("metadata")
    public ItemAttributes metadata() {
        return item.attributes();
    }

    @JsonIgnore
    public float[] embedding() {
        return item.embedding();
    }
}
