package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A scored (diamond, setting) pair. {@code pairEmbedding} is the normalized
 * average of both item embeddings.
 */
public record Combination(
    @JsonProperty("diamond")
    SearchResult diamond,

    @JsonProperty("setting")
    SearchResult setting,

    @JsonIgnore
    float[] pairEmbedding,

    @JsonProperty("combination_score")
    double score,

    @JsonProperty("score_breakdown")
    ScoreBreakdown breakdown
) {
    public Combination {
        if (diamond == null || setting == null) {
            throw new IllegalArgumentException("Combination needs both a diamond and a setting");
        }
        if (pairEmbedding == null || pairEmbedding.length == 0) {
            throw new IllegalArgumentException("Pair embedding cannot be null or empty");
        }
    }

    /** Sum of both prices; a missing price counts as zero. */
    @JsonProperty("total_price")
    public double totalPrice() {
        return diamond.metadata().price().orElse(0.0) + setting.metadata().price().orElse(0.0);
    }

    public Combination withScore(double newScore, ScoreBreakdown newBreakdown) {
        return new Combination(diamond, setting, pairEmbedding, newScore, newBreakdown);
    }
}
