package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Individual terms behind a combination score.
 */
@Builder(toBuilder = true)
public record ScoreBreakdown(
    @JsonProperty("query_similarity")
    double querySimilarity,

    @JsonProperty("diamond_similarity")
    double diamondSimilarity,

    @JsonProperty("setting_similarity")
    double settingSimilarity,

    @JsonProperty("attribute_boost")
    double attributeBoost,

    @JsonProperty("compatibility")
    double compatibility,

    @JsonProperty("user_alignment")
    double userAlignment,

    @JsonProperty("collaborative_boost")
    double collaborativeBoost,

    @JsonProperty("sequential_boost")
    double sequentialBoost
) {
}
