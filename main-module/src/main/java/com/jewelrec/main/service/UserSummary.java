package com.jewelrec.main.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jewelrec.common.model.InteractionType;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a user profile without its vectors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserSummary(
    @JsonProperty("user_id")
    String userId,

    @JsonProperty("exists")
    boolean exists,

    @JsonProperty("preference_text")
    String preferenceText,

    @JsonProperty("has_vector")
    boolean hasVector,

    @JsonProperty("interaction_count")
    int interactionCount,

    @JsonProperty("interactions_by_type")
    Map<InteractionType, Long> interactionsByType,

    @JsonProperty("last_interaction")
    Instant lastInteraction,

    @JsonProperty("sparse")
    boolean sparse
) {
}
