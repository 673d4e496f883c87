package com.jewelrec.main.personalization;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserSimilarity(
    @JsonProperty("user_id")
    String userId,

    @JsonProperty("similarity")
    double similarity
) {
}
