package com.jewelrec.main.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jewelrec.common.model.Combination;

import java.util.List;

public record RecommendResponse(
    @JsonProperty("results")
    List<Combination> results,

    @JsonProperty("query_info")
    QueryInfo queryInfo
) {
}
