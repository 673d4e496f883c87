package com.jewelrec.main.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jewelrec.common.model.SearchResult;

import java.util.List;

public record SearchResponse(
    @JsonProperty("results")
    List<SearchResult> results,

    @JsonProperty("query_info")
    QueryInfo queryInfo
) {
}
