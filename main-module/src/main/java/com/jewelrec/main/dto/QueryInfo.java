package com.jewelrec.main.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jewelrec.main.scoring.QueryHints;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "How a query was interpreted and executed")
public class QueryInfo {

    private String dataset;

    @JsonProperty("query_text")
    private String queryText;

    @JsonProperty("has_image")
    private boolean hasImage;

    @JsonProperty("top_k")
    private int topK;

    @JsonProperty("result_count")
    private int resultCount;

    private String filters;

    private QueryHints hints;

    @JsonProperty("diamond_candidates")
    private Integer diamondCandidates;

    @JsonProperty("setting_candidates")
    private Integer settingCandidates;

    @JsonProperty("pairs_scored")
    private Integer pairsScored;

    @JsonProperty("prefilter_bypassed")
    private Boolean prefilterBypassed;

    private Boolean personalized;

    private Boolean collaborative;

    @Schema(description = "Explanation when no results were found")
    private String message;
}
