package com.jewelrec.main.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for diamond and setting combination recommendations")
public class RecommendRequest {

    @Schema(description = "Precomputed query vector; bypasses the embedding service")
    private float[] vector;

    @JsonProperty("query_text")
    @Schema(description = "Free-text query", example = "vintage rose gold ring with an oval diamond")
    private String queryText;

    @JsonProperty("image_base64")
    @Schema(description = "Base64 encoded query image")
    private String imageBase64;

    @Min(1)
    @Max(100)
    @JsonProperty("top_k")
    @Schema(description = "Number of combinations to return", example = "10")
    private int topK = 10;

    @JsonProperty("user_id")
    @Schema(description = "User to personalize for", example = "user-42")
    private String userId;

    @JsonProperty("diamond_filters")
    @Schema(description = "Filters on the diamond pool")
    private Map<String, Object> diamondFilters;

    @JsonProperty("setting_filters")
    @Schema(description = "Filters on the setting pool")
    private Map<String, Object> settingFilters;
}
