package com.jewelrec.main.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for searching a single item pool")
public class SearchRequest {

    @NotBlank
    @Schema(description = "Dataset to search", example = "diamonds", allowableValues = {"diamonds", "settings", "catalog"})
    private String dataset;

    @Schema(description = "Precomputed query vector; bypasses the embedding service")
    private float[] vector;

    @JsonProperty("query_text")
    @Schema(description = "Free-text query", example = "oval diamond under 5000")
    private String queryText;

    @JsonProperty("image_base64")
    @Schema(description = "Base64 encoded query image")
    private String imageBase64;

    @Min(1)
    @Max(100)
    @JsonProperty("top_k")
    @Schema(description = "Number of results to return", example = "10")
    private int topK = 10;

    @Schema(description = "Dataset-specific filters, e.g. {\"price_min\": 1000, \"color\": [\"D\", \"E\"]}")
    private Map<String, Object> filters;
}
