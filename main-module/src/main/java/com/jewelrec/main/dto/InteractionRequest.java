package com.jewelrec.main.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Either {@code item_embedding} or {@code dataset} with {@code item_id} identifies the item.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A user interaction with an item")
public class InteractionRequest {

    @NotBlank
    @JsonProperty("interaction_type")
    @Schema(description = "Interaction type", example = "like", allowableValues = {"click", "like", "purchase"})
    private String interactionType;

    @JsonProperty("item_embedding")
    @Schema(description = "Embedding of the item interacted with")
    private float[] itemEmbedding;

    @Schema(description = "Dataset of the referenced item", example = "diamonds")
    private String dataset;

    @JsonProperty("item_id")
    @Schema(description = "Id of the referenced item", example = "1024")
    private String itemId;

    @DecimalMin("0.0")
    @Schema(description = "Explicit weight; defaults to the type weight", example = "2.0")
    private Double weight;

    @Schema(description = "Interaction time; defaults to now", example = "2024-05-01T12:00:00Z")
    private Instant timestamp;
}
