package com.jewelrec.main.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Explicit user preferences")
public class PreferencesRequest {

    @Schema(description = "Preferred metal", example = "rose gold")
    private String metal;

    @Schema(description = "Preferred style", example = "vintage")
    private String style;

    @Size(min = 2, max = 2)
    @JsonProperty("price_range")
    @Schema(description = "Price range [min, max]", example = "[1000, 5000]")
    private List<Double> priceRange;

    @JsonProperty("diamond_color")
    @Schema(description = "Preferred diamond color grades", example = "D-F")
    private String diamondColor;

    @JsonProperty("diamond_shape")
    @Schema(description = "Preferred diamond shape", example = "oval")
    private String diamondShape;

    public Map<String, Object> toPreferenceMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "metal", metal);
        putIfPresent(map, "style", style);
        putIfPresent(map, "price_range", priceRange);
        putIfPresent(map, "diamond_color", diamondColor);
        putIfPresent(map, "diamond_shape", diamondShape);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
