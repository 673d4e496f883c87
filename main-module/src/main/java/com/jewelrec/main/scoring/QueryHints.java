package com.jewelrec.main.scoring;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Key attributes a query asks for. A hint is explicit when it was found in the
 * query text, inferred when it came from a majority vote over top candidates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryHints(
    @JsonProperty("metal")
    String metal,

    @JsonProperty("color")
    String color,

    @JsonProperty("shape")
    String shape,

    @JsonProperty("metal_explicit")
    boolean metalExplicit,

    @JsonProperty("color_explicit")
    boolean colorExplicit,

    @JsonProperty("shape_explicit")
    boolean shapeExplicit
) {
    private static final QueryHints NONE = new QueryHints(null, null, null, false, false, false);

    public static QueryHints none() {
        return NONE;
    }

    public boolean hasAny() {
        return metal != null || color != null || shape != null;
    }

    public boolean hasExplicit() {
        return metalExplicit || colorExplicit || shapeExplicit;
    }

    public QueryHints withInferredMetal(String inferred) {
        return metal != null || inferred == null ? this
            : new QueryHints(inferred, color, shape, false, colorExplicit, shapeExplicit);
    }

    public QueryHints withInferredColor(String inferred) {
        return color != null || inferred == null ? this
            : new QueryHints(metal, inferred, shape, metalExplicit, false, shapeExplicit);
    }

    public QueryHints withInferredShape(String inferred) {
        return shape != null || inferred == null ? this
            : new QueryHints(metal, color, inferred, metalExplicit, colorExplicit, false);
    }
}
