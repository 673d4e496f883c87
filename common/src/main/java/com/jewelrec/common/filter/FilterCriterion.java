package com.jewelrec.common.filter;

/**
 * A single validated predicate over one item attribute.
 * Implementations: {@link PriceRange}, {@link NumericRange}, {@link CategoricalSet}.
 */
public interface FilterCriterion {

    /** Metadata attribute the criterion inspects. */
    String attribute();
}
