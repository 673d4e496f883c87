package com.jewelrec.common.filter;

import com.jewelrec.common.exception.InvalidFilterException;

/**
 * Inclusive range over a numeric attribute. Either bound may be open.
 */
public record NumericRange(String attribute, Double min, Double max) implements FilterCriterion {

    public NumericRange {
        if (attribute == null || attribute.isBlank()) {
            throw new InvalidFilterException("Range attribute cannot be empty");
        }
        validateBounds(attribute, min, max);
    }

    public boolean contains(double value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }

    static void validateBounds(String attribute, Double min, Double max) {
        if (min == null && max == null) {
            throw new InvalidFilterException("Range on '" + attribute + "' needs at least one bound");
        }
        if ((min != null && min.isNaN()) || (max != null && max.isNaN())) {
            throw new InvalidFilterException("Range on '" + attribute + "' has a non-numeric bound");
        }
        if (min != null && max != null && min > max) {
            throw new InvalidFilterException(
                String.format("Range on '%s' is empty: min %s > max %s", attribute, min, max));
        }
    }
}
