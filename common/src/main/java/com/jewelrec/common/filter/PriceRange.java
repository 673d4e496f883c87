package com.jewelrec.common.filter;

import com.jewelrec.common.exception.InvalidFilterException;
import com.jewelrec.common.model.ItemAttributes;

/**
 * Inclusive price range, in catalog currency.
 */
public record PriceRange(Double min, Double max) implements FilterCriterion {

    public PriceRange {
        NumericRange.validateBounds(ItemAttributes.PRICE, min, max);
        if ((min != null && min < 0) || (max != null && max < 0)) {
            throw new InvalidFilterException("Price bounds cannot be negative");
        }
    }

    @Override
    public String attribute() {
        return ItemAttributes.PRICE;
    }

    public boolean contains(double price) {
        return (min == null || price >= min) && (max == null || price <= max);
    }
}
