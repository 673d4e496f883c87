package com.jewelrec.common.filter;

import com.jewelrec.common.exception.InvalidFilterException;

import java.util.List;
import java.util.Locale;

/**
 * Passes when any requested value matches the attribute. Values are held lower-cased.
 */
public record CategoricalSet(String attribute, List<String> values, MatchMode mode) implements FilterCriterion {

    public enum MatchMode {
        EXACT,
        SUBSTRING
    }

    public CategoricalSet {
        if (attribute == null || attribute.isBlank()) {
            throw new InvalidFilterException("Categorical attribute cannot be empty");
        }
        if (values == null || values.isEmpty()) {
            throw new InvalidFilterException("Filter on '" + attribute + "' needs at least one value");
        }
        values = values.stream()
            .map(v -> v.trim().toLowerCase(Locale.ROOT))
            .filter(v -> !v.isEmpty())
            .distinct()
            .toList();
        if (values.isEmpty()) {
            throw new InvalidFilterException("Filter on '" + attribute + "' needs at least one value");
        }
        if (mode == null) {
            mode = MatchMode.EXACT;
        }
    }

    /** Checks a single attribute value. */
    public boolean matches(String itemValue) {
        String candidate = itemValue.trim().toLowerCase(Locale.ROOT);
        for (String value : values) {
            boolean hit = mode == MatchMode.SUBSTRING ? candidate.contains(value) : candidate.equals(value);
            if (hit) {
                return true;
            }
        }
        return false;
    }
}
