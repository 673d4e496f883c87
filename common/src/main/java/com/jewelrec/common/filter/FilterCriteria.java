package com.jewelrec.common.filter;

import com.jewelrec.common.exception.InvalidFilterException;
import com.jewelrec.common.exception.UnknownFilterKeyException;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.ItemAttributes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of filter criteria for one dataset, built from the loose key/value
 * form accepted at the API boundary.
 */
public final class FilterCriteria {

    private static final FilterCriteria NONE = new FilterCriteria(List.of());
    private static final String MIN_SUFFIX = "_min";
    private static final String MAX_SUFFIX = "_max";

    private final List<FilterCriterion> criteria;

    private FilterCriteria(List<FilterCriterion> criteria) {
        this.criteria = criteria;
    }

    public static FilterCriteria none() {
        return NONE;
    }

    public static FilterCriteria of(FilterCriterion... criteria) {
        return criteria.length == 0 ? NONE : new FilterCriteria(List.of(criteria));
    }

    /**
     * Parses raw filters. Numeric keys use {@code _min}/{@code _max} suffixes; categorical
     * values may be a list or a comma-delimited string. Null and empty values are ignored.
     *
     * @throws UnknownFilterKeyException if a key is not defined for the dataset
     * @throws InvalidFilterException if a value cannot be interpreted
     */
    public static FilterCriteria parse(Dataset dataset, Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return NONE;
        }
        Map<String, Double[]> ranges = new LinkedHashMap<>();
        List<FilterCriterion> result = new ArrayList<>();

        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if (key.endsWith(MIN_SUFFIX) || key.endsWith(MAX_SUFFIX)) {
                String base = key.substring(0, key.length() - MIN_SUFFIX.length());
                Dataset.FilterField field = dataset.filterField(base)
                    .filter(f -> f.kind() == Dataset.FieldKind.NUMERIC)
                    .orElseThrow(() -> unknownKey(dataset, key));
                if (value == null) {
                    continue;
                }
                Double[] bounds = ranges.computeIfAbsent(field.key(), k -> new Double[2]);
                bounds[key.endsWith(MIN_SUFFIX) ? 0 : 1] = toNumber(key, value);
                continue;
            }

            Dataset.FilterField field = dataset.filterField(key)
                .filter(f -> f.kind() != Dataset.FieldKind.NUMERIC)
                .orElseThrow(() -> unknownKey(dataset, key));
            List<String> values = toValues(value);
            if (values.isEmpty()) {
                continue;
            }
            CategoricalSet.MatchMode mode = field.kind() == Dataset.FieldKind.SUBSTRING
                ? CategoricalSet.MatchMode.SUBSTRING
                : CategoricalSet.MatchMode.EXACT;
            result.add(new CategoricalSet(field.attribute(), values, mode));
        }

        ranges.forEach((fieldKey, bounds) -> {
            String attribute = dataset.filterField(fieldKey).orElseThrow().attribute();
            if (ItemAttributes.PRICE.equals(attribute)) {
                result.add(new PriceRange(bounds[0], bounds[1]));
            } else {
                result.add(new NumericRange(attribute, bounds[0], bounds[1]));
            }
        });
        return result.isEmpty() ? NONE : new FilterCriteria(Collections.unmodifiableList(result));
    }

    /**
     * Returns a copy where {@code criterion} replaces any criterion on the same attribute.
     */
    public FilterCriteria with(FilterCriterion criterion) {
        Objects.requireNonNull(criterion, "criterion");
        List<FilterCriterion> updated = new ArrayList<>();
        for (FilterCriterion existing : criteria) {
            if (!existing.attribute().equals(criterion.attribute())) {
                updated.add(existing);
            }
        }
        updated.add(criterion);
        return new FilterCriteria(Collections.unmodifiableList(updated));
    }

    public List<FilterCriterion> criteria() {
        return criteria;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    private static UnknownFilterKeyException unknownKey(Dataset dataset, String key) {
        return new UnknownFilterKeyException(
            String.format("Unknown filter key '%s' for dataset %s", key, dataset.key()));
    }

    private static Double toNumber(String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidFilterException("Filter '" + key + "' expects a number, got: " + value, e);
        }
    }

    private static List<String> toValues(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        }
        return Arrays.stream(value.toString().split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FilterCriteria other && criteria.equals(other.criteria);
    }

    @Override
    public int hashCode() {
        return criteria.hashCode();
    }

    @Override
    public String toString() {
        return "FilterCriteria" + criteria;
    }
}
