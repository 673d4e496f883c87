package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over the metadata record of an item. Accessors are lenient:
 * a missing or malformed value is reported as absent rather than as an error.
 */
public final class ItemAttributes {

    public static final String PRICE = "price";
    public static final String METAL = "metal";
    public static final String STYLE = "style";
    public static final String COLOR = "color";
    public static final String SHAPE = "shape";
    public static final String CUT = "cut";
    public static final String CARAT = "carat_weight";
    public static final String BAND_WIDTH = "band_width_mm";

    private static final ItemAttributes EMPTY = new ItemAttributes(Map.of());

    private final Map<String, Object> values;

    private ItemAttributes(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator
    public static ItemAttributes of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ItemAttributes(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ItemAttributes empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<Object> raw(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<Double> number(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? Optional.empty() : Optional.of(d);
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> text(String key) {
        Object value = values.get(key);
        if (value == null || value instanceof Collection<?>) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /** Values of a list attribute; a scalar is returned as a singleton list. */
    public List<String> texts(String key) {
        Object value = values.get(key);
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
        return text(key).map(List::of).orElse(List.of());
    }

    public boolean has(String key) {
        Object value = values.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return !value.toString().isBlank();
    }

    public Optional<Double> price() {
        return number(PRICE);
    }

    public Optional<String> metal() {
        return text(METAL);
    }

    public Optional<String> style() {
        return text(STYLE);
    }

    public Optional<String> color() {
        return text(COLOR);
    }

    public Optional<String> shape() {
        return text(SHAPE);
    }

    public Optional<String> cut() {
        return text(CUT);
    }

    public Optional<Double> carat() {
        return number(CARAT);
    }

    public Optional<Double> bandWidth() {
        return number(BAND_WIDTH);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ItemAttributes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
