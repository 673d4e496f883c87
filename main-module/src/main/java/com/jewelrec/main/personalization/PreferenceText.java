package com.jewelrec.main.personalization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders an explicit preference map as a sentence for the text embedder.
 * Recognized keys: metal, style, price_range, diamond_color, diamond_shape.
 */
public final class PreferenceText {

    static final String EMPTY = "no specific preferences";

    private PreferenceText() {
    }

    public static String render(Map<String, ?> preferences) {
        if (preferences == null || preferences.isEmpty()) {
            return EMPTY;
        }
        List<String> parts = new ArrayList<>();
        value(preferences, "metal").ifPresent(v -> parts.add("prefers " + v));
        value(preferences, "style").ifPresent(v -> parts.add("prefers " + v + " style"));
        priceRange(preferences.get("price_range")).ifPresent(parts::add);
        value(preferences, "diamond_color").ifPresent(v -> parts.add("prefers " + v + " color diamonds"));
        value(preferences, "diamond_shape").ifPresent(v -> parts.add("prefers " + v + " shape"));
        return parts.isEmpty() ? EMPTY : String.join(". ", parts);
    }

    private static Optional<String> value(Map<String, ?> preferences, String key) {
        Object value = preferences.get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString().trim());
    }

    private static Optional<String> priceRange(Object value) {
        if (!(value instanceof Collection<?> range) || range.size() != 2) {
            return Optional.empty();
        }
        List<String> bounds = range.stream().map(PreferenceText::formatNumber).toList();
        return Optional.of("price range $" + bounds.get(0) + " to $" + bounds.get(1));
    }

    private static String formatNumber(Object value) {
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return String.valueOf(number.longValue());
        }
        return String.valueOf(value);
    }
}
