package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InteractionType {
    CLICK(1.0),
    LIKE(2.0),
    PURCHASE(5.0);

    private final double defaultWeight;

    InteractionType(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InteractionType fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Interaction type cannot be empty");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown interaction type: " + key, e);
        }
    }
}
