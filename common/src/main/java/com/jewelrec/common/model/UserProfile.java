package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted state of a user: optional explicit preferences plus a bounded,
 * oldest-first interaction log. Instances are immutable; mutators return copies.
 */
public record UserProfile(
    @JsonProperty("schema_version")
    int schemaVersion,

    @JsonProperty("user_id")
    String userId,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("preference_vector")
    float[] preferenceVector,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("preference_text")
    String preferenceText,

    @JsonProperty("interactions")
    List<InteractionEvent> interactions
) {
    public static final int SCHEMA_VERSION = 1;

    @JsonCreator
    public UserProfile {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id cannot be null or empty");
        }
        if (schemaVersion <= 0) {
            schemaVersion = SCHEMA_VERSION;
        }
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
    }

    public static UserProfile empty(String userId) {
        return new UserProfile(SCHEMA_VERSION, userId, null, null, List.of());
    }

    public UserProfile withPreferences(float[] vector, String text) {
        return new UserProfile(SCHEMA_VERSION, userId, vector, text, interactions);
    }

    /**
     * Appends an interaction, evicting the oldest entries beyond {@code maxInteractions}.
     */
    public UserProfile withInteraction(InteractionEvent event, int maxInteractions) {
        List<InteractionEvent> updated = new ArrayList<>(interactions);
        updated.add(event);
        while (updated.size() > maxInteractions) {
            updated.remove(0);
        }
        return new UserProfile(SCHEMA_VERSION, userId, preferenceVector, preferenceText, updated);
    }

    @JsonIgnore
    public Optional<float[]> preference() {
        return Optional.ofNullable(preferenceVector);
    }

    @JsonIgnore
    public int interactionCount() {
        return interactions.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return preferenceVector == null && interactions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UserProfile other
            && schemaVersion == other.schemaVersion
            && userId.equals(other.userId)
            && Arrays.equals(preferenceVector, other.preferenceVector)
            && Objects.equals(preferenceText, other.preferenceText)
            && interactions.equals(other.interactions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaVersion, userId, Arrays.hashCode(preferenceVector), preferenceText, interactions);
    }
}
