package com.jewelrec.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class UserProfileTest {

    private static InteractionEvent click(int i) {
        return InteractionEvent.builder()
            .type(InteractionType.CLICK)
            .itemEmbedding(new float[]{1f, 0f})
            .weight(1.0)
            .timestamp(Instant.ofEpochSecond(i))
            .itemId("item-" + i)
            .build();
    }

    @Test
    void interactionLogDropsOldestBeyondCap() {
        UserProfile profile = UserProfile.empty("u1");
        for (int i = 0; i < 5; i++) {
            profile = profile.withInteraction(click(i), 3);
        }

        assertThat(profile.interactions())
            .extracting(InteractionEvent::itemId)
            .containsExactly("item-2", "item-3", "item-4");
    }

    @Test
    void emptyProfileHasNoPreference() {
        UserProfile profile = UserProfile.empty("u1");

        assertThat(profile.isEmpty()).isTrue();
        assertThat(profile.preference()).isEmpty();
    }

    @Test
    void serializesWithSnakeCaseSchema() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        UserProfile profile = UserProfile.empty("u1")
            .withPreferences(new float[]{0f, 1f}, "prefers platinum")
            .withInteraction(click(1), 100);

        String json = mapper.writeValueAsString(profile);
        UserProfile restored = mapper.readValue(json, UserProfile.class);

        assertThat(json).contains("\"schema_version\":1", "\"preference_text\"", "\"item_embedding\"", "\"type\":\"click\"");
        assertThat(restored.userId()).isEqualTo("u1");
        assertThat(restored.preferenceVector()).containsExactly(0f, 1f);
        assertThat(restored.interactions()).hasSize(1);
        assertThat(restored.interactions().get(0).timestamp()).isEqualTo(Instant.ofEpochSecond(1));
        assertThat(restored.interactions().get(0).type()).isEqualTo(InteractionType.CLICK);
        assertThat(restored).isEqualTo(profile).hasSameHashCodeAs(profile);
    }

    @Test
    void equalityComparesVectorContents() {
        UserProfile first = UserProfile.empty("u1").withPreferences(new float[]{0f, 1f}, "prefers platinum");
        UserProfile second = UserProfile.empty("u1").withPreferences(new float[]{0f, 1f}, "prefers platinum");

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(first.withPreferences(new float[]{1f, 0f}, "prefers platinum"));
        assertThat(click(1)).isEqualTo(click(1)).isNotEqualTo(click(2));
    }
}
