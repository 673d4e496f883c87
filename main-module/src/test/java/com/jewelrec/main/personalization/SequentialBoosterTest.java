package com.jewelrec.main.personalization;

import com.jewelrec.common.model.InteractionEvent;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.common.model.UserProfile;
import com.jewelrec.main.config.RecommenderProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.jewelrec.main.TestItems.axis;
import static com.jewelrec.main.TestItems.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SequentialBoosterTest {

    private final SequentialBooster booster = new SequentialBooster(new RecommenderProperties());

    @Test
    void needsAtLeastTwoInteractions() {
        UserProfile profile = UserProfile.empty("u").withInteraction(event(axis(2, 0)), 100);

        assertThat(booster.trendVector(profile)).isEmpty();
    }

    @Test
    void trendUsesOnlyTheRecentWindow() {
        UserProfile profile = UserProfile.empty("u");
        for (int i = 0; i < 3; i++) {
            profile = profile.withInteraction(event(axis(2, 0)), 100);
        }
        for (int i = 0; i < 5; i++) {
            profile = profile.withInteraction(event(axis(2, 1)), 100);
        }

        assertThat(booster.trendVector(profile).orElseThrow()).containsExactly(axis(2, 1), within(1e-6f));
    }

    @Test
    void boostIsNonNegative() {
        assertThat(booster.boost(axis(2, 0), unit(1, 1))).isCloseTo(Math.sqrt(0.5), within(1e-6));
        assertThat(booster.boost(axis(2, 0), new float[]{-1, 0})).isZero();
        assertThat(booster.boost(axis(2, 0), axis(3, 0))).isZero();
    }

    private static InteractionEvent event(float[] embedding) {
        return InteractionEvent.builder()
            .type(InteractionType.CLICK)
            .itemEmbedding(embedding)
            .weight(1.0)
            .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    }
}
