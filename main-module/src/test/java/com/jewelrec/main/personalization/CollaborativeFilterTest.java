package com.jewelrec.main.personalization;

import com.jewelrec.common.model.InteractionEvent;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.common.model.UserProfile;
import com.jewelrec.main.config.RecommenderProperties;
import com.jewelrec.storage.profile.InMemoryProfileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.jewelrec.main.TestItems.axis;
import static com.jewelrec.main.TestItems.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CollaborativeFilterTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryProfileStore store;
    private CollaborativeFilter filter;

    private final Map<String, float[]> items = Map.of(
        "a", axis(3, 0),
        "b", unit(0.9f, 0.1f, 0),
        "c", axis(3, 1),
        "d", axis(3, 2));

    @BeforeEach
    void setUp() {
        store = new InMemoryProfileStore();
        filter = new CollaborativeFilter(store, new RecommenderProperties());
        filter.rebuild();
    }

    @Test
    void rebuildReadsItemInteractionsFromStore() {
        UserProfile profile = UserProfile.empty("u1")
            .withInteraction(event("diamonds:1"), 100)
            .withInteraction(event(null), 100);
        store.put(profile);

        filter.rebuild();

        assertThat(filter.hasHistory("u1")).isTrue();
        assertThat(filter.itemSimilarityByInteractions("diamonds:1", 5)).isEmpty();
        assertThat(filter.hasHistory("u2")).isFalse();
    }

    @Test
    void jaccardSimilarityOverItemSets() {
        record("u1", "a", "b");
        record("u2", "a", "b", "c");
        record("u3", "x");

        List<UserSimilarity> similar = filter.userSimilarityByInteractions("u1", 10);

        assertThat(similar).hasSize(1);
        assertThat(similar.get(0).userId()).isEqualTo("u2");
        assertThat(similar.get(0).similarity()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void itemJaccardOverUserSets() {
        record("u1", "a", "b");
        record("u2", "a", "c");

        List<ItemScore> similar = filter.itemSimilarityByInteractions("a", 10);

        assertThat(similar).extracting(ItemScore::itemId).containsExactly("b", "c");
        assertThat(similar.get(0).score()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void userHistoryIsCappedLikeTheProfileLog() {
        RecommenderProperties properties = new RecommenderProperties();
        properties.getPersonalization().setMaxInteractions(2);
        filter = new CollaborativeFilter(store, properties);
        record("u1", "a", "b", "c");
        record("u2", "a");

        assertThat(filter.userSimilarityByInteractions("u2", 10)).isEmpty();
        assertThat(filter.itemSimilarityByInteractions("b", 10)).extracting(ItemScore::itemId)
            .containsExactly("c");
        assertThat(filter.itemSimilarityByInteractions("a", 10)).isEmpty();
    }

    @Test
    void vectorSimilarityExcludesSelf() {
        Map<String, float[]> users = Map.of("u1", axis(2, 0), "u2", unit(1, 1), "u3", axis(2, 1));

        List<UserSimilarity> similar = filter.userSimilarity("u1", users, 1);

        assertThat(similar).extracting(UserSimilarity::userId).containsExactly("u2");
        assertThat(filter.itemSimilarity("a", items, 10)).extracting(ItemScore::itemId).doesNotContain("a")
            .first().isEqualTo("b");
    }

    @Test
    void recommendAggregatesSimilarUsersByTypeWeight() {
        filter.recordInteraction("u2", "c", InteractionType.PURCHASE, 5.0, T);
        filter.recordInteraction("u2", "d", InteractionType.CLICK, 1.0, T);
        Map<String, float[]> users = Map.of("u1", axis(2, 0), "u2", unit(1, 1));

        List<ItemScore> recommendations = filter.recommend("u1", users, items, null, 10);

        assertThat(recommendations).extracting(ItemScore::itemId).containsExactly("c", "d");
        assertThat(recommendations.get(0).score()).isCloseTo(Math.sqrt(0.5) * 5.0, within(1e-6));
    }

    @Test
    void recommendFallsBackToOwnHistory() {
        filter.recordInteraction("u1", "a", InteractionType.LIKE, 2.0, T);

        List<ItemScore> recommendations = filter.recommend("u1", Map.of(), items, axis(3, 2), 2);

        assertThat(recommendations).extracting(ItemScore::itemId).first().isEqualTo("b");
        assertThat(recommendations).extracting(ItemScore::itemId).doesNotContain("a");
    }

    @Test
    void recommendFallsBackToContentSimilarityWithoutHistory() {
        List<ItemScore> recommendations = filter.recommend("new", Map.of(), items, axis(3, 2), 2);

        assertThat(recommendations).extracting(ItemScore::itemId).first().isEqualTo("d");
        assertThat(filter.recommend("new", Map.of(), items, null, 2)).isEmpty();
    }

    private void record(String userId, String... itemIds) {
        for (String itemId : itemIds) {
            filter.recordInteraction(userId, itemId, InteractionType.CLICK, 1.0, T);
        }
    }

    private static InteractionEvent event(String itemId) {
        return InteractionEvent.builder()
            .type(InteractionType.LIKE)
            .itemEmbedding(axis(3, 0))
            .weight(2.0)
            .timestamp(T)
            .itemId(itemId)
            .build();
    }
}
