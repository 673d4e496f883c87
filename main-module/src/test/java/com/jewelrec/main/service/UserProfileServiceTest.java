package com.jewelrec.main.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jewelrec.common.exception.EmbeddingUnavailableException;
import com.jewelrec.common.exception.ItemNotFoundException;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.main.client.EmbeddingClient;
import com.jewelrec.main.config.RecommenderProperties;
import com.jewelrec.main.personalization.CollaborativeFilter;
import com.jewelrec.main.personalization.UserPreferenceModel;
import com.jewelrec.storage.index.IndexSettings;
import com.jewelrec.storage.index.PoolIndexFactory;
import com.jewelrec.storage.pool.ItemPool;
import com.jewelrec.storage.pool.PoolLoader;
import com.jewelrec.storage.pool.PoolRegistry;
import com.jewelrec.storage.profile.InMemoryProfileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.jewelrec.main.TestItems.axis;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserProfileServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @Mock
    private EmbeddingClient embeddingClient;

    private UserPreferenceModel preferenceModel;
    private CollaborativeFilter collaborativeFilter;
    private UserProfileService service;

    @BeforeEach
    void setUp() {
        InMemoryProfileStore store = new InMemoryProfileStore();
        preferenceModel = new UserPreferenceModel(store, new RecommenderProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        collaborativeFilter = new CollaborativeFilter(store, new RecommenderProperties());

        PoolLoader loader = new PoolLoader(Path.of("unused"), new PoolIndexFactory(IndexSettings.DEFAULTS),
            new ObjectMapper());
        ItemPool diamonds = loader.build(Dataset.DIAMONDS, new float[][]{{1, 0, 0}, {0, 2, 0}},
            List.of(Map.<String, Object>of("id", "7", "color", "E"), Map.<String, Object>of("id", "8", "color", "F")));
        PoolRegistry registry = new PoolRegistry(dataset -> diamonds);

        service = new UserProfileService(preferenceModel, collaborativeFilter, embeddingClient, registry);
    }

    @Test
    void preferencesAreRenderedEmbeddedAndStored() {
        when(embeddingClient.embedText("prefers platinum. prefers oval shape"))
            .thenReturn(Optional.of(new float[]{0, 0, 4}));

        UserSummary summary = service.updatePreferences("u1", Map.of("metal", "platinum", "diamond_shape", "oval"));

        assertThat(summary.exists()).isTrue();
        assertThat(summary.preferenceText()).isEqualTo("prefers platinum. prefers oval shape");
        assertThat(summary.hasVector()).isTrue();
        assertThat(preferenceModel.userVector("u1")).hasValueSatisfying(v -> assertThat(v).containsExactly(0, 0, 1));
    }

    @Test
    void preferencesFailWhenEmbeddingMissing() {
        when(embeddingClient.embedText("no specific preferences")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updatePreferences("u1", Map.of()))
            .isInstanceOf(EmbeddingUnavailableException.class);
        assertThat(service.summary("u1").exists()).isFalse();
    }

    @Test
    void itemInteractionResolvesEmbeddingAndFeedsCollaborativeFilter() {
        UserSummary summary = service.logItemInteraction("u1", Dataset.DIAMONDS, "8", InteractionType.LIKE, null, null);

        assertThat(summary.interactionCount()).isEqualTo(1);
        assertThat(summary.interactionsByType()).containsEntry(InteractionType.LIKE, 1L);
        assertThat(summary.lastInteraction()).isEqualTo(NOW);
        assertThat(summary.sparse()).isTrue();
        assertThat(preferenceModel.profile("u1").orElseThrow().interactions().get(0).itemId()).isEqualTo("diamonds:8");
        assertThat(collaborativeFilter.hasHistory("u1")).isTrue();
    }

    @Test
    void unknownItemIsNotFound() {
        assertThatThrownBy(() -> service.logItemInteraction("u1", Dataset.DIAMONDS, "99", InteractionType.CLICK, null, null))
            .isInstanceOf(ItemNotFoundException.class)
            .hasMessageContaining("99");
        assertThat(preferenceModel.profile("u1")).isEmpty();
    }

    @Test
    void interactionWithoutItemIdSkipsCollaborativeFilter() {
        service.logInteraction("u1", axis(3, 0), InteractionType.CLICK, 0.5, null, null);

        assertThat(collaborativeFilter.hasHistory("u1")).isFalse();
        assertThat(preferenceModel.profile("u1").orElseThrow().interactions().get(0).weight()).isEqualTo(0.5);
    }

    @Test
    void coldUserIsInitializedFromSimilarUsers() {
        service.logItemInteraction("warm", Dataset.DIAMONDS, "7", InteractionType.PURCHASE, null, null);
        service.logItemInteraction("cold", Dataset.DIAMONDS, "7", InteractionType.CLICK, null, null);

        assertThat(service.initializeFromSimilarUsers("cold")).isTrue();
        assertThat(service.summary("cold").preferenceText()).isEqualTo("Initialized from 1 similar users");
    }

    @Test
    void unknownUserSummary() {
        UserSummary summary = service.summary("ghost");

        assertThat(summary.exists()).isFalse();
        assertThat(summary.hasVector()).isFalse();
        assertThat(summary.interactionCount()).isZero();
    }
}
