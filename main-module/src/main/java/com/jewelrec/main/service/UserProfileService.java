package com.jewelrec.main.service;

import com.jewelrec.common.exception.EmbeddingUnavailableException;
import com.jewelrec.common.exception.ItemNotFoundException;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.InteractionEvent;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.common.model.UserProfile;
import com.jewelrec.main.client.EmbeddingClient;
import com.jewelrec.main.personalization.CollaborativeFilter;
import com.jewelrec.main.personalization.PreferenceText;
import com.jewelrec.main.personalization.UserPreferenceModel;
import com.jewelrec.main.personalization.UserSimilarity;
import com.jewelrec.storage.pool.PoolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * User preferences, interaction logging and profile summaries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

    private static final int SIMILAR_USERS = 10;

    private final UserPreferenceModel preferenceModel;
    private final CollaborativeFilter collaborativeFilter;
    private final EmbeddingClient embeddingClient;
    private final PoolRegistry poolRegistry;

    /**
     * Render explicit preferences as text, embed it and store it on the profile
     * @param userId user identifier
     * @param preferences keys metal, style, price_range, diamond_color, diamond_shape
     * @return summary of the updated profile
     */
    public UserSummary updatePreferences(String userId, Map<String, ?> preferences) {
        String text = PreferenceText.render(preferences);
        float[] vector = embeddingClient.embedText(text)
            .orElseThrow(() -> new EmbeddingUnavailableException("Embedding service returned no vector for preferences"));
        log.debug("Embedding preferences of user {}: '{}'", userId, text);
        return summarize(userId, Optional.of(preferenceModel.updatePreferences(userId, vector, text)));
    }

    /**
     * Log an interaction with an item embedding
     * @param itemId optional qualified item key; enables collaborative filtering
     */
    public UserSummary logInteraction(String userId, float[] itemEmbedding, InteractionType type,
                                      Double weight, Instant timestamp, String itemId) {
        UserProfile profile = preferenceModel.logInteraction(userId, itemEmbedding, type, weight, timestamp, itemId);
        if (itemId != null) {
            InteractionEvent logged = profile.interactions().get(profile.interactionCount() - 1);
            collaborativeFilter.recordInteraction(userId, itemId, type, logged.weight(), logged.timestamp());
        }
        return summarize(userId, Optional.of(profile));
    }

    /**
     * Log an interaction with a pool item, resolving its embedding by id
     * @throws ItemNotFoundException if the dataset has no such item
     */
    public UserSummary logItemInteraction(String userId, Dataset dataset, String itemId, InteractionType type,
                                          Double weight, Instant timestamp) {
        float[] embedding = poolRegistry.get(dataset).embeddingOf(itemId)
            .orElseThrow(() -> new ItemNotFoundException(
                String.format("Item %s not found in %s", itemId, dataset.key())));
        return logInteraction(userId, embedding, type, weight, timestamp, dataset.qualify(itemId));
    }

    public UserSummary summary(String userId) {
        return summarize(userId, preferenceModel.profile(userId));
    }

    /**
     * Seed a user's preference vector from the users most similar to it
     * @return whether a vector was stored
     */
    public boolean initializeFromSimilarUsers(String userId) {
        List<UserSimilarity> similar = collaborativeFilter.userSimilarity(
            userId, preferenceModel.allUserVectors(), SIMILAR_USERS);
        if (similar.isEmpty()) {
            similar = collaborativeFilter.userSimilarityByInteractions(userId, SIMILAR_USERS);
        }
        return preferenceModel.initializeFromSimilarUsers(userId, similar).isPresent();
    }

    private UserSummary summarize(String userId, Optional<UserProfile> profile) {
        if (profile.isEmpty()) {
            return new UserSummary(userId, false, null, false, 0, Map.of(), null, true);
        }
        UserProfile p = profile.get();
        Map<InteractionType, Long> byType = p.interactions().stream()
            .collect(Collectors.groupingBy(InteractionEvent::type,
                () -> new EnumMap<>(InteractionType.class), Collectors.counting()));
        Instant last = p.interactions().isEmpty() ? null
            : p.interactions().get(p.interactionCount() - 1).timestamp();
        return new UserSummary(userId, true, p.preferenceText(), preferenceModel.hybridVector(p).isPresent(),
            p.interactionCount(), byType, last, preferenceModel.isSparse(p));
    }
}
