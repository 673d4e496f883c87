package com.jewelrec.main.personalization;

import com.jewelrec.common.math.VectorMath;
import com.jewelrec.common.model.InteractionEvent;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.common.model.UserProfile;
import com.jewelrec.main.config.RecommenderProperties;
import com.jewelrec.storage.profile.UserProfileStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * User-user and item-item collaborative filtering over logged interactions that
 * carry an item id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollaborativeFilter {

    /** Similar users considered when aggregating recommendations. */
    static final int SIMILAR_USERS = 20;

    /** Neighbours expanded per interacted item in the item-based fallback. */
    static final int SIMILAR_ITEMS = 20;

    private static final Comparator<ItemScore> BY_SCORE =
        Comparator.comparingDouble(ItemScore::score).reversed().thenComparing(ItemScore::itemId);

    private final UserProfileStore profileStore;
    private final RecommenderProperties properties;

    private final Map<String, List<Interaction>> userInteractions = new ConcurrentHashMap<>();
    private final Map<String, List<Interaction>> itemInteractions = new ConcurrentHashMap<>();

    /** One side of an interaction; {@code counterpart} is an item id or a user id. */
    record Interaction(String counterpart, InteractionType type, double weight, Instant timestamp) {
    }

    /**
     * Rebuilds both multimaps from every stored profile.
     */
    @PostConstruct
    public void rebuild() {
        userInteractions.clear();
        itemInteractions.clear();
        int count = 0;
        for (UserProfile profile : profileStore.getAll()) {
            for (InteractionEvent event : profile.interactions()) {
                if (event.itemId() != null) {
                    recordInteraction(profile.userId(), event.itemId(), event.type(), event.weight(), event.timestamp());
                    count++;
                }
            }
        }
        log.info("Collaborative filter built from {} interactions of {} users", count, userInteractions.size());
    }

    /**
     * Records one interaction on both sides. A user keeps at most {@code max-interactions}
     * entries, matching the profile log; the oldest are evicted from both maps.
     */
    public void recordInteraction(String userId, String itemId, InteractionType type, double weight, Instant timestamp) {
        int limit = properties.getPersonalization().getMaxInteractions();
        List<Interaction> evicted = new ArrayList<>();
        userInteractions.compute(userId, (id, current) -> {
            List<Interaction> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);
            updated.add(new Interaction(itemId, type, weight, timestamp));
            while (updated.size() > limit) {
                evicted.add(updated.remove(0));
            }
            return List.copyOf(updated);
        });
        itemInteractions.compute(itemId, (id, current) -> {
            List<Interaction> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);
            updated.add(new Interaction(userId, type, weight, timestamp));
            return List.copyOf(updated);
        });
        for (Interaction old : evicted) {
            Interaction mirror = new Interaction(userId, old.type(), old.weight(), old.timestamp());
            itemInteractions.computeIfPresent(old.counterpart(), (id, current) -> {
                List<Interaction> remaining = new ArrayList<>(current);
                remaining.remove(mirror);
                return remaining.isEmpty() ? null : List.copyOf(remaining);
            });
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} oldest interactions of user {}", evicted.size(), userId);
        }
    }

    public boolean hasHistory(String userId) {
        List<Interaction> interactions = userInteractions.get(userId);
        return interactions != null && !interactions.isEmpty();
    }

    /**
     * Users most similar by inner product of their vectors, excluding the user itself.
     */
    public List<UserSimilarity> userSimilarity(String userId, Map<String, float[]> userVectors, int topN) {
        float[] target = userVectors.get(userId);
        if (target == null) {
            return List.of();
        }
        return userVectors.entrySet().stream()
            .filter(entry -> !entry.getKey().equals(userId))
            .filter(entry -> entry.getValue().length == target.length)
            .map(entry -> new UserSimilarity(entry.getKey(), VectorMath.dot(target, entry.getValue())))
            .sorted(Comparator.comparingDouble(UserSimilarity::similarity).reversed()
                .thenComparing(UserSimilarity::userId))
            .limit(topN)
            .toList();
    }

    /**
     * Users ranked by Jaccard overlap of interacted item sets. Users sharing no item are left out.
     */
    public List<UserSimilarity> userSimilarityByInteractions(String userId, int topN) {
        Set<String> target = counterparts(userInteractions.get(userId));
        if (target.isEmpty()) {
            return List.of();
        }
        return userInteractions.entrySet().stream()
            .filter(entry -> !entry.getKey().equals(userId))
            .map(entry -> new UserSimilarity(entry.getKey(), jaccard(target, counterparts(entry.getValue()))))
            .filter(similarity -> similarity.similarity() > 0)
            .sorted(Comparator.comparingDouble(UserSimilarity::similarity).reversed()
                .thenComparing(UserSimilarity::userId))
            .limit(topN)
            .toList();
    }

    /**
     * Items most similar by embedding inner product, excluding the item itself.
     */
    public List<ItemScore> itemSimilarity(String itemId, Map<String, float[]> itemEmbeddings, int topN) {
        float[] target = itemEmbeddings.get(itemId);
        if (target == null) {
            return List.of();
        }
        return itemEmbeddings.entrySet().stream()
            .filter(entry -> !entry.getKey().equals(itemId))
            .filter(entry -> entry.getValue().length == target.length)
            .map(entry -> new ItemScore(entry.getKey(), VectorMath.dot(target, entry.getValue())))
            .sorted(BY_SCORE)
            .limit(topN)
            .toList();
    }

    /**
     * Items ranked by Jaccard overlap of the users who interacted with them.
     */
    public List<ItemScore> itemSimilarityByInteractions(String itemId, int topN) {
        Set<String> target = counterparts(itemInteractions.get(itemId));
        if (target.isEmpty()) {
            return List.of();
        }
        return itemInteractions.entrySet().stream()
            .filter(entry -> !entry.getKey().equals(itemId))
            .map(entry -> new ItemScore(entry.getKey(), jaccard(target, counterparts(entry.getValue()))))
            .filter(score -> score.score() > 0)
            .sorted(BY_SCORE)
            .limit(topN)
            .toList();
    }

    /**
     * Collaborative recommendations for a user.
     * <p>
     * Items of similar users are scored by {@code similarity * type weight}. Without similar
     * users the user's own history is expanded through item similarity, and without history
     * the query is matched against the item embeddings directly.
     *
     * @param queryVector query embedding for the cold-start path, may be null
     */
    public List<ItemScore> recommend(String userId, Map<String, float[]> userVectors,
                                     Map<String, float[]> itemEmbeddings, float[] queryVector, int topK) {
        List<UserSimilarity> similarUsers = userVectors.containsKey(userId)
            ? userSimilarity(userId, userVectors, SIMILAR_USERS)
            : userSimilarityByInteractions(userId, SIMILAR_USERS);

        Map<String, Double> scores = new HashMap<>();
        for (UserSimilarity similar : similarUsers) {
            for (Interaction interaction : userInteractions.getOrDefault(similar.userId(), List.of())) {
                scores.merge(interaction.counterpart(),
                    similar.similarity() * interaction.type().defaultWeight(), Double::sum);
            }
        }
        if (!scores.isEmpty()) {
            log.debug("User {}: {} items from {} similar users", userId, scores.size(), similarUsers.size());
            return top(scores, topK);
        }

        if (hasHistory(userId)) {
            log.debug("User {}: no similar users, expanding own history", userId);
            return itemBased(userId, itemEmbeddings, topK);
        }

        log.debug("User {}: no history, falling back to content similarity", userId);
        return coldStart(itemEmbeddings, queryVector, topK);
    }

    List<ItemScore> itemBased(String userId, Map<String, float[]> itemEmbeddings, int topK) {
        Map<String, Double> scores = new HashMap<>();
        for (Interaction interaction : userInteractions.getOrDefault(userId, List.of())) {
            for (ItemScore similar : itemSimilarity(interaction.counterpart(), itemEmbeddings, SIMILAR_ITEMS)) {
                scores.merge(similar.itemId(), similar.score() * interaction.type().defaultWeight(), Double::sum);
            }
        }
        return top(scores, topK);
    }

    List<ItemScore> coldStart(Map<String, float[]> itemEmbeddings, float[] queryVector, int topK) {
        if (queryVector == null) {
            return List.of();
        }
        return itemEmbeddings.entrySet().stream()
            .filter(entry -> entry.getValue().length == queryVector.length)
            .map(entry -> new ItemScore(entry.getKey(), VectorMath.dot(queryVector, entry.getValue())))
            .sorted(BY_SCORE)
            .limit(topK)
            .toList();
    }

    private static List<ItemScore> top(Map<String, Double> scores, int topK) {
        return scores.entrySet().stream()
            .map(entry -> new ItemScore(entry.getKey(), entry.getValue()))
            .sorted(BY_SCORE)
            .limit(topK)
            .toList();
    }

    private static Set<String> counterparts(List<Interaction> interactions) {
        if (interactions == null) {
            return Set.of();
        }
        return interactions.stream().map(Interaction::counterpart).collect(Collectors.toSet());
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        long intersection = a.stream().filter(b::contains).count();
        int union = a.size() + b.size() - (int) intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }
}
