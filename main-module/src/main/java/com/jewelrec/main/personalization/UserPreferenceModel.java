package com.jewelrec.main.personalization;

import com.jewelrec.common.math.VectorMath;
import com.jewelrec.common.model.InteractionEvent;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.common.model.UserProfile;
import com.jewelrec.main.config.RecommenderProperties;
import com.jewelrec.storage.profile.UserProfileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Hybrid user preference vectors: explicit preferences blended with a decayed
 * average of interaction embeddings.
 */
@Slf4j
@Service
public class UserPreferenceModel {

    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    private final UserProfileStore profileStore;
    private final RecommenderProperties.Personalization settings;
    private final Clock clock;
    private final Map<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public UserPreferenceModel(UserProfileStore profileStore, RecommenderProperties properties, Clock clock) {
        this.profileStore = profileStore;
        this.settings = properties.getPersonalization();
        this.clock = clock;
    }

    public Optional<UserProfile> profile(String userId) {
        return profileStore.get(userId);
    }

    /**
     * Replaces the explicit preferences of a user, creating the profile if needed.
     *
     * @param preferenceVector preference embedding; stored normalized
     * @param preferenceText   text the embedding was computed from
     */
    public UserProfile updatePreferences(String userId, float[] preferenceVector, String preferenceText) {
        float[] unit = VectorMath.normalize(preferenceVector);
        UserProfile updated = mutate(userId, profile -> profile.withPreferences(unit, preferenceText));
        log.info("Updated preferences for user {}", userId);
        return updated;
    }

    /**
     * Appends an interaction to the user's log.
     *
     * @param weight    explicit weight, or null for the type default
     * @param timestamp interaction time, or null for now
     * @param itemId    optional item reference
     */
    public UserProfile logInteraction(String userId, float[] itemEmbedding, InteractionType type,
                                      Double weight, Instant timestamp, String itemId) {
        InteractionEvent event = InteractionEvent.builder()
            .type(type)
            .itemEmbedding(VectorMath.normalize(itemEmbedding))
            .weight(weight != null ? weight : type.defaultWeight())
            .timestamp(timestamp != null ? timestamp : clock.instant())
            .itemId(itemId)
            .build();
        UserProfile updated = mutate(userId, profile -> profile.withInteraction(event, settings.getMaxInteractions()));
        log.debug("Logged {} interaction for user {}, log size {}", type.key(), userId, updated.interactionCount());
        return updated;
    }

    /**
     * Hybrid vector of a user; empty when the user has neither preferences nor interactions.
     */
    public Optional<float[]> userVector(String userId) {
        return profileStore.get(userId).flatMap(this::hybridVector);
    }

    public Optional<float[]> hybridVector(UserProfile profile) {
        Optional<float[]> base = profile.preference().map(VectorMath::normalize);
        Optional<float[]> interactions = interactionVector(profile.interactions(), clock.instant());

        if (base.isPresent() && interactions.isPresent()) {
            return Optional.of(VectorMath.weightedSum(
                base.get(), settings.getBaseWeight(),
                interactions.get(), settings.getInteractionWeight()));
        }
        return base.isPresent() ? base : interactions;
    }

    /**
     * Decay-weighted average of interaction embeddings, normalized. Each interaction
     * weighs {@code weight * decay(age)}.
     */
    public Optional<float[]> interactionVector(List<InteractionEvent> interactions, Instant now) {
        if (interactions.isEmpty()) {
            return Optional.empty();
        }
        int dimension = interactions.get(0).itemEmbedding().length;
        double[] acc = new double[dimension];
        double totalWeight = 0.0;
        for (InteractionEvent event : interactions) {
            if (event.itemEmbedding().length != dimension) {
                log.warn("Ignoring interaction with dimension {} (expected {})", event.itemEmbedding().length, dimension);
                continue;
            }
            double w = event.weight() * decayWeight(event.timestamp(), now);
            VectorMath.accumulate(acc, event.itemEmbedding(), w);
            totalWeight += w;
        }
        if (totalWeight <= 0) {
            return Optional.empty();
        }
        float[] mean = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            mean[i] = (float) (acc[i] / totalWeight);
        }
        return VectorMath.norm(mean) > 0 ? Optional.of(VectorMath.normalize(mean)) : Optional.empty();
    }

    /**
     * {@code 2^(-ageDays / halfLifeDays)}; 1.0 for interactions at or after {@code now}.
     */
    public double decayWeight(Instant timestamp, Instant now) {
        double ageDays = Duration.between(timestamp, now).toMillis() / MILLIS_PER_DAY;
        if (ageDays <= 0) {
            return 1.0;
        }
        return Math.pow(2.0, -ageDays / settings.getHalfLifeDays());
    }

    /** Fewer interactions than the sparse threshold, whether or not a vector exists. */
    public boolean isSparse(UserProfile profile) {
        return profile.interactionCount() < settings.getSparseThreshold();
    }

    /** Hybrid vectors of all stored users that have one. */
    public Map<String, float[]> allUserVectors() {
        Map<String, float[]> vectors = new HashMap<>();
        for (UserProfile profile : profileStore.getAll()) {
            hybridVector(profile).ifPresent(v -> vectors.put(profile.userId(), v));
        }
        return vectors;
    }

    /**
     * Seeds a user's preference vector with the similarity-weighted average of similar users' vectors.
     *
     * @return the stored vector, or empty when no similar user has a vector
     */
    public Optional<float[]> initializeFromSimilarUsers(String userId, List<UserSimilarity> similarUsers) {
        double[] acc = null;
        double totalWeight = 0.0;
        int used = 0;
        for (UserSimilarity similar : similarUsers) {
            Optional<float[]> vector = userVector(similar.userId());
            if (vector.isEmpty() || similar.similarity() <= 0) {
                continue;
            }
            if (acc == null) {
                acc = new double[vector.get().length];
            } else if (acc.length != vector.get().length) {
                continue;
            }
            VectorMath.accumulate(acc, vector.get(), similar.similarity());
            totalWeight += similar.similarity();
            used++;
        }
        if (acc == null || totalWeight <= 0) {
            log.debug("No similar user of {} has a vector, nothing to initialize", userId);
            return Optional.empty();
        }
        float[] seeded = VectorMath.toFloat(acc);
        if (VectorMath.norm(seeded) == 0) {
            return Optional.empty();
        }
        float[] unit = VectorMath.normalize(seeded);
        String text = "Initialized from " + used + " similar users";
        mutate(userId, profile -> profile.withPreferences(unit, text));
        log.info("Initialized user {} from {} similar users", userId, used);
        return Optional.of(unit);
    }

    /** Read-modify-persist under the user's lock. */
    private UserProfile mutate(String userId, UnaryOperator<UserProfile> change) {
        ReentrantLock lock = userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            UserProfile current = profileStore.get(userId).orElseGet(() -> UserProfile.empty(userId));
            UserProfile updated = change.apply(current);
            profileStore.put(updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }
}
