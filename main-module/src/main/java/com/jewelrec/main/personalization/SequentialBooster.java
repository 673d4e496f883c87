package com.jewelrec.main.personalization;

import com.jewelrec.common.math.VectorMath;
import com.jewelrec.common.model.InteractionEvent;
import com.jewelrec.common.model.UserProfile;
import com.jewelrec.main.config.RecommenderProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Boosts pairs aligned with the direction of a user's most recent interactions.
 */
@Component
public class SequentialBooster {

    private static final int MIN_INTERACTIONS = 2;

    private final int window;

    public SequentialBooster(RecommenderProperties properties) {
        this.window = properties.getPersonalization().getSequentialWindow();
    }

    /**
     * Normalized mean of the last interaction embeddings; empty with fewer than two interactions.
     */
    public Optional<float[]> trendVector(UserProfile profile) {
        List<InteractionEvent> interactions = profile.interactions();
        if (interactions.size() < MIN_INTERACTIONS) {
            return Optional.empty();
        }
        List<InteractionEvent> recent = interactions.subList(Math.max(0, interactions.size() - window), interactions.size());
        int dimension = recent.get(recent.size() - 1).itemEmbedding().length;
        double[] acc = new double[dimension];
        for (InteractionEvent event : recent) {
            if (event.itemEmbedding().length == dimension) {
                VectorMath.accumulate(acc, event.itemEmbedding(), 1.0);
            }
        }
        float[] mean = VectorMath.toFloat(acc);
        return VectorMath.norm(mean) > 0 ? Optional.of(VectorMath.normalize(mean)) : Optional.empty();
    }

    public double boost(float[] trend, float[] pairEmbedding) {
        if (trend.length != pairEmbedding.length) {
            return 0.0;
        }
        return Math.max(0.0, VectorMath.dot(trend, pairEmbedding));
    }
}
