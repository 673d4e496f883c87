package com.jewelrec.main.scoring;

import com.jewelrec.common.math.VectorMath;
import com.jewelrec.common.model.Combination;
import com.jewelrec.common.model.ItemAttributes;
import com.jewelrec.common.model.ScoreBreakdown;
import com.jewelrec.common.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Hierarchical weighted scoring of a (diamond, setting) pair.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CombinationScorer {

    static final double METAL_BOOST = 0.4;
    static final double COLOR_BOOST = 0.3;
    static final double SHAPE_BOOST = 0.3;

    private final CompatibilityScorer compatibilityScorer;

    /**
     * Scores a pair as the weighted sum of query similarity (mean of both search scores),
     * attribute boost, compatibility and user alignment.
     *
     * @param userVector hybrid user vector; alignment is 0 when absent
     * @return empty when the two embeddings cannot be combined
     */
    public Optional<Combination> score(SearchResult diamond, SearchResult setting, Optional<float[]> userVector,
                                       QueryHints hints, boolean hasImage) {
        Optional<float[]> pairEmbedding = pairEmbedding(diamond, setting);
        if (pairEmbedding.isEmpty()) {
            log.warn("Skipping pair {}/{}: embeddings cannot be combined", diamond.id(), setting.id());
            return Optional.empty();
        }

        double querySimilarity = (diamond.score() + setting.score()) / 2.0;
        double attributeBoost = attributeBoost(diamond.metadata(), setting.metadata(), hints);
        double compatibility = compatibilityScorer.compatibility(diamond.metadata(), setting.metadata());
        double userAlignment = userVector
            .filter(u -> u.length == pairEmbedding.get().length)
            .map(u -> VectorMath.dot(u, pairEmbedding.get()))
            .orElse(0.0);

        ScoringWeights weights = ScoringWeights.forQuery(hasImage);
        double score = weights.similarity() * querySimilarity
            + weights.attribute() * attributeBoost
            + weights.compatibility() * compatibility
            + weights.user() * userAlignment;

        ScoreBreakdown breakdown = ScoreBreakdown.builder()
            .querySimilarity(querySimilarity)
            .diamondSimilarity(diamond.score())
            .settingSimilarity(setting.score())
            .attributeBoost(attributeBoost)
            .compatibility(compatibility)
            .userAlignment(userAlignment)
            .build();
        return Optional.of(new Combination(diamond, setting, pairEmbedding.get(), score, breakdown));
    }

    /**
     * Credits metal (0.4), color (0.3) and shape (0.3) matches against the hints, capped at 1.0.
     */
    public double attributeBoost(ItemAttributes diamond, ItemAttributes setting, QueryHints hints) {
        double boost = 0.0;
        if (hints.metal() != null && setting.metal().map(m -> overlaps(m, hints.metal())).orElse(false)) {
            boost += METAL_BOOST;
        }
        if (hints.color() != null && diamond.color().map(c -> c.equalsIgnoreCase(hints.color())).orElse(false)) {
            boost += COLOR_BOOST;
        }
        if (hints.shape() != null && diamond.shape().map(s -> overlaps(s, hints.shape())).orElse(false)) {
            boost += SHAPE_BOOST;
        }
        return Math.min(1.0, boost);
    }

    /** Normalized mean of both embeddings, empty if their dimensions differ. */
    public static Optional<float[]> pairEmbedding(SearchResult diamond, SearchResult setting) {
        float[] d = diamond.embedding();
        float[] s = setting.embedding();
        if (d.length != s.length || VectorMath.dot(d, s) <= -1.0 + 1e-9) {
            return Optional.empty();
        }
        return Optional.of(VectorMath.average(d, s));
    }

    /** Case-insensitive containment in either direction. */
    public static boolean overlaps(String itemValue, String hint) {
        String a = itemValue.toLowerCase(Locale.ROOT);
        String b = hint.toLowerCase(Locale.ROOT);
        return a.contains(b) || b.contains(a);
    }
}
