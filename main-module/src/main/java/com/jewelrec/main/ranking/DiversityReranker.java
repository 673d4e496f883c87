package com.jewelrec.main.ranking;

import com.jewelrec.common.math.VectorMath;
import com.jewelrec.common.model.Combination;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maximal marginal relevance re-ranking of scored combinations.
 */
@Slf4j
@Component
public class DiversityReranker {

    public static final Comparator<Combination> BY_SCORE =
        Comparator.comparingDouble(Combination::score).reversed();

    /**
     * Greedily selects {@code k} combinations maximizing
     * {@code score - lambda * max similarity to already selected}, seeded with the best score.
     * The selection is returned ordered by score.
     *
     * @param candidates scored combinations
     * @param lambda     diversity weight; 0 yields the plain top-k
     */
    public List<Combination> rerank(List<Combination> candidates, int k, double lambda) {
        if (candidates.size() <= k) {
            return candidates;
        }
        List<Combination> remaining = new ArrayList<>(candidates);
        remaining.sort(BY_SCORE);
        if (lambda <= 0) {
            return List.copyOf(remaining.subList(0, k));
        }

        List<Combination> selected = new ArrayList<>(k);
        selected.add(remaining.remove(0));
        while (selected.size() < k && !remaining.isEmpty()) {
            int bestIndex = 0;
            double bestValue = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                Combination candidate = remaining.get(i);
                double value = candidate.score() - lambda * maxSimilarity(candidate, selected);
                if (value > bestValue) {
                    bestValue = value;
                    bestIndex = i;
                }
            }
            selected.add(remaining.remove(bestIndex));
        }
        selected.sort(BY_SCORE);
        log.debug("MMR selected {} of {} candidates with lambda {}", selected.size(), candidates.size(), lambda);
        return selected;
    }

    private static double maxSimilarity(Combination candidate, List<Combination> selected) {
        double max = Double.NEGATIVE_INFINITY;
        for (Combination chosen : selected) {
            max = Math.max(max, VectorMath.dot(candidate.pairEmbedding(), chosen.pairEmbedding()));
        }
        return max;
    }
}
