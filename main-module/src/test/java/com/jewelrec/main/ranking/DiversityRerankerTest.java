package com.jewelrec.main.ranking;

import com.jewelrec.common.model.Combination;
import com.jewelrec.common.model.ScoreBreakdown;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jewelrec.main.TestItems.axis;
import static com.jewelrec.main.TestItems.hit;
import static com.jewelrec.main.TestItems.unit;
import static org.assertj.core.api.Assertions.assertThat;

class DiversityRerankerTest {

    private final DiversityReranker reranker = new DiversityReranker();

    @Test
    void zeroLambdaIsPlainTopK() {
        List<Combination> candidates = List.of(
            combo("a", axis(3, 0), 0.5),
            combo("b", axis(3, 0), 0.9),
            combo("c", axis(3, 1), 0.7),
            combo("d", axis(3, 2), 0.8));

        List<Combination> ranked = reranker.rerank(candidates, 3, 0.0);

        assertThat(ranked).extracting(c -> c.diamond().id()).containsExactly("b", "d", "c");
    }

    @Test
    void identicalCandidatesDoNotBothSurvive() {
        List<Combination> candidates = List.of(
            combo("first", axis(3, 0), 0.90),
            combo("twin", axis(3, 0), 0.89),
            combo("other", axis(3, 1), 0.80));

        List<Combination> ranked = reranker.rerank(candidates, 2, 0.5);

        assertThat(ranked).extracting(c -> c.diamond().id()).containsExactly("first", "other");
    }

    @Test
    void seedsWithHighestScoreAndReturnsScoreOrder() {
        List<Combination> candidates = List.of(
            combo("low", unit(0, 1, 1), 0.60),
            combo("top", axis(3, 0), 0.95),
            combo("near", unit(1, 0.1f, 0), 0.94),
            combo("far", axis(3, 2), 0.70));

        List<Combination> ranked = reranker.rerank(candidates, 2, 0.3);

        assertThat(ranked).extracting(c -> c.diamond().id()).containsExactly("top", "far");
        assertThat(ranked).isSortedAccordingTo(DiversityReranker.BY_SCORE);
    }

    @Test
    void fewerCandidatesThanKAreReturnedUnchanged() {
        List<Combination> candidates = List.of(combo("a", axis(3, 0), 0.1), combo("b", axis(3, 0), 0.9));

        assertThat(reranker.rerank(candidates, 5, 0.1)).isSameAs(candidates);
    }

    private static Combination combo(String id, float[] embedding, double score) {
        return new Combination(hit(id, embedding, score), hit("s-" + id, embedding, score), embedding, score,
            ScoreBreakdown.builder().build());
    }
}
