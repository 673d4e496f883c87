package com.jewelrec.main.scoring;

/**
 * Weights of the combination score terms.
 */
public record ScoringWeights(double similarity, double attribute, double compatibility, double user) {

    /** Image-bearing queries lean on visual similarity. */
    public static final ScoringWeights IMAGE_QUERY = new ScoringWeights(0.5, 0.3, 0.1, 0.1);

    /** Text-only queries lean on the attributes the text names. */
    public static final ScoringWeights TEXT_QUERY = new ScoringWeights(0.3, 0.4, 0.2, 0.1);

    public static ScoringWeights forQuery(boolean hasImage) {
        return hasImage ? IMAGE_QUERY : TEXT_QUERY;
    }
}
