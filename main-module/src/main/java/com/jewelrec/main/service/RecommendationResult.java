package com.jewelrec.main.service;

import com.jewelrec.common.model.Combination;
import com.jewelrec.main.scoring.QueryHints;

import java.util.List;

/**
 * Ranked combinations plus diagnostics about how they were produced.
 *
 * @param message            note explaining an empty result, otherwise null
 * @param prefilterBypassed  whether the cheap compatibility prefilter was skipped to keep enough pairs
 * @param personalized       whether a user vector contributed to scoring
 * @param collaborative      whether the collaborative boost was applied
 */
public record RecommendationResult(
    List<Combination> combinations,
    QueryHints hints,
    int diamondCandidates,
    int settingCandidates,
    int pairsScored,
    boolean prefilterBypassed,
    boolean personalized,
    boolean collaborative,
    String message
) {
    static RecommendationResult empty(QueryHints hints, int diamonds, int settings, String message) {
        return new RecommendationResult(List.of(), hints, diamonds, settings, 0, false, false, false, message);
    }
}
