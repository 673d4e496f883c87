package com.jewelrec.main.service;

import com.jewelrec.common.filter.CategoricalSet;
import com.jewelrec.common.filter.FilterCriteria;
import com.jewelrec.common.model.Combination;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.ItemAttributes;
import com.jewelrec.common.model.SearchResult;
import com.jewelrec.common.model.UserProfile;
import com.jewelrec.main.config.RecommenderProperties;
import com.jewelrec.main.embedding.EmbeddedQuery;
import com.jewelrec.main.personalization.CollaborativeFilter;
import com.jewelrec.main.personalization.ItemScore;
import com.jewelrec.main.personalization.SequentialBooster;
import com.jewelrec.main.personalization.UserPreferenceModel;
import com.jewelrec.main.ranking.DiversityReranker;
import com.jewelrec.main.scoring.CombinationScorer;
import com.jewelrec.main.scoring.CompatibilityScorer;
import com.jewelrec.main.scoring.HintExtractor;
import com.jewelrec.main.scoring.QueryHints;
import com.jewelrec.storage.pool.PoolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Diamond and setting combination recommendations: retrieval, hint extraction,
 * pairing, scoring, personalization boosts and diversity re-ranking.
 */
@Slf4j
@Service
public class RecommendationService {

    private final PoolRegistry poolRegistry;
    private final HintExtractor hintExtractor;
    private final CompatibilityScorer compatibilityScorer;
    private final CombinationScorer combinationScorer;
    private final UserPreferenceModel preferenceModel;
    private final CollaborativeFilter collaborativeFilter;
    private final SequentialBooster sequentialBooster;
    private final DiversityReranker reranker;
    private final RecommenderProperties.Scoring scoring;
    private final int maxCandidates;

    public RecommendationService(PoolRegistry poolRegistry,
                                 HintExtractor hintExtractor,
                                 CompatibilityScorer compatibilityScorer,
                                 CombinationScorer combinationScorer,
                                 UserPreferenceModel preferenceModel,
                                 CollaborativeFilter collaborativeFilter,
                                 SequentialBooster sequentialBooster,
                                 DiversityReranker reranker,
                                 RecommenderProperties properties) {
        this.poolRegistry = poolRegistry;
        this.hintExtractor = hintExtractor;
        this.compatibilityScorer = compatibilityScorer;
        this.combinationScorer = combinationScorer;
        this.preferenceModel = preferenceModel;
        this.collaborativeFilter = collaborativeFilter;
        this.sequentialBooster = sequentialBooster;
        this.reranker = reranker;
        this.scoring = properties.getScoring();
        this.maxCandidates = properties.getPools().getMaxCandidates();
    }

    /**
     * Recommend diamond and setting combinations for a query
     * @param query embedded query with its raw text
     * @param topK number of combinations to return
     * @param userId optional user for personalization
     * @param diamondFilters filters on the diamond pool
     * @param settingFilters filters on the setting pool
     * @return ranked combinations, empty with a message when no candidates exist
     */
    public RecommendationResult recommend(EmbeddedQuery query, int topK, String userId,
                                          FilterCriteria diamondFilters, FilterCriteria settingFilters) {
        QueryHints hints = hintExtractor.extract(query.text());

        FilterCriteria diamondCriteria = diamondFilters == null ? FilterCriteria.none() : diamondFilters;
        if (hints.shapeExplicit()) {
            diamondCriteria = diamondCriteria.with(
                new CategoricalSet(ItemAttributes.SHAPE, List.of(hints.shape()), CategoricalSet.MatchMode.EXACT));
        }

        List<SearchResult> diamonds = poolRegistry.get(Dataset.DIAMONDS)
            .search(query.vector(), maxCandidates, diamondCriteria);
        List<SearchResult> settings = poolRegistry.get(Dataset.SETTINGS)
            .search(query.vector(), maxCandidates, settingFilters == null ? FilterCriteria.none() : settingFilters);
        log.debug("Retrieved {} diamonds and {} settings", diamonds.size(), settings.size());

        if (diamonds.isEmpty() || settings.isEmpty()) {
            String missing = diamonds.isEmpty() ? "diamonds" : "settings";
            return RecommendationResult.empty(hints, diamonds.size(), settings.size(),
                "No " + missing + " matched the query and filters");
        }

        hints = hintExtractor.inferMissing(hints, diamonds, settings);

        List<Pair> pairs = pairCandidates(diamonds, settings, hints);
        List<Pair> compatible = pairs.stream()
            .filter(pair -> compatibilityScorer.quickCheck(pair.diamond().metadata(), pair.setting().metadata()))
            .toList();
        boolean bypassed = compatible.size() < topK;
        if (bypassed) {
            log.debug("Prefilter kept {} of {} pairs, below top_k {}; scoring all pairs",
                compatible.size(), pairs.size(), topK);
        }
        List<Pair> toScore = bypassed ? pairs : compatible;

        Optional<UserProfile> profile = userId == null ? Optional.empty() : preferenceModel.profile(userId);
        Optional<float[]> userVector = profile.flatMap(preferenceModel::hybridVector);

        List<Combination> scored = new ArrayList<>(toScore.size());
        for (Pair pair : toScore) {
            combinationScorer.score(pair.diamond(), pair.setting(), userVector, hints, query.hasImage())
                .ifPresent(scored::add);
        }

        boolean useCollaborative = userId != null
            && (userVector.isEmpty() || profile.map(preferenceModel::isSparse).orElse(true));
        Map<String, Double> collaborativeBoost = useCollaborative
            ? collaborativeBoost(userId, query.vector(), diamonds, settings)
            : Map.of();
        Optional<float[]> trend = scoring.isUseSequential()
            ? profile.flatMap(this::trendVector)
            : Optional.empty();

        List<Combination> boosted = new ArrayList<>(scored.size());
        for (Combination combination : scored) {
            double collaborative = Math.max(
                collaborativeBoost.getOrDefault(Dataset.DIAMONDS.qualify(combination.diamond().id()), 0.0),
                collaborativeBoost.getOrDefault(Dataset.SETTINGS.qualify(combination.setting().id()), 0.0));
            double sequential = trend.map(t -> sequentialBooster.boost(t, combination.pairEmbedding())).orElse(0.0);
            double score = combination.score()
                + scoring.getCollaborativeBoostWeight() * collaborative
                + scoring.getSequentialBoostWeight() * sequential;
            boosted.add(combination.withScore(score, combination.breakdown().toBuilder()
                .collaborativeBoost(collaborative)
                .sequentialBoost(sequential)
                .build()));
        }
        boosted.sort(DiversityReranker.BY_SCORE);

        List<Combination> ranked = reranker.rerank(boosted, topK, scoring.getDiversityWeight());
        List<Combination> top = ranked.size() > topK ? List.copyOf(ranked.subList(0, topK)) : ranked;

        log.info("Recommended {} combinations from {} scored pairs (user={}, hints={})",
            top.size(), scored.size(), userId, hints);
        return new RecommendationResult(top, hints, diamonds.size(), settings.size(), scored.size(),
            bypassed, userVector.isPresent(), !collaborativeBoost.isEmpty(),
            top.isEmpty() ? "No compatible combinations found" : null);
    }

    /**
     * Pairs matching the explicit metal and color hints, or the full cross product when none match.
     */
    List<Pair> pairCandidates(List<SearchResult> diamonds, List<SearchResult> settings, QueryHints hints) {
        List<Pair> all = new ArrayList<>(diamonds.size() * settings.size());
        List<Pair> matched = new ArrayList<>();
        for (SearchResult diamond : diamonds) {
            for (SearchResult setting : settings) {
                Pair pair = new Pair(diamond, setting);
                all.add(pair);
                if (matchesExplicitHints(pair, hints)) {
                    matched.add(pair);
                }
            }
        }
        if (!hints.metalExplicit() && !hints.colorExplicit()) {
            return all;
        }
        if (matched.isEmpty()) {
            log.debug("No pair matches explicit hints {}, using cross product of {}", hints, all.size());
            return all;
        }
        return matched;
    }

    private static boolean matchesExplicitHints(Pair pair, QueryHints hints) {
        if (hints.metalExplicit()) {
            Optional<String> metal = pair.setting().metadata().metal();
            if (metal.isPresent() && !CombinationScorer.overlaps(metal.get(), hints.metal())) {
                return false;
            }
        }
        if (hints.colorExplicit()) {
            Optional<String> color = pair.diamond().metadata().color();
            if (color.isPresent() && !color.get().equalsIgnoreCase(hints.color())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collaborative scores keyed by qualified item id, normalized by the top score.
     * Failures degrade to no boost.
     */
    private Map<String, Double> collaborativeBoost(String userId, float[] queryVector,
                                                   List<SearchResult> diamonds, List<SearchResult> settings) {
        try {
            Map<String, float[]> itemEmbeddings = new LinkedHashMap<>();
            diamonds.forEach(d -> itemEmbeddings.put(Dataset.DIAMONDS.qualify(d.id()), d.embedding()));
            settings.forEach(s -> itemEmbeddings.put(Dataset.SETTINGS.qualify(s.id()), s.embedding()));

            List<ItemScore> recommendations = collaborativeFilter.recommend(
                userId, preferenceModel.allUserVectors(), itemEmbeddings, queryVector, itemEmbeddings.size());
            if (recommendations.isEmpty() || recommendations.get(0).score() <= 0) {
                return Map.of();
            }
            double top = recommendations.get(0).score();
            Map<String, Double> boost = new HashMap<>();
            for (ItemScore item : recommendations) {
                boost.put(item.itemId(), Math.max(0.0, item.score() / top));
            }
            log.debug("Collaborative boost for user {} covers {} items", userId, boost.size());
            return boost;
        } catch (RuntimeException e) {
            log.warn("Collaborative boost failed for user {}: {}", userId, e.getMessage());
            return Map.of();
        }
    }

    private Optional<float[]> trendVector(UserProfile profile) {
        try {
            return sequentialBooster.trendVector(profile);
        } catch (RuntimeException e) {
            log.warn("Sequential boost failed for user {}: {}", profile.userId(), e.getMessage());
            return Optional.empty();
        }
    }

    record Pair(SearchResult diamond, SearchResult setting) {
    }
}
