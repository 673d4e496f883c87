package com.jewelrec.main.scoring;

import com.jewelrec.common.model.ItemAttributes;
import com.jewelrec.common.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexicon-based detection of metal, diamond color grade and shape in query text,
 * with majority-vote inference from top candidates for hints the text lacks.
 */
@Slf4j
@Component
public class HintExtractor {

    /** Candidates per pool considered when inferring a missing hint. */
    static final int INFERENCE_DEPTH = 5;

    // Specific gold phrases precede the bare "gold" fallback.
    private static final List<LexiconEntry> METALS = List.of(
        entry("platinum", "\\bplatinum\\b", "\\bpt\\b"),
        entry("white gold", "white\\s*gold", "18k white"),
        entry("rose gold", "rose\\s*gold", "pink\\s*gold", "18k rose", "18k pink"),
        entry("yellow gold", "yellow\\s*gold", "18k yellow", "\\bgold\\b")
    );

    // "square step" must win over the bare "square" of princess.
    private static final List<LexiconEntry> SHAPES = List.of(
        entry("Round", "\\bround\\b", "\\bcircle\\b", "\\bcircular\\b"),
        entry("Asscher", "\\basscher\\b", "\\bsquare step\\b"),
        entry("Princess", "\\bprincess\\b", "\\bsquare\\b"),
        entry("Cushion", "\\bcushion\\b", "\\bpillow\\b"),
        entry("Oval", "\\boval\\b", "\\belliptical\\b"),
        entry("Emerald", "\\bemerald\\b", "\\brectangular\\b"),
        entry("Pear", "\\bpear\\b", "\\bteardrop\\b"),
        entry("Marquise", "\\bmarquise\\b", "\\bnavette\\b"),
        entry("Radiant", "\\bradiant\\b"),
        entry("Heart", "\\bheart\\b")
    );

    private static final Pattern COLOR_BEFORE = Pattern.compile("\\b([d-n])[ -]colou?r\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COLOR_AFTER = Pattern.compile("\\bcolou?r:?\\s+([d-n])\\b", Pattern.CASE_INSENSITIVE);
    // Bare uppercase grade token; "I" is excluded because it is usually the pronoun.
    private static final Pattern COLOR_TOKEN = Pattern.compile("(?<![\\w-])([D-HJ-N])(?![\\w-])");

    /**
     * Extracts explicit hints from query text. Missing hints stay unset.
     */
    public QueryHints extract(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return QueryHints.none();
        }
        String lower = queryText.toLowerCase(Locale.ROOT);
        String metal = match(METALS, lower);
        String color = extractColor(queryText);
        String shape = match(SHAPES, lower);

        QueryHints hints = new QueryHints(metal, color, shape, metal != null, color != null, shape != null);
        log.debug("Extracted hints {} from query text", hints);
        return hints;
    }

    /**
     * Fills hints the text did not provide by majority vote over the top candidates:
     * metal from settings, color and shape from diamonds. Ties go to the value seen first.
     */
    public QueryHints inferMissing(QueryHints hints, List<SearchResult> diamonds, List<SearchResult> settings) {
        QueryHints result = hints;
        if (hints.metal() == null) {
            result = result.withInferredMetal(
                majority(settings, attrs -> attrs.metal().map(m -> m.toLowerCase(Locale.ROOT))));
        }
        if (hints.color() == null) {
            result = result.withInferredColor(
                majority(diamonds, attrs -> attrs.color().map(c -> c.toUpperCase(Locale.ROOT))));
        }
        if (hints.shape() == null) {
            result = result.withInferredShape(
                majority(diamonds, attrs -> attrs.shape().map(HintExtractor::capitalize)));
        }
        return result;
    }

    static String extractColor(String queryText) {
        for (Pattern pattern : List.of(COLOR_BEFORE, COLOR_AFTER, COLOR_TOKEN)) {
            Matcher matcher = pattern.matcher(queryText);
            if (matcher.find()) {
                return matcher.group(1).toUpperCase(Locale.ROOT);
            }
        }
        return null;
    }

    private static String match(List<LexiconEntry> lexicon, String lowerText) {
        for (LexiconEntry entry : lexicon) {
            for (Pattern pattern : entry.patterns()) {
                if (pattern.matcher(lowerText).find()) {
                    return entry.canonical();
                }
            }
        }
        return null;
    }

    private static String majority(List<SearchResult> candidates, Function<ItemAttributes, Optional<String>> extractor) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        candidates.stream()
            .limit(INFERENCE_DEPTH)
            .map(candidate -> extractor.apply(candidate.metadata()))
            .flatMap(Optional::stream)
            .forEach(value -> counts.merge(value, 1, Integer::sum));

        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    static String capitalize(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private static LexiconEntry entry(String canonical, String... regexes) {
        return new LexiconEntry(canonical, Arrays.stream(regexes).map(Pattern::compile).toList());
    }

    private record LexiconEntry(String canonical, List<Pattern> patterns) {
    }
}
