package com.jewelrec.main.scoring;

import com.jewelrec.common.model.ItemAttributes;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Rule-based diamond/setting compatibility.
 */
@Component
public class CompatibilityScorer {

    private static final Set<String> PREMIUM_COLORS = Set.of("D", "E", "F");
    private static final Set<String> MID_COLORS = Set.of("G", "H", "I");
    private static final Set<String> WARM_COLORS = Set.of("J", "K", "L");

    /**
     * Additive rule credits, clipped to 1.0:
     * <ul>
     *   <li>color/metal affinity: D-F with platinum or white gold 0.3, G-I with any metal 0.2,
     *       J-L with yellow, rose or pink gold 0.25</li>
     *   <li>cut/style: round or brilliant 0.2, princess/cushion/emerald in a vintage or classic setting 0.25</li>
     *   <li>setting share of total price in [0.2, 0.4] 0.2, in [0.15, 0.5] 0.1</li>
     *   <li>carat above 2 on a band of at least 2mm 0.1, carat below 0.5 on a band of at most 3mm
     *       (or unknown) 0.1</li>
     * </ul>
     *
     * @return compatibility in [0, 1]
     */
    public double compatibility(ItemAttributes diamond, ItemAttributes setting) {
        double score = 0.0;

        String color = diamond.color().map(c -> c.toUpperCase(Locale.ROOT)).orElse("");
        String metal = lower(setting.metal());
        if (PREMIUM_COLORS.contains(color)) {
            if (metal.contains("platinum") || metal.contains("white gold")) {
                score += 0.3;
            }
        } else if (MID_COLORS.contains(color)) {
            score += 0.2;
        } else if (WARM_COLORS.contains(color)) {
            if (metal.contains("yellow gold") || metal.contains("pink gold") || metal.contains("rose gold")) {
                score += 0.25;
            }
        }

        String cut = lower(diamond.cut()) + " " + lower(diamond.shape());
        String style = lower(setting.style());
        if (cut.contains("round") || cut.contains("brilliant")) {
            score += 0.2;
        } else if (cut.contains("princess") || cut.contains("cushion") || cut.contains("emerald")) {
            if (style.contains("vintage") || style.contains("classic")) {
                score += 0.25;
            }
        }

        Optional<Double> ratio = settingPriceRatio(diamond, setting);
        if (ratio.isPresent()) {
            double r = ratio.get();
            if (r >= 0.2 && r <= 0.4) {
                score += 0.2;
            } else if (r >= 0.15 && r <= 0.5) {
                score += 0.1;
            }
        }

        Optional<Double> carat = diamond.carat().filter(c -> c > 0);
        Optional<Double> band = setting.bandWidth().filter(b -> b > 0);
        if (carat.isPresent()) {
            if (carat.get() > 2.0 && band.isPresent() && band.get() >= 2.0) {
                score += 0.1;
            } else if (carat.get() < 0.5 && (band.isEmpty() || band.get() <= 3.0)) {
                score += 0.1;
            }
        }

        return Math.min(1.0, score);
    }

    /**
     * Cheap prefilter: rejects a setting priced outside 10-60% of the total, and a band
     * narrower than 1.5mm under a diamond above 3 carats.
     */
    public boolean quickCheck(ItemAttributes diamond, ItemAttributes setting) {
        Optional<Double> ratio = settingPriceRatio(diamond, setting);
        if (ratio.isPresent() && (ratio.get() < 0.1 || ratio.get() > 0.6)) {
            return false;
        }
        double carat = diamond.carat().orElse(0.0);
        double band = setting.bandWidth().orElse(0.0);
        return !(carat > 3.0 && band > 0 && band < 1.5);
    }

    /** Setting price over total price; absent unless both prices are positive. */
    static Optional<Double> settingPriceRatio(ItemAttributes diamond, ItemAttributes setting) {
        double diamondPrice = diamond.price().orElse(0.0);
        double settingPrice = setting.price().orElse(0.0);
        if (diamondPrice <= 0 || settingPrice <= 0) {
            return Optional.empty();
        }
        return Optional.of(settingPrice / (diamondPrice + settingPrice));
    }

    private static String lower(Optional<String> value) {
        return value.map(v -> v.toLowerCase(Locale.ROOT)).orElse("");
    }
}
