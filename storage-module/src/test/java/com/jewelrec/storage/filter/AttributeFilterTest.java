package com.jewelrec.storage.filter;

import com.jewelrec.common.filter.CategoricalSet;
import com.jewelrec.common.filter.FilterCriteria;
import com.jewelrec.common.filter.NumericRange;
import com.jewelrec.common.filter.PriceRange;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.ItemAttributes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeFilterTest {

    @Test
    void priceRangeIsInclusiveAtBothBounds() {
        PriceRange range = new PriceRange(1000.0, 5000.0);

        assertThat(AttributeFilter.matches(range, ItemAttributes.of(Map.of("price", 1000)))).isTrue();
        assertThat(AttributeFilter.matches(range, ItemAttributes.of(Map.of("price", 5000.0)))).isTrue();
        assertThat(AttributeFilter.matches(range, ItemAttributes.of(Map.of("price", 999.99)))).isFalse();
        assertThat(AttributeFilter.matches(range, ItemAttributes.of(Map.of("price", 5000.01)))).isFalse();
    }

    @Test
    void missingAttributePasses() {
        ItemAttributes empty = ItemAttributes.empty();

        assertThat(AttributeFilter.matches(new PriceRange(1.0, 2.0), empty)).isTrue();
        assertThat(AttributeFilter.matches(new NumericRange("carat_weight", 1.0, null), empty)).isTrue();
        assertThat(AttributeFilter.matches(
            new CategoricalSet("color", List.of("D"), CategoricalSet.MatchMode.EXACT), empty)).isTrue();
    }

    @Test
    void codedGradesMatchExactlyIgnoringCase() {
        CategoricalSet colors = new CategoricalSet("color", List.of("D", "E"), CategoricalSet.MatchMode.EXACT);

        assertThat(AttributeFilter.matches(colors, ItemAttributes.of(Map.of("color", "d")))).isTrue();
        assertThat(AttributeFilter.matches(colors, ItemAttributes.of(Map.of("color", "DE")))).isFalse();
    }

    @Test
    void listAttributePassesWhenAnyElementMatches() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.CATALOG, Map.of("gemstones", "emerald,ruby"));

        assertThat(AttributeFilter.matches(criteria,
            ItemAttributes.of(Map.of("gemstones", List.of("Diamond", "Ruby"))))).isTrue();
        assertThat(AttributeFilter.matches(criteria,
            ItemAttributes.of(Map.of("gemstones", List.of("Sapphire"))))).isFalse();
    }

    @Test
    void allCriteriaMustPass() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.SETTINGS,
            Map.of("metal", "platinum", "price_max", 2000));

        assertThat(AttributeFilter.matches(criteria,
            ItemAttributes.of(Map.of("metal", "Platinum", "price", 1500)))).isTrue();
        assertThat(AttributeFilter.matches(criteria,
            ItemAttributes.of(Map.of("metal", "Platinum", "price", 2500)))).isFalse();
    }
}
