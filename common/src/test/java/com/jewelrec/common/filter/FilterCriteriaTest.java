package com.jewelrec.common.filter;

import com.jewelrec.common.exception.InvalidFilterException;
import com.jewelrec.common.exception.UnknownFilterKeyException;
import com.jewelrec.common.model.Dataset;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterCriteriaTest {

    @Test
    void parsesPriceBoundsIntoSinglePriceRange() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.DIAMONDS,
            Map.of("price_min", 1000, "price_max", "5000"));

        assertThat(criteria.criteria()).containsExactly(new PriceRange(1000.0, 5000.0));
    }

    @Test
    void mapsNumericKeyToDatasetAttribute() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.DIAMONDS, Map.of("carat_min", 1.5));

        assertThat(criteria.criteria()).containsExactly(new NumericRange("carat_weight", 1.5, null));
    }

    @Test
    void splitsDelimitedCategoricalValues() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.DIAMONDS, Map.of("color", "D, E ,F"));

        CategoricalSet set = (CategoricalSet) criteria.criteria().get(0);
        assertThat(set.values()).containsExactly("d", "e", "f");
        assertThat(set.mode()).isEqualTo(CategoricalSet.MatchMode.EXACT);
    }

    @Test
    void freeTextFieldsUseSubstringMatching() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.SETTINGS, Map.of("metal", List.of("Gold")));

        CategoricalSet set = (CategoricalSet) criteria.criteria().get(0);
        assertThat(set.mode()).isEqualTo(CategoricalSet.MatchMode.SUBSTRING);
        assertThat(set.matches("18K Rose Gold")).isTrue();
        assertThat(set.matches("Platinum")).isFalse();
    }

    @Test
    void catalogMetalKeyTargetsListAttribute() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.CATALOG, Map.of("metal", List.of("platinum")));

        assertThat(criteria.criteria().get(0).attribute()).isEqualTo("metals");
    }

    @Test
    void nullAndEmptyValuesAreIgnored() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("color", List.of());
        raw.put("price_min", null);
        raw.put("shape", "");

        assertThat(FilterCriteria.parse(Dataset.DIAMONDS, raw).isEmpty()).isTrue();
    }

    @Test
    void rejectsUnknownKeys() {
        assertThatThrownBy(() -> FilterCriteria.parse(Dataset.SETTINGS, Map.of("clarity", "VS1")))
            .isInstanceOf(UnknownFilterKeyException.class)
            .hasMessageContaining("clarity");
        assertThatThrownBy(() -> FilterCriteria.parse(Dataset.DIAMONDS, Map.of("color_min", 1)))
            .isInstanceOf(UnknownFilterKeyException.class);
    }

    @Test
    void rejectsInvertedRange() {
        assertThatThrownBy(() -> FilterCriteria.parse(Dataset.DIAMONDS, Map.of("price_min", 10, "price_max", 5)))
            .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void rejectsNonNumericBound() {
        assertThatThrownBy(() -> FilterCriteria.parse(Dataset.DIAMONDS, Map.of("price_min", "cheap")))
            .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void withReplacesCriterionOnSameAttribute() {
        FilterCriteria criteria = FilterCriteria.parse(Dataset.DIAMONDS, Map.of("shape", "Round", "color", "D"));

        FilterCriteria updated = criteria.with(
            new CategoricalSet("shape", List.of("Oval"), CategoricalSet.MatchMode.EXACT));

        assertThat(updated.criteria()).hasSize(2);
        assertThat(updated.criteria())
            .filteredOn(c -> c.attribute().equals("shape"))
            .singleElement()
            .satisfies(c -> assertThat(((CategoricalSet) c).values()).containsExactly("oval"));
    }
}
