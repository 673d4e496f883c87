package com.jewelrec.storage.filter;

import com.jewelrec.common.filter.CategoricalSet;
import com.jewelrec.common.filter.FilterCriteria;
import com.jewelrec.common.filter.FilterCriterion;
import com.jewelrec.common.filter.NumericRange;
import com.jewelrec.common.filter.PriceRange;
import com.jewelrec.common.model.ItemAttributes;
import com.jewelrec.common.model.JewelryItem;

import java.util.List;
import java.util.Optional;

/**
 * Проверка метаданных элемента на соответствие критериям фильтра.
 * Отсутствующий атрибут никогда не отсекает элемент.
 */
public final class AttributeFilter {

    private AttributeFilter() {
    }

    /** Элемент проходит все критерии */
    public static boolean matches(FilterCriteria criteria, ItemAttributes attributes) {
        for (FilterCriterion criterion : criteria.criteria()) {
            if (!matches(criterion, attributes)) {
                return false;
            }
        }
        return true;
    }

    /** Элемент проходит один критерий */
    public static boolean matches(FilterCriterion criterion, ItemAttributes attributes) {
        if (criterion instanceof PriceRange range) {
            Optional<Double> price = attributes.price();
            return price.isEmpty() || range.contains(price.get());
        }
        if (criterion instanceof NumericRange range) {
            Optional<Double> value = attributes.number(range.attribute());
            return value.isEmpty() || range.contains(value.get());
        }
        if (criterion instanceof CategoricalSet set) {
            List<String> values = attributes.texts(set.attribute());
            return values.isEmpty() || values.stream().anyMatch(set::matches);
        }
        throw new IllegalArgumentException("Unsupported filter criterion: " + criterion.getClass().getSimpleName());
    }

    /** Позиции элементов пула, прошедших фильтр, в исходном порядке */
    public static int[] eligiblePositions(List<JewelryItem> items, FilterCriteria criteria) {
        return items.stream()
            .filter(item -> matches(criteria, item.attributes()))
            .mapToInt(JewelryItem::position)
            .toArray();
    }
}
