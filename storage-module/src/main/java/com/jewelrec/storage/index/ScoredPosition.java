package com.jewelrec.storage.index;

import java.util.Comparator;

/** Позиция элемента в пуле и его оценка сходства с запросом */
public record ScoredPosition(int position, double score) {

    /** По убыванию оценки, при равенстве по возрастанию позиции */
    public static final Comparator<ScoredPosition> RANKING =
        Comparator.comparingDouble(ScoredPosition::score).reversed()
            .thenComparingInt(ScoredPosition::position);
}
