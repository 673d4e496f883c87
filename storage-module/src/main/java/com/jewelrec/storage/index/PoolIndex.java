package com.jewelrec.storage.index;

import java.util.List;

/**
 * Индекс поиска ближайших соседей по эмбеддингам одного пула.
 * После построения индекс только читается и безопасен для параллельного поиска.
 */
public interface PoolIndex {

    /** Тип индекса */
    IndexType type();

    /** Количество проиндексированных векторов */
    int size();

    /** Размерность векторов */
    int dimension();

    /**
     * Найти до {@code k} ближайших векторов. Результат упорядочен по убыванию оценки,
     * равные оценки упорядочены по позиции в пуле.
     */
    List<ScoredPosition> search(float[] query, int k);
}
