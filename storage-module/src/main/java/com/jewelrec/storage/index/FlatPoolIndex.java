package com.jewelrec.storage.index;

import com.jewelrec.common.math.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Точный индекс: полный перебор по скалярному произведению.
 * Может быть построен над подмножеством позиций пула (для поиска с фильтрами).
 */
@Slf4j
public class FlatPoolIndex implements PoolIndex {

    private final List<float[]> vectors;
    private final int[] positions;
    private final int dimension;

    /** Индекс над всеми векторами пула */
    public FlatPoolIndex(List<float[]> vectors, int dimension) {
        this(vectors, identity(vectors.size()), dimension);
    }

    /** Индекс над выбранными позициями пула */
    public FlatPoolIndex(List<float[]> vectors, int[] positions, int dimension) {
        this.vectors = vectors;
        this.positions = positions;
        this.dimension = dimension;
    }

    @Override
    public IndexType type() {
        return IndexType.FLAT;
    }

    @Override
    public int size() {
        return positions.length;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<ScoredPosition> search(float[] query, int k) {
        if (k <= 0 || positions.length == 0) {
            return List.of();
        }
        List<ScoredPosition> scored = new ArrayList<>(positions.length);
        for (int position : positions) {
            scored.add(new ScoredPosition(position, VectorMath.dot(query, vectors.get(position))));
        }
        scored.sort(ScoredPosition.RANKING);
        int resultSize = Math.min(k, scored.size());

        log.debug("Flat search scanned {} vectors, returning top {}", scored.size(), resultSize);
        return List.copyOf(scored.subList(0, resultSize));
    }

    private static int[] identity(int size) {
        int[] positions = new int[size];
        for (int i = 0; i < size; i++) {
            positions[i] = i;
        }
        return positions;
    }
}
