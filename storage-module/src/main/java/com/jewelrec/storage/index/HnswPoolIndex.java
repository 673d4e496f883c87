package com.jewelrec.storage.index;

import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.SearchResult;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Приближённый индекс HNSW на чистой Java библиотеке hnswlib.
 * Дистанция скалярного произведения: distance = 1 - dot, поэтому оценка = 1 - distance.
 * Строится один раз, без фазы обучения.
 */
@Slf4j
public class HnswPoolIndex implements PoolIndex {

    private final HnswIndex<Integer, float[], PoolVector, Float> hnswIndex;
    private final int dimension;

    private HnswPoolIndex(HnswIndex<Integer, float[], PoolVector, Float> hnswIndex, int dimension) {
        this.hnswIndex = hnswIndex;
        this.dimension = dimension;
    }

    /**
     * Построить индекс по всем векторам пула.
     *
     * @throws IllegalStateException если построение было прервано
     */
    public static HnswPoolIndex build(List<float[]> vectors, int dimension, IndexSettings settings) {
        log.info("Building HNSW index over {} vectors: dimension={}, m={}, efConstruction={}, efSearch={}",
                vectors.size(), dimension, settings.m(), settings.efConstruction(), settings.efSearch());

        HnswIndex<Integer, float[], PoolVector, Float> index = HnswIndex
            .newBuilder(dimension, DistanceFunctions.FLOAT_INNER_PRODUCT, Math.max(1, vectors.size()))
            .withM(settings.m())
            .withEfConstruction(settings.efConstruction())
            .withEf(settings.efSearch())
            .build();

        List<PoolVector> items = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            items.add(new PoolVector(i, vectors.get(i)));
        }
        try {
            index.addAll(items);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("HNSW index build was interrupted", e);
        }

        log.info("HNSW index built with {} vectors", index.size());
        return new HnswPoolIndex(index, dimension);
    }

    @Override
    public IndexType type() {
        return IndexType.HNSW;
    }

    @Override
    public int size() {
        return hnswIndex.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<ScoredPosition> search(float[] query, int k) {
        if (k <= 0 || hnswIndex.size() == 0) {
            return List.of();
        }
        List<SearchResult<PoolVector, Float>> nearest = hnswIndex.findNearest(query, Math.min(k, hnswIndex.size()));

        List<ScoredPosition> results = new ArrayList<>(nearest.size());
        for (SearchResult<PoolVector, Float> hit : nearest) {
            results.add(new ScoredPosition(hit.item().id(), 1.0 - hit.distance()));
        }
        results.sort(ScoredPosition.RANKING);

        log.debug("HNSW search returned {} results for k={}", results.size(), k);
        return results;
    }
}
