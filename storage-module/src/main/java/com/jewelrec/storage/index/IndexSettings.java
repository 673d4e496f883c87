package com.jewelrec.storage.index;

/**
 * Параметры выбора и построения индекса.
 *
 * @param flatThreshold пулы меньше этого размера получают точный индекс
 * @param m             число соседей в графе HNSW
 * @param efConstruction качество построения HNSW
 * @param efSearch      ширина поиска HNSW
 */
public record IndexSettings(int flatThreshold, int m, int efConstruction, int efSearch) {

    public static final IndexSettings DEFAULTS = new IndexSettings(10_000, 32, 200, 100);

    public IndexSettings {
        if (flatThreshold < 0) {
            throw new IllegalArgumentException("Flat threshold cannot be negative");
        }
        if (m <= 0 || efConstruction <= 0 || efSearch <= 0) {
            throw new IllegalArgumentException("HNSW parameters must be positive");
        }
    }
}
