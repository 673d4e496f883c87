package com.jewelrec.storage.index;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/** Выбор типа индекса по размеру пула */
@Slf4j
public class PoolIndexFactory {

    private final IndexSettings settings;

    public PoolIndexFactory(IndexSettings settings) {
        this.settings = settings;
    }

    public PoolIndex build(List<float[]> vectors, int dimension) {
        if (vectors.size() < settings.flatThreshold()) {
            log.debug("Pool of {} vectors is below threshold {}, using flat index",
                    vectors.size(), settings.flatThreshold());
            return new FlatPoolIndex(vectors, dimension);
        }
        return HnswPoolIndex.build(vectors, dimension, settings);
    }

    public IndexSettings settings() {
        return settings;
    }
}
