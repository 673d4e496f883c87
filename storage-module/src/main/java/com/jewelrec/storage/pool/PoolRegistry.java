package com.jewelrec.storage.pool;

import com.jewelrec.common.model.Dataset;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Реестр пулов с атомарной операцией получения или создания.
 * Каждый пул строится ровно один раз; последующие чтения не блокируются.
 */
@Slf4j
public class PoolRegistry {

    private final Function<Dataset, ItemPool> loader;
    private final Map<Dataset, ItemPool> pools = new ConcurrentHashMap<>();
    private final Object buildLock = new Object();

    public PoolRegistry(Function<Dataset, ItemPool> loader) {
        this.loader = loader;
    }

    /** Получить пул, построив его при первом обращении */
    public ItemPool get(Dataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        ItemPool pool = pools.get(dataset);
        if (pool != null) {
            return pool;
        }
        synchronized (buildLock) {
            pool = pools.get(dataset);
            if (pool == null) {
                log.info("Pool {} requested for the first time, building", dataset.key());
                pool = loader.apply(dataset);
                pools.put(dataset, pool);
            }
            return pool;
        }
    }

    public boolean isLoaded(Dataset dataset) {
        return pools.containsKey(dataset);
    }

    /** Загрузить все пулы заранее */
    public void loadAll() {
        Arrays.stream(Dataset.values()).forEach(this::get);
    }

    /** Статистика загруженных пулов */
    public List<PoolStats> stats() {
        return Arrays.stream(Dataset.values())
            .map(pools::get)
            .filter(Objects::nonNull)
            .map(ItemPool::stats)
            .toList();
    }
}
