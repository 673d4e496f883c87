package com.jewelrec.main.service;

import com.jewelrec.common.filter.FilterCriteria;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.SearchResult;
import com.jewelrec.storage.pool.ItemPool;
import com.jewelrec.storage.pool.PoolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single-pool similarity search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    private final PoolRegistry poolRegistry;

    /**
     * Find the top K items of a dataset closest to the query vector
     * @param dataset pool to search
     * @param queryVector unit query vector
     * @param topK maximum number of results
     * @param criteria filters, may be empty
     * @return results ordered by descending score
     */
    public List<SearchResult> search(Dataset dataset, float[] queryVector, int topK, FilterCriteria criteria) {
        ItemPool pool = poolRegistry.get(dataset);
        List<SearchResult> results = pool.search(queryVector, topK, criteria);
        log.debug("Search in {} returned {} of requested {}", dataset.key(), results.size(), topK);
        return results;
    }
}
