package com.jewelrec.storage.pool;

import com.jewelrec.common.exception.InvalidQueryException;
import com.jewelrec.common.filter.FilterCriteria;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.JewelryItem;
import com.jewelrec.common.model.SearchResult;
import com.jewelrec.storage.filter.AttributeFilter;
import com.jewelrec.storage.index.FlatPoolIndex;
import com.jewelrec.storage.index.PoolIndex;
import com.jewelrec.storage.index.ScoredPosition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Неизменяемый пул элементов одного датасета вместе с индексом поиска.
 * Позиция элемента в списке совпадает с позицией его эмбеддинга в индексе.
 */
@Slf4j
public class ItemPool {

    private final Dataset dataset;
    private final List<JewelryItem> items;
    private final List<float[]> embeddings;
    private final Map<String, JewelryItem> itemsById;
    private final PoolIndex index;

    ItemPool(Dataset dataset, List<JewelryItem> items, PoolIndex index) {
        this.dataset = dataset;
        this.items = List.copyOf(items);
        this.embeddings = this.items.stream().map(JewelryItem::embedding).toList();
        this.itemsById = this.items.stream()
            .collect(Collectors.toUnmodifiableMap(JewelryItem::id, Function.identity()));
        this.index = index;
    }

    public Dataset dataset() {
        return dataset;
    }

    public int size() {
        return items.size();
    }

    public int dimension() {
        return index.dimension();
    }

    public List<JewelryItem> items() {
        return items;
    }

    /** Найти элемент по идентификатору */
    public Optional<JewelryItem> findById(String id) {
        return Optional.ofNullable(itemsById.get(id));
    }

    /** Эмбеддинг элемента по идентификатору */
    public Optional<float[]> embeddingOf(String id) {
        return findById(id).map(JewelryItem::embedding);
    }

    public List<SearchResult> search(float[] query, int k) {
        return search(query, k, FilterCriteria.none());
    }

    /**
     * Поиск с фильтром: сначала вычисляется множество подходящих позиций,
     * затем выполняется точный поиск только по нему.
     */
    public List<SearchResult> search(float[] query, int k, FilterCriteria criteria) {
        if (query == null || query.length != index.dimension()) {
            throw new InvalidQueryException(String.format(
                "Query vector dimension mismatch for %s. Expected: %d, got: %d",
                dataset.key(), index.dimension(), query == null ? 0 : query.length));
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }

        List<ScoredPosition> hits;
        if (criteria == null || criteria.isEmpty()) {
            hits = index.search(query, k);
        } else {
            int[] eligible = AttributeFilter.eligiblePositions(items, criteria);
            log.debug("Filter {} on {} kept {} of {} items", criteria, dataset.key(), eligible.length, items.size());
            if (eligible.length == 0) {
                return List.of();
            }
            hits = new FlatPoolIndex(embeddings, eligible, index.dimension()).search(query, k);
        }

        return hits.stream()
            .map(hit -> new SearchResult(items.get(hit.position()), hit.score()))
            .toList();
    }

    public PoolStats stats() {
        return new PoolStats(dataset, items.size(), index.dimension(), index.type());
    }
}
