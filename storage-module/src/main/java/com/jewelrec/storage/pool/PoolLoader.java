package com.jewelrec.storage.pool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jewelrec.common.exception.IndexBuildException;
import com.jewelrec.common.math.VectorMath;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.ItemAttributes;
import com.jewelrec.common.model.JewelryItem;
import com.jewelrec.storage.index.PoolIndex;
import com.jewelrec.storage.index.PoolIndexFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Загрузка пула: матрица эмбеддингов {@code .npy} плюс метаданные JSON.
 * Количество эмбеддингов и записей метаданных обязано совпадать.
 */
@Slf4j
public class PoolLoader {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final Path embeddingsDir;
    private final PoolIndexFactory indexFactory;
    private final ObjectMapper objectMapper;

    public PoolLoader(Path embeddingsDir, PoolIndexFactory indexFactory, ObjectMapper objectMapper) {
        this.embeddingsDir = embeddingsDir;
        this.indexFactory = indexFactory;
        this.objectMapper = objectMapper;
    }

    /**
     * Загрузить пул датасета из каталога эмбеддингов.
     *
     * @throws IndexBuildException если файлы отсутствуют, повреждены или не согласованы
     */
    public ItemPool load(Dataset dataset) {
        Path embeddingsFile = embeddingsDir.resolve(dataset.embeddingsFile());
        Path metadataFile = embeddingsDir.resolve(dataset.metadataFile());
        log.info("Loading {} pool from {} and {}", dataset.key(), embeddingsFile, metadataFile);

        if (!Files.isRegularFile(embeddingsFile)) {
            throw new IndexBuildException("Embeddings file not found: " + embeddingsFile);
        }
        if (!Files.isRegularFile(metadataFile)) {
            throw new IndexBuildException("Metadata file not found: " + metadataFile);
        }

        float[][] embeddings = NpyReader.read(embeddingsFile);
        List<Map<String, Object>> metadata = readMetadata(metadataFile);
        return build(dataset, embeddings, metadata);
    }

    /**
     * Построить пул из выровненных по позиции эмбеддингов и метаданных.
     * Эмбеддинги нормализуются; нулевые векторы отклоняются.
     */
    public ItemPool build(Dataset dataset, float[][] embeddings, List<Map<String, Object>> metadata) {
        if (embeddings.length != metadata.size()) {
            throw new IndexBuildException(String.format(
                "Pool %s is misaligned: %d embeddings vs %d metadata records",
                dataset.key(), embeddings.length, metadata.size()));
        }
        if (embeddings.length == 0) {
            throw new IndexBuildException("Pool " + dataset.key() + " is empty");
        }

        int dimension = embeddings[0].length;
        List<JewelryItem> items = new ArrayList<>(embeddings.length);
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < embeddings.length; i++) {
            if (embeddings[i].length != dimension || dimension == 0) {
                throw new IndexBuildException(String.format(
                    "Pool %s has inconsistent dimension at row %d: %d vs %d",
                    dataset.key(), i, embeddings[i].length, dimension));
            }
            float[] unit;
            try {
                unit = VectorMath.normalize(embeddings[i]);
            } catch (IllegalArgumentException e) {
                throw new IndexBuildException(
                    String.format("Pool %s has a zero embedding at row %d", dataset.key(), i), e);
            }
            Map<String, Object> record = metadata.get(i);
            String id = itemId(record, i);
            if (!seenIds.add(id)) {
                throw new IndexBuildException(String.format("Pool %s has duplicate item id %s", dataset.key(), id));
            }
            items.add(new JewelryItem(id, i, unit, ItemAttributes.of(record)));
        }

        PoolIndex index = indexFactory.build(items.stream().map(JewelryItem::embedding).toList(), dimension);
        ItemPool pool = new ItemPool(dataset, items, index);
        log.info("Loaded {} pool: {} items, dimension={}, index={}",
                dataset.key(), items.size(), dimension, index.type());
        return pool;
    }

    private List<Map<String, Object>> readMetadata(Path metadataFile) {
        try {
            JsonNode root = objectMapper.readTree(metadataFile.toFile());
            JsonNode data = root.isArray() ? root : root.get("data");
            if (data == null || !data.isArray()) {
                throw new IndexBuildException("Metadata file has no data array: " + metadataFile);
            }
            List<Map<String, Object>> records = new ArrayList<>(data.size());
            for (JsonNode node : data) {
                records.add(node.isObject() ? objectMapper.convertValue(node, RECORD_TYPE) : Map.of());
            }
            return records;
        } catch (IOException e) {
            throw new IndexBuildException("Failed to read metadata file " + metadataFile, e);
        }
    }

    private static String itemId(Map<String, Object> record, int position) {
        Object id = record == null ? null : record.get("id");
        if (id == null || id.toString().isBlank()) {
            return String.valueOf(position);
        }
        return id.toString();
    }
}
