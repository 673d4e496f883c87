package com.jewelrec.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.jewelrec.common.exception.UnknownDatasetException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Searchable item pools. Each dataset knows its file base name and which
 * attributes may be used as filter keys.
 */
public enum Dataset {

    DIAMONDS("diamonds", "diamond", List.of(
        FilterField.numeric("price", "price"),
        FilterField.numeric("carat", "carat_weight"),
        FilterField.exact("color", "color"),
        FilterField.exact("clarity", "clarity"),
        FilterField.exact("cut", "cut"),
        FilterField.exact("shape", "shape"),
        FilterField.exact("lab", "lab")
    )),

    SETTINGS("settings", "setting", List.of(
        FilterField.numeric("price", "price"),
        FilterField.numeric("band_width", "band_width_mm"),
        FilterField.substring("metal", "metal"),
        FilterField.substring("style", "style"),
        FilterField.exact("gemstones", "gemstones")
    )),

    CATALOG("catalog", "cartier", List.of(
        FilterField.numeric("price", "price"),
        FilterField.numeric("band_width", "band_width_mm"),
        FilterField.exact("metal", "metals"),
        FilterField.exact("gemstones", "gemstones"),
        FilterField.exact("styles", "styles")
    ));

    private final String key;
    private final String filePrefix;
    private final List<FilterField> filterFields;

    Dataset(String key, String filePrefix, List<FilterField> filterFields) {
        this.key = key;
        this.filePrefix = filePrefix;
        this.filterFields = filterFields;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Item key unique across datasets, e.g. {@code diamonds:42}.
     */
    public String qualify(String itemId) {
        return key + ":" + itemId;
    }

    public String embeddingsFile() {
        return filePrefix + "_embeddings.npy";
    }

    public String metadataFile() {
        return filePrefix + "_metadata.json";
    }

    public List<FilterField> filterFields() {
        return filterFields;
    }

    public Optional<FilterField> filterField(String filterKey) {
        return filterFields.stream()
            .filter(field -> field.key().equals(filterKey))
            .findFirst();
    }

    @JsonCreator
    public static Dataset fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new UnknownDatasetException("Dataset must be specified");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Dataset dataset : values()) {
            if (dataset.key.equals(normalized)) {
                return dataset;
            }
        }
        throw new UnknownDatasetException("Unknown dataset: " + key);
    }

    /** How a filter key is matched against an item attribute. */
    public enum FieldKind {
        /** Inclusive numeric range via {@code <key>_min} / {@code <key>_max}. */
        NUMERIC,
        /** Case-insensitive equality, for coded grades and tag lists. */
        EXACT,
        /** Case-insensitive containment, for free-text fields. */
        SUBSTRING
    }

    public record FilterField(String key, String attribute, FieldKind kind) {

        static FilterField numeric(String key, String attribute) {
            return new FilterField(key, attribute, FieldKind.NUMERIC);
        }

        static FilterField exact(String key, String attribute) {
            return new FilterField(key, attribute, FieldKind.EXACT);
        }

        static FilterField substring(String key, String attribute) {
            return new FilterField(key, attribute, FieldKind.SUBSTRING);
        }
    }
}
