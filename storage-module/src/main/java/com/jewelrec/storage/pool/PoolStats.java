package com.jewelrec.storage.pool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.storage.index.IndexType;

public record PoolStats(
    @JsonProperty("dataset")
    Dataset dataset,

    @JsonProperty("item_count")
    int itemCount,

    @JsonProperty("dimension")
    int dimension,

    @JsonProperty("index_type")
    IndexType indexType
) {
}
