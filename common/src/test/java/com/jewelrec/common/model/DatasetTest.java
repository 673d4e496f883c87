package com.jewelrec.common.model;

import com.jewelrec.common.exception.UnknownDatasetException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    @Test
    void lookupIsCaseInsensitive() {
        assertThat(Dataset.fromKey(" Diamonds ")).isEqualTo(Dataset.DIAMONDS);
    }

    @Test
    void unknownDatasetIsRejected() {
        assertThatThrownBy(() -> Dataset.fromKey("watches")).isInstanceOf(UnknownDatasetException.class);
    }

    @Test
    void fileNamesFollowPrefix() {
        assertThat(Dataset.SETTINGS.embeddingsFile()).isEqualTo("setting_embeddings.npy");
        assertThat(Dataset.CATALOG.metadataFile()).isEqualTo("cartier_metadata.json");
    }

    @Test
    void attributesAreLenient() {
        ItemAttributes attrs = ItemAttributes.of(Map.of("price", "1200.5", "metal", " ", "gemstones", List.of("ruby", "")));

        assertThat(attrs.price()).contains(1200.5);
        assertThat(attrs.metal()).isEmpty();
        assertThat(attrs.texts("gemstones")).containsExactly("ruby");
        assertThat(attrs.carat()).isEmpty();
    }
}
