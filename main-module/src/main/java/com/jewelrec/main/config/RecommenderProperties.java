package com.jewelrec.main.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for item pools, personalization, scoring and storage.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "jewelry")
public class RecommenderProperties {

    @Valid
    @NotNull
    private Pools pools = new Pools();

    @Valid
    @NotNull
    private Personalization personalization = new Personalization();

    @Valid
    @NotNull
    private Scoring scoring = new Scoring();

    @Valid
    @NotNull
    private Storage storage = new Storage();

    @Valid
    @NotNull
    private Embedding embedding = new Embedding();

    @Data
    public static class Pools {
        /**
         * Directory holding {@code <prefix>_embeddings.npy} and {@code <prefix>_metadata.json} files.
         */
        @NotBlank
        private String embeddingsDir = "embeddings";

        /**
         * Pools smaller than this use an exact flat index, larger ones an HNSW graph.
         */
        @Min(0)
        private int flatThreshold = 10_000;

        @Valid
        @NotNull
        private Hnsw hnsw = new Hnsw();

        /**
         * Candidates retrieved from each pool before pairing.
         */
        @Min(1)
        private int maxCandidates = 15;

        /**
         * Load all pools at startup instead of on first use.
         */
        private boolean eagerLoad = false;
    }

    @Data
    public static class Hnsw {
        @Min(2)
        private int m = 32;
        @Min(1)
        private int efConstruction = 200;
        @Min(1)
        private int efSearch = 100;
    }

    @Data
    public static class Personalization {
        @DecimalMin("0.0")
        private double baseWeight = 0.6;
        @DecimalMin("0.0")
        private double interactionWeight = 0.4;

        /**
         * Age in days at which an interaction counts half as much.
         */
        @DecimalMin(value = "0.0", inclusive = false)
        private double halfLifeDays = 30;

        @Min(1)
        private int maxInteractions = 100;

        /**
         * Users with fewer interactions are treated as cold regardless of their vector.
         */
        @Min(0)
        private int sparseThreshold = 3;

        @Min(1)
        private int sequentialWindow = 5;
    }

    @Data
    public static class Scoring {
        /**
         * MMR lambda; 0 disables diversity re-ranking.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double diversityWeight = 0.1;
        @DecimalMin("0.0")
        private double collaborativeBoostWeight = 0.2;
        @DecimalMin("0.0")
        private double sequentialBoostWeight = 0.15;
        private boolean useSequential = true;
    }

    @Data
    public static class Storage {
        @NotNull
        private StorageType type = StorageType.ROCKSDB;
        @NotBlank
        private String dataPath = "./data/profiles";
    }

    public enum StorageType {
        ROCKSDB,
        MEMORY
    }

    @Data
    public static class Embedding {
        @NotBlank
        private String baseUrl = "http://localhost:8001";
        @NotNull
        private Duration connectionTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
