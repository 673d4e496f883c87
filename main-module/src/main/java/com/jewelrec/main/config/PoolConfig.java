package com.jewelrec.main.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jewelrec.storage.index.IndexSettings;
import com.jewelrec.storage.index.PoolIndexFactory;
import com.jewelrec.storage.pool.PoolLoader;
import com.jewelrec.storage.pool.PoolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Slf4j
@Configuration
public class PoolConfig {

    @Bean
    public PoolIndexFactory poolIndexFactory(RecommenderProperties properties) {
        RecommenderProperties.Pools pools = properties.getPools();
        return new PoolIndexFactory(new IndexSettings(
            pools.getFlatThreshold(),
            pools.getHnsw().getM(),
            pools.getHnsw().getEfConstruction(),
            pools.getHnsw().getEfSearch()));
    }

    @Bean
    public PoolLoader poolLoader(RecommenderProperties properties, PoolIndexFactory poolIndexFactory,
                                 ObjectMapper objectMapper) {
        return new PoolLoader(Path.of(properties.getPools().getEmbeddingsDir()), poolIndexFactory, objectMapper);
    }

    @Bean
    public PoolRegistry poolRegistry(PoolLoader poolLoader, RecommenderProperties properties) {
        PoolRegistry registry = new PoolRegistry(poolLoader::load);
        if (properties.getPools().isEagerLoad()) {
            log.info("Eager loading all pools from {}", properties.getPools().getEmbeddingsDir());
            registry.loadAll();
        }
        return registry;
    }
}
