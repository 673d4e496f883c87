package com.jewelrec.main.config;

import com.jewelrec.storage.profile.InMemoryProfileStore;
import com.jewelrec.storage.profile.RocksDbProfileStore;
import com.jewelrec.storage.profile.UserProfileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(name = "jewelry.storage.type", havingValue = "rocksdb", matchIfMissing = true)
    public UserProfileStore rocksDbProfileStore(RecommenderProperties properties) {
        return new RocksDbProfileStore(properties.getStorage().getDataPath());
    }

    @Bean
    @ConditionalOnProperty(name = "jewelry.storage.type", havingValue = "memory")
    public UserProfileStore inMemoryProfileStore() {
        log.warn("Using in-memory profile store, profiles will not survive a restart");
        return new InMemoryProfileStore();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
