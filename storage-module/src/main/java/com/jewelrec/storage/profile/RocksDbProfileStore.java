package com.jewelrec.storage.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jewelrec.common.exception.ProfileStoreException;
import com.jewelrec.common.model.UserProfile;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище профилей в RocksDB. Ключ - ID пользователя, значение - JSON документ профиля.
 */
@Slf4j
public class RocksDbProfileStore implements UserProfileStore {

    private static final String PROFILES_CF = "user_profiles";

    private final String dataPath;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private RocksDB rocksDB;
    private DBOptions dbOptions;
    private final List<ColumnFamilyHandle> handles = new ArrayList<>();
    private ColumnFamilyHandle profilesHandle;

    public RocksDbProfileStore(String dataPath) {
        this.dataPath = dataPath;
    }

    @PostConstruct
    public void initialize() {
        RocksDB.loadLibrary();

        try {
            Path dbPath = Paths.get(dataPath);
            dbPath.toFile().mkdirs();

            List<ColumnFamilyDescriptor> columnFamilyDescriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor(PROFILES_CF.getBytes(StandardCharsets.UTF_8))
            );

            dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);

            rocksDB = RocksDB.open(dbOptions, dbPath.toString(), columnFamilyDescriptors, handles);
            profilesHandle = handles.get(1);

            log.info("RocksDB profile store initialized at path: {}", dbPath);

        } catch (RocksDBException e) {
            log.error("Failed to initialize RocksDB profile store", e);
            throw new ProfileStoreException("Failed to initialize profile storage", e);
        }
    }

    @Override
    public Optional<UserProfile> get(String userId) {
        try {
            byte[] value = rocksDB.get(profilesHandle, key(userId));
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value, UserProfile.class));
        } catch (RocksDBException | IOException e) {
            throw new ProfileStoreException("Failed to read profile of user " + userId, e);
        }
    }

    @Override
    public void put(UserProfile profile) {
        try {
            byte[] value = objectMapper.writeValueAsBytes(profile);
            rocksDB.put(profilesHandle, key(profile.userId()), value);
        } catch (RocksDBException | IOException e) {
            throw new ProfileStoreException("Failed to write profile of user " + profile.userId(), e);
        }
    }

    @Override
    public List<UserProfile> getAll() {
        List<UserProfile> profiles = new ArrayList<>();

        try (RocksIterator iterator = rocksDB.newIterator(profilesHandle)) {
            iterator.seekToFirst();

            while (iterator.isValid()) {
                profiles.add(objectMapper.readValue(iterator.value(), UserProfile.class));
                iterator.next();
            }
        } catch (IOException e) {
            throw new ProfileStoreException("Failed to read stored profiles", e);
        }

        return profiles;
    }

    @PreDestroy
    public void cleanup() {
        if (rocksDB != null) {
            handles.forEach(ColumnFamilyHandle::close);
            rocksDB.close();
            rocksDB = null;
            log.info("RocksDB profile store closed successfully");
        }
        if (dbOptions != null) {
            dbOptions.close();
            dbOptions = null;
        }
    }

    private static byte[] key(String userId) {
        return userId.getBytes(StandardCharsets.UTF_8);
    }
}
