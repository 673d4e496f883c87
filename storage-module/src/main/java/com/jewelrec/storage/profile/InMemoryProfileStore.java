package com.jewelrec.storage.profile;

import com.jewelrec.common.model.UserProfile;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Хранилище профилей в памяти процесса */
@Slf4j
public class InMemoryProfileStore implements UserProfileStore {

    private final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<UserProfile> get(String userId) {
        return Optional.ofNullable(profiles.get(userId));
    }

    @Override
    public void put(UserProfile profile) {
        profiles.put(profile.userId(), profile);
        log.debug("Stored profile for user {} in memory", profile.userId());
    }

    @Override
    public List<UserProfile> getAll() {
        return List.copyOf(profiles.values());
    }
}
