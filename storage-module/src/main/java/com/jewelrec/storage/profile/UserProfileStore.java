package com.jewelrec.storage.profile;

import com.jewelrec.common.model.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище профилей пользователей. Профиль всегда перезаписывается целиком.
 * Ошибки ввода-вывода оборачиваются в {@link com.jewelrec.common.exception.ProfileStoreException}.
 */
public interface UserProfileStore {

    /** Получить профиль по ID пользователя */
    Optional<UserProfile> get(String userId);

    /** Сохранить профиль целиком */
    void put(UserProfile profile);

    /** Получить все профили */
    List<UserProfile> getAll();
}
