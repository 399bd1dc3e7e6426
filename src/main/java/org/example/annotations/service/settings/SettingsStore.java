package org.example.annotations.service.settings;

import java.util.Optional;

/**
 * String key-value store for persisted view state. Implementations signal IO failures with
 * {@link org.example.annotations.exception.SettingsStorageException}.
 */
public interface SettingsStore {

    Optional<String> read(String key);

    void write(String key, String value);
}
