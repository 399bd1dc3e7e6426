package org.example.annotations.service.settings;

import org.example.annotations.config.AnnotationProperties;
import org.example.annotations.exception.ConfigurationException;
import org.example.annotations.exception.SettingsStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores each key as {@code <key>.json} under the configured settings directory. Last write wins.
 */
@Component
public class FileSettingsStore implements SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(FileSettingsStore.class);

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path storageDir;

    public FileSettingsStore(AnnotationProperties properties) {
        this.storageDir = Paths.get(properties.getSettings().getStorageDir());
    }

    @Override
    public Optional<String> read(String key) {
        Path file = resolve(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            log.debug("Reading settings from {}", file);
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SettingsStorageException("Failed to read settings file " + file, e);
        }
    }

    @Override
    public void write(String key, String value) {
        Path file = resolve(key);
        try {
            Files.createDirectories(storageDir);
            Files.writeString(file, value, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SettingsStorageException("Failed to write settings file " + file, e);
        }
    }

    private Path resolve(String key) {
        if (key == null || key.startsWith(".") || !KEY_PATTERN.matcher(key).matches()) {
            throw new ConfigurationException("Invalid settings key: " + key);
        }
        return storageDir.resolve(key + ".json");
    }
}
