package org.example.annotations.service.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.example.annotations.exception.ConfigurationException;

import java.util.Optional;

public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String value;

    SortDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SortDirection fromValue(String value) {
        return find(value).orElseThrow(() -> new ConfigurationException("Unsupported sort direction: " + value));
    }

    public static Optional<SortDirection> find(String value) {
        for (SortDirection direction : values()) {
            if (direction.value.equals(value)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
