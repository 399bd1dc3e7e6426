package org.example.annotations.service.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.example.annotations.exception.ConfigurationException;

import java.util.Optional;

public enum SortField {
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt"),
    START_OFFSET("startOffset"),
    TYPE("type");

    private final String value;

    SortField(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SortField fromValue(String value) {
        return find(value).orElseThrow(() -> new ConfigurationException("Unsupported sort field: " + value));
    }

    public static Optional<SortField> find(String value) {
        for (SortField field : values()) {
            if (field.value.equals(value)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
