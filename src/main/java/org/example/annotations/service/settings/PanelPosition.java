package org.example.annotations.service.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.example.annotations.exception.ConfigurationException;

import java.util.Optional;

public enum PanelPosition {
    RIGHT("right"),
    BOTTOM("bottom");

    private final String value;

    PanelPosition(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PanelPosition fromValue(String value) {
        return find(value).orElseThrow(() -> new ConfigurationException("Unsupported panel position: " + value));
    }

    public static Optional<PanelPosition> find(String value) {
        for (PanelPosition position : values()) {
            if (position.value.equals(value)) {
                return Optional.of(position);
            }
        }
        return Optional.empty();
    }
}
