package org.example.annotations.service.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExportDateStyle {
    SHORT("short"),
    LONG("long"),
    ISO("iso");

    private final String value;

    ExportDateStyle(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ExportDateStyle fromValue(String value) {
        for (ExportDateStyle style : values()) {
            if (style.value.equals(value)) {
                return style;
            }
        }
        return LONG;
    }
}
