package org.example.annotations.service.query;

import org.example.annotations.exception.ConfigurationException;

public record SortSpec(SortField field, SortDirection direction) {

    public SortSpec {
        if (field == null) {
            throw new ConfigurationException("Sort field is required");
        }
        if (direction == null) {
            throw new ConfigurationException("Sort direction is required");
        }
    }

    public static SortSpec of(String field, String direction) {
        return new SortSpec(SortField.fromValue(field), SortDirection.fromValue(direction));
    }

    public static SortSpec byPosition() {
        return new SortSpec(SortField.START_OFFSET, SortDirection.ASC);
    }
}
