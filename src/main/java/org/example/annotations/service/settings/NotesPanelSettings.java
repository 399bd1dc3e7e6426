package org.example.annotations.service.settings;

import org.example.annotations.service.query.SortDirection;
import org.example.annotations.service.query.SortField;
import org.example.annotations.service.query.SortSpec;

/**
 * Validated notes panel view state. Only {@link NotesPanelSettingsService#validate} should build one from outside
 * input.
 */
public record NotesPanelSettings(
        PanelPosition position,
        int width,
        int height,
        FilterPreset filterPreset,
        SortField sortField,
        SortDirection sortDirection
) {

    public static NotesPanelSettings defaults() {
        return new NotesPanelSettings(
                PanelPosition.RIGHT,
                PanelConstraints.DEFAULT.defaultWidth(),
                PanelConstraints.DEFAULT.defaultHeight(),
                FilterPreset.ALL,
                SortField.CREATED_AT,
                SortDirection.DESC);
    }

    public SortSpec sortSpec() {
        return new SortSpec(sortField, sortDirection);
    }
}
