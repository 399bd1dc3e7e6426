package org.example.annotations.service.settings;

/**
 * Partial, unvalidated settings as they arrive from a request body or the settings store. Every field may be
 * missing; enum fields are kept as raw tokens so an unknown value falls back instead of failing the whole read.
 */
public record NotesPanelSettingsInput(
        String position,
        Integer width,
        Integer height,
        String filterPreset,
        String sortField,
        String sortDirection
) {

    public static NotesPanelSettingsInput empty() {
        return new NotesPanelSettingsInput(null, null, null, null, null, null);
    }

    public static NotesPanelSettingsInput of(NotesPanelSettings settings) {
        return new NotesPanelSettingsInput(
                settings.position().value(),
                settings.width(),
                settings.height(),
                settings.filterPreset().value(),
                settings.sortField().value(),
                settings.sortDirection().value());
    }
}
