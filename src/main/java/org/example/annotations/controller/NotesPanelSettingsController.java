package org.example.annotations.controller;

import org.example.annotations.service.settings.NotesPanelSettings;
import org.example.annotations.service.settings.NotesPanelSettingsInput;
import org.example.annotations.service.settings.NotesPanelSettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings/notes-panel")
public class NotesPanelSettingsController {

    private final NotesPanelSettingsService settingsService;

    public NotesPanelSettingsController(NotesPanelSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public NotesPanelSettings getSettings() {
        return settingsService.load();
    }

    /**
     * Validates the partial input, persists it, and returns what was stored. A failed write still returns the
     * validated settings so the client can keep using them for the session.
     */
    @PutMapping
    public ResponseEntity<NotesPanelSettings> updateSettings(@RequestBody(required = false) NotesPanelSettingsInput input) {
        NotesPanelSettings settings = settingsService.validate(input);
        settingsService.save(settings);
        return ResponseEntity.ok(settings);
    }
}
