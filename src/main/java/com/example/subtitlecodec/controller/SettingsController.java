package com.example.subtitlecodec.controller;

import com.example.subtitlecodec.config.ConversionSettings;
import com.example.subtitlecodec.exception.UnknownFormatException;
import com.example.subtitlecodec.format.SubtitleFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

import java.io.IOException;
import java.util.Map;

/**
 * Controller for the default conversion options.
 */
@Controller
public class SettingsController {

    private static final Logger log = LoggerFactory.getLogger(SettingsController.class);

    private final ConversionSettings settings;
    private final SubtitleFormats formats;

    public SettingsController(ConversionSettings settings, SubtitleFormats formats) {
        this.settings = settings;
        this.formats = formats;
    }

    // ==================== REST API ====================

    @GetMapping("/api/settings")
    @ResponseBody
    public ResponseEntity<?> getSettings() {
        return ResponseEntity.ok(settings.asMap());
    }

    @PostMapping("/api/settings")
    @ResponseBody
    public ResponseEntity<?> updateSettings(@RequestBody Map<String, Object> updates) {
        try {
            if (updates.get("defaultTargetFormat") != null) {
                // rejects unknown identifiers before anything is changed
                formats.codec(updates.get("defaultTargetFormat").toString());
            }
            settings.update(updates);
            settings.saveSettings();
            return ResponseEntity.ok(Map.of("success", true, "message", "Settings saved"));
        } catch (IOException | IllegalArgumentException | UnknownFormatException e) {
            log.error("Failed to update settings", e);
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
