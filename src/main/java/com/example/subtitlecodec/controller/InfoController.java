package com.example.subtitlecodec.controller;

import com.example.subtitlecodec.format.SubtitleCodec;
import com.example.subtitlecodec.format.SubtitleFormats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Info endpoints describing the server's capabilities.
 */
@RestController
@RequestMapping("/api/v1/infos")
public class InfoController {

    private final SubtitleFormats formats;

    public InfoController(SubtitleFormats formats) {
        this.formats = formats;
    }

    /**
     * GET /api/v1/infos/formats - Get supported subtitle formats.
     */
    @GetMapping("/formats")
    public ResponseEntity<Map<String, Object>> getFormats() {
        List<Map<String, Object>> data = new ArrayList<>();
        for (SubtitleCodec codec : formats.codecs()) {
            Map<String, Object> format = new LinkedHashMap<>();
            format.put("format_id", codec.identifier());
            format.put("format_name", codec.displayName());
            format.put("format_extension", codec.fileExtensions().isEmpty() ? ""
                    : codec.fileExtensions().get(0).substring(1));
            format.put("lossless", codec.policy().isLossless());
            data.add(format);
        }
        return ResponseEntity.ok(Map.of("data", data));
    }
}
