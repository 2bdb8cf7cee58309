package com.example.subtitlecodec.config;

import com.example.subtitlecodec.format.CodecOptions;
import com.example.subtitlecodec.model.LineBreakStyle;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Default conversion options for the HTTP surface. Initial values come from
 * {@code subtitle.conversion.*} properties and are overridden by a JSON settings file
 * that persists across restarts.
 */
@Component
public class ConversionSettings {

    private static final Logger log = LoggerFactory.getLogger(ConversionSettings.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final Path settingsFile;

    private String defaultTargetFormat;
    private Double frameRate;
    private boolean lenient;
    private boolean keepHtmlTags;
    private boolean keepUnknownHtmlTags;
    private boolean detectLanguage;
    private boolean applyStyles;
    private boolean keepSsaTags;
    private boolean writeFrameRateDeclaration;
    private LineBreakStyle lineBreakStyle;

    public ConversionSettings(
            @Value("${subtitle.settings-file:${user.home}/.subtitle-codec/settings.json}") String settingsFile,
            @Value("${subtitle.conversion.default-target-format:srt}") String defaultTargetFormat,
            @Value("${subtitle.conversion.frame-rate:#{null}}") Double frameRate,
            @Value("${subtitle.conversion.lenient:false}") boolean lenient,
            @Value("${subtitle.conversion.keep-html-tags:false}") boolean keepHtmlTags,
            @Value("${subtitle.conversion.keep-unknown-html-tags:false}") boolean keepUnknownHtmlTags,
            @Value("${subtitle.conversion.detect-language:false}") boolean detectLanguage,
            @Value("${subtitle.conversion.apply-styles:true}") boolean applyStyles,
            @Value("${subtitle.conversion.keep-ssa-tags:false}") boolean keepSsaTags,
            @Value("${subtitle.conversion.write-frame-rate-declaration:true}") boolean writeFrameRateDeclaration,
            @Value("${subtitle.conversion.line-break-style:LF}") String lineBreakStyle) {
        this.settingsFile = Path.of(settingsFile);
        this.defaultTargetFormat = defaultTargetFormat;
        this.frameRate = frameRate;
        this.lenient = lenient;
        this.keepHtmlTags = keepHtmlTags;
        this.keepUnknownHtmlTags = keepUnknownHtmlTags;
        this.detectLanguage = detectLanguage;
        this.applyStyles = applyStyles;
        this.keepSsaTags = keepSsaTags;
        this.writeFrameRateDeclaration = writeFrameRateDeclaration;
        this.lineBreakStyle = parseLineBreakStyle(lineBreakStyle);
    }

    @PostConstruct
    private void init() {
        loadSettings();
    }

    public void loadSettings() {
        if (!Files.exists(settingsFile)) {
            log.info("No settings file found at {}, using defaults", settingsFile);
            return;
        }

        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> data = mapper.readValue(settingsFile.toFile(), Map.class);
            update(data);
            log.info("Loaded conversion settings: target={}, lenient={}", defaultTargetFormat, lenient);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load settings from {}", settingsFile, e);
        }
    }

    public void saveSettings() throws IOException {
        Path parent = settingsFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile.toFile(), asMap());
        log.info("Saved settings to {}", settingsFile);
    }

    /**
     * Applies the recognized keys of {@code data}; other keys are ignored. Either every value is
     * applied or, when one is rejected, none is.
     *
     * @throws IllegalArgumentException if a value cannot be used
     */
    public void update(Map<String, Object> data) {
        String newTargetFormat = getString(data, "defaultTargetFormat", defaultTargetFormat);
        Double newFrameRate = data.containsKey("frameRate") ? getDouble(data, "frameRate") : frameRate;
        if (newFrameRate != null && !(newFrameRate > 0)) {
            throw new IllegalArgumentException("frameRate must be positive: " + newFrameRate);
        }
        boolean newLenient = getBoolean(data, "lenient", lenient);
        boolean newKeepHtmlTags = getBoolean(data, "keepHtmlTags", keepHtmlTags);
        boolean newKeepUnknownHtmlTags = getBoolean(data, "keepUnknownHtmlTags", keepUnknownHtmlTags);
        boolean newDetectLanguage = getBoolean(data, "detectLanguage", detectLanguage);
        boolean newApplyStyles = getBoolean(data, "applyStyles", applyStyles);
        boolean newKeepSsaTags = getBoolean(data, "keepSsaTags", keepSsaTags);
        boolean newWriteFrameRateDeclaration =
                getBoolean(data, "writeFrameRateDeclaration", writeFrameRateDeclaration);
        LineBreakStyle newLineBreakStyle = data.get("lineBreakStyle") != null
                ? parseLineBreakStyle(data.get("lineBreakStyle").toString())
                : lineBreakStyle;

        // the options record has the final say on what is valid
        CodecOptions.builder()
                .frameRate(newFrameRate)
                .lineBreakStyle(newLineBreakStyle)
                .build();

        defaultTargetFormat = newTargetFormat;
        frameRate = newFrameRate;
        lenient = newLenient;
        keepHtmlTags = newKeepHtmlTags;
        keepUnknownHtmlTags = newKeepUnknownHtmlTags;
        detectLanguage = newDetectLanguage;
        applyStyles = newApplyStyles;
        keepSsaTags = newKeepSsaTags;
        writeFrameRateDeclaration = newWriteFrameRateDeclaration;
        lineBreakStyle = newLineBreakStyle;
    }

    public Map<String, Object> asMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("defaultTargetFormat", defaultTargetFormat);
        data.put("frameRate", frameRate);
        data.put("lenient", lenient);
        data.put("keepHtmlTags", keepHtmlTags);
        data.put("keepUnknownHtmlTags", keepUnknownHtmlTags);
        data.put("detectLanguage", detectLanguage);
        data.put("applyStyles", applyStyles);
        data.put("keepSsaTags", keepSsaTags);
        data.put("writeFrameRateDeclaration", writeFrameRateDeclaration);
        data.put("lineBreakStyle", lineBreakStyle.name());
        return data;
    }

    /**
     * Options built from the current settings; request parameters refine them through the builder.
     */
    public CodecOptions toCodecOptions() {
        return CodecOptions.builder()
                .frameRate(frameRate)
                .lenient(lenient)
                .keepHtmlTags(keepHtmlTags)
                .keepUnknownHtmlTags(keepUnknownHtmlTags)
                .detectLanguage(detectLanguage)
                .applyStyles(applyStyles)
                .keepSsaTags(keepSsaTags)
                .writeFrameRateDeclaration(writeFrameRateDeclaration)
                .lineBreakStyle(lineBreakStyle)
                .build();
    }

    private static LineBreakStyle parseLineBreakStyle(String value) {
        return LineBreakStyle.valueOf(value.strip().toUpperCase(Locale.ROOT));
    }

    private static String getString(Map<String, Object> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private static Double getDouble(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    // Getters

    public Path getSettingsFile() {
        return settingsFile;
    }

    public String getDefaultTargetFormat() {
        return defaultTargetFormat;
    }

    public Double getFrameRate() {
        return frameRate;
    }

    public boolean isLenient() {
        return lenient;
    }

    public boolean isDetectLanguage() {
        return detectLanguage;
    }

    public LineBreakStyle getLineBreakStyle() {
        return lineBreakStyle;
    }
}
