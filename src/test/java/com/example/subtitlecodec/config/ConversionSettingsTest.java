package com.example.subtitlecodec.config;

import com.example.subtitlecodec.format.CodecOptions;
import com.example.subtitlecodec.model.LineBreakStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionSettingsTest {

    @TempDir
    Path tempDir;

    private ConversionSettings settings(Path file) {
        return new ConversionSettings(file.toString(), "srt", null, false, false, false, false, true, false, true,
                "LF");
    }

    @Test
    void savedSettingsAreLoadedBack() throws IOException {
        Path file = tempDir.resolve("nested/settings.json");
        ConversionSettings first = settings(file);
        first.update(Map.of("defaultTargetFormat", "vtt", "frameRate", 23.976, "lenient", true,
                "lineBreakStyle", "crlf"));
        first.saveSettings();

        ConversionSettings second = settings(file);
        second.loadSettings();

        assertThat(second.getDefaultTargetFormat()).isEqualTo("vtt");
        assertThat(second.getFrameRate()).isEqualTo(23.976);
        assertThat(second.isLenient()).isTrue();
        assertThat(second.getLineBreakStyle()).isEqualTo(LineBreakStyle.CRLF);
    }

    @Test
    void missingOrBrokenFileKeepsDefaults() throws IOException {
        ConversionSettings missing = settings(tempDir.resolve("absent.json"));
        missing.loadSettings();
        assertThat(missing.getDefaultTargetFormat()).isEqualTo("srt");

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        ConversionSettings fromBroken = settings(broken);
        fromBroken.loadSettings();
        assertThat(fromBroken.getDefaultTargetFormat()).isEqualTo("srt");
    }

    @Test
    void stringValuesAreAccepted() {
        ConversionSettings settings = settings(tempDir.resolve("settings.json"));

        settings.update(Map.of("detectLanguage", "true", "frameRate", "25"));

        CodecOptions options = settings.toCodecOptions();
        assertThat(options.detectLanguage()).isTrue();
        assertThat(options.frameRate()).isEqualTo(25.0);
        assertThat(options.applyStyles()).isTrue();
    }

    @Test
    void rejectsNonPositiveFrameRate() {
        ConversionSettings settings = settings(tempDir.resolve("settings.json"));

        assertThatThrownBy(() -> settings.update(Map.of("frameRate", 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectedUpdateLeavesSettingsUntouched() {
        ConversionSettings settings = settings(tempDir.resolve("settings.json"));

        assertThatThrownBy(() -> settings.update(Map.of("frameRate", -5.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(settings.getFrameRate()).isNull();
        assertThat(settings.toCodecOptions().frameRate()).isNull();

        assertThatThrownBy(() -> settings.update(Map.of("lenient", true, "lineBreakStyle", "bogus")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(settings.isLenient()).isFalse();
        assertThat(settings.getLineBreakStyle()).isEqualTo(LineBreakStyle.LF);

        assertThatThrownBy(() -> settings.update(Map.of("defaultTargetFormat", "vtt", "frameRate", "fast")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(settings.getDefaultTargetFormat()).isEqualTo("srt");
    }

    @Test
    void invalidSettingsFileIsIgnoredAsAWhole() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{\"lenient\": true, \"frameRate\": -5}");
        ConversionSettings settings = settings(file);

        settings.loadSettings();

        assertThat(settings.isLenient()).isFalse();
        assertThat(settings.getFrameRate()).isNull();
        assertThat(settings.toCodecOptions().lenient()).isFalse();
    }
}
