package com.example.subtitlecodec.service;

import com.example.subtitlecodec.exception.UnknownFormatException;
import com.example.subtitlecodec.format.CodecOptions;
import com.example.subtitlecodec.format.ConversionResult;
import com.example.subtitlecodec.format.SubtitleFormats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubtitleConversionServiceTest {

    private static final String SRT = "1\n00:00:01,000 --> 00:00:02,000\nHello\n\n";

    private final SubtitleConversionService service =
            new SubtitleConversionService(SubtitleFormats.createDefault(), new EncodingDetector());

    @TempDir
    Path tempDir;

    @Test
    void infersSourceFromFileName() {
        ConversionResult result = service.convert(SRT.getBytes(StandardCharsets.UTF_8), "movie.SRT", null, "mpl2",
                CodecOptions.DEFAULTS);

        assertThat(result.sourceFormat()).isEqualTo("srt");
        assertThat(result.text()).isEqualTo("[10][20]Hello\n");
    }

    @Test
    void fallsBackToContentWhenExtensionIsUnknown() {
        ConversionResult result = service.convert(SRT.getBytes(StandardCharsets.UTF_8), "upload.bin", null, "vtt",
                CodecOptions.DEFAULTS);

        assertThat(result.sourceFormat()).isEqualTo("srt");
    }

    @Test
    void decodesLegacyEncodings() {
        byte[] bytes = "1\n00:00:01,000 --> 00:00:02,000\nCafé\n".getBytes(Charset.forName("windows-1252"));

        ConversionResult result = service.convert(bytes, null, "srt", "tmp", CodecOptions.DEFAULTS);

        assertThat(result.text()).isEqualTo("00:00:01:Café\n");
    }

    @Test
    void convertsFileNextToInput() throws IOException {
        Path input = tempDir.resolve("episode.srt");
        Files.writeString(input, SRT);

        ConversionResult result = service.convertFile(input, "ass", CodecOptions.DEFAULTS);

        Path output = tempDir.resolve("episode.ass");
        assertThat(output).exists();
        assertThat(Files.readString(output)).isEqualTo(result.text()).startsWith("[Script Info]");
    }

    @Test
    void targetFormatComesFromOutputExtension() throws IOException {
        Path input = tempDir.resolve("episode.srt");
        Files.writeString(input, SRT);
        Path output = tempDir.resolve("out/episode.vtt");

        ConversionResult result = service.convertFile(input, output, null, null, CodecOptions.DEFAULTS);

        assertThat(result.targetFormat()).isEqualTo("vtt");
        assertThat(Files.readString(output)).startsWith("WEBVTT");
    }

    @Test
    void formatsWithoutExtensionUseTheirIdentifier() {
        assertThat(service.outputPathFor(Path.of("dir", "a.b.srt"), "mpl2")).isEqualTo(Path.of("dir", "a.b.mpl2"));
        assertThat(service.outputPathFor(Path.of("noext"), "srt")).isEqualTo(Path.of("noext.srt"));
    }

    @Test
    void refusesToOverwriteInput() throws IOException {
        Path input = tempDir.resolve("episode.srt");
        Files.writeString(input, SRT);

        assertThatThrownBy(() -> service.convertFile(input, "srt", CodecOptions.DEFAULTS))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("overwrite");
        assertThat(Files.readString(input)).isEqualTo(SRT);
    }

    @Test
    void rejectsMissingInputAndUnknownTargets() throws IOException {
        assertThatThrownBy(() -> service.convertFile(tempDir.resolve("missing.srt"), "ass", CodecOptions.DEFAULTS))
                .isInstanceOf(IOException.class);

        Path input = tempDir.resolve("episode.srt");
        Files.writeString(input, SRT);
        assertThatThrownBy(() -> service.convertFile(input, tempDir.resolve("episode.doc"), null, null,
                CodecOptions.DEFAULTS))
                .isInstanceOf(UnknownFormatException.class);
    }

    @Test
    void extensionHelpers() {
        assertThat(SubtitleConversionService.getExtension("Movie.Part1.SRT")).isEqualTo("srt");
        assertThat(SubtitleConversionService.getExtension(".hidden")).isEmpty();
        assertThat(SubtitleConversionService.getBaseName("Movie.Part1.srt")).isEqualTo("Movie.Part1");
    }

    @Test
    void extensionMatchingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(SubtitleConversionService.getExtension("notes.LIST")).isEqualTo("list");
            assertThat(SubtitleConversionService.getExtension("Movie.SRT")).isEqualTo("srt");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
