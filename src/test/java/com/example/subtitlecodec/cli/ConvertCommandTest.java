package com.example.subtitlecodec.cli;

import com.example.subtitlecodec.config.ConversionSettings;
import com.example.subtitlecodec.format.SubtitleFormats;
import com.example.subtitlecodec.service.EncodingDetector;
import com.example.subtitlecodec.service.SubtitleConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConvertCommandTest {

    private static final String SRT = "1\n00:00:01,000 --> 00:00:02,000\nHello\n\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private ConvertCommand command;

    @BeforeEach
    void setUp() {
        SubtitleConversionService service =
                new SubtitleConversionService(SubtitleFormats.createDefault(), new EncodingDetector());
        ConversionSettings settings = new ConversionSettings(tempDir.resolve("settings.json").toString(), "srt",
                null, false, false, false, false, true, false, true, "LF");
        command = new ConvertCommand(service, settings, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void convertsNextToInput() throws IOException {
        Path input = tempDir.resolve("show.srt");
        Files.writeString(input, SRT);

        int code = command.execute(input.toString(), "--to", "vtt");

        assertThat(code).isEqualTo(ConvertCommand.OK);
        assertThat(Files.readString(tempDir.resolve("show.vtt"))).startsWith("WEBVTT");
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("from srt to vtt", "0 lossy mappings");
    }

    @Test
    void explicitOutputAndFrameRate() throws IOException {
        Path input = tempDir.resolve("show.srt");
        Files.writeString(input, SRT);
        Path output = tempDir.resolve("show.sub");

        int code = command.execute(input.toString(), "-o", output.toString(), "--fps=25");

        assertThat(code).isEqualTo(ConvertCommand.OK);
        assertThat(Files.readString(output)).isEqualTo("{1}{1}25\n{25}{50}Hello\n");
    }

    @Test
    void fatalParseErrorGivesNonZeroExit() throws IOException {
        Path input = tempDir.resolve("broken.srt");
        Files.writeString(input, "1\n00:00:02,000 --> 00:00:01,000\nBackwards\n");

        int code = command.execute(input.toString(), "--to", "ass");

        assertThat(code).isEqualTo(ConvertCommand.FAILED);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Error:", "Line 2");
        assertThat(tempDir.resolve("broken.ass")).doesNotExist();
    }

    @Test
    void lenientModeReportsWarningsAndSucceeds() throws IOException {
        Path input = tempDir.resolve("broken.srt");
        Files.writeString(input, "1\n00:00:02,000 --> 00:00:01,000\nBackwards\n\n2\n00:00:03,000 --> 00:00:04,000\nOk\n");

        int code = command.execute(input.toString(), "--to", "ass", "--lenient");

        assertThat(code).isEqualTo(ConvertCommand.OK);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Warning: MALFORMED_INPUT at 2");
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Converted 1 events");
    }

    @Test
    void invalidArgumentsPrintUsage() {
        assertThat(command.execute()).isEqualTo(ConvertCommand.USAGE);
        assertThat(command.execute("in.srt")).isEqualTo(ConvertCommand.USAGE);
        assertThat(command.execute("in.srt", "--to", "vtt", "--bogus")).isEqualTo(ConvertCommand.USAGE);
        assertThat(command.execute("in.srt", "--to", "vtt", "--fps", "fast")).isEqualTo(ConvertCommand.USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage: convert");
    }

    @Test
    void unknownTargetFails() throws IOException {
        Path input = tempDir.resolve("show.srt");
        Files.writeString(input, SRT);

        assertThat(command.execute(input.toString(), "--to", "stl")).isEqualTo(ConvertCommand.FAILED);
    }

    @Test
    void runIgnoresOtherCommands() {
        command.run("serve");

        assertThat(command.getExitCode()).isEqualTo(ConvertCommand.OK);
        assertThat(out.size()).isZero();
    }
}
