package com.example.subtitlecodec.cli;

import com.example.subtitlecodec.config.ConversionSettings;
import com.example.subtitlecodec.exception.SubtitleException;
import com.example.subtitlecodec.format.CodecOptions;
import com.example.subtitlecodec.format.ConversionResult;
import com.example.subtitlecodec.format.ConversionWarning;
import com.example.subtitlecodec.model.LineBreakStyle;
import com.example.subtitlecodec.service.SubtitleConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * {@code convert <input> [-o <output>] [--from <format>] [--to <format>] [options]}
 * <p>
 * Converts one file. Warnings go to standard error and the exit code is non-zero only when
 * the input cannot be read, the formats are unknown, or the arguments are invalid.
 */
@Component
public class ConvertCommand implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    public static final String NAME = "convert";

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    static final String USAGE_TEXT = """
            Usage: convert <input> [-o <output>] [--from <format>] [--to <format>]
                           [--fps <rate>] [--lenient] [--keep-html-tags] [--keep-unknown-html-tags]
                           [--detect-language] [--no-styles] [--keep-ssa-tags] [--crlf]
            Either --to or -o is required; formats are inferred from file extensions when omitted.""";

    private final SubtitleConversionService conversionService;
    private final ConversionSettings settings;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = OK;

    @Autowired
    public ConvertCommand(SubtitleConversionService conversionService, ConversionSettings settings) {
        this(conversionService, settings, System.out, System.err);
    }

    ConvertCommand(SubtitleConversionService conversionService, ConversionSettings settings, PrintStream out,
                   PrintStream err) {
        this.conversionService = conversionService;
        this.settings = settings;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        if (args.length > 0 && NAME.equals(args[0])) {
            exitCode = execute(Arrays.copyOfRange(args, 1, args.length));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one conversion.
     *
     * @return the process exit code
     */
    public int execute(String... args) {
        Arguments arguments;
        try {
            arguments = parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE_TEXT);
            return USAGE;
        }

        try {
            Path output = arguments.output != null ? arguments.output
                    : conversionService.outputPathFor(arguments.input, arguments.to);
            ConversionResult result = conversionService.convertFile(arguments.input, output, arguments.from,
                    arguments.to, arguments.options);
            for (ConversionWarning warning : result.allWarnings()) {
                err.println("Warning: " + warning);
            }
            out.printf("Converted %d events from %s to %s (%d lossy mappings, %d warnings)%n",
                    result.eventCount(), result.sourceFormat(), result.targetFormat(), result.lossyMappings(),
                    result.allWarnings().size());
            return OK;
        } catch (SubtitleException | IOException e) {
            log.error("Conversion of {} failed: {}", arguments.input, e.getMessage());
            err.println("Error: " + e.getMessage());
            return FAILED;
        }
    }

    private Arguments parse(String... args) {
        Arguments arguments = new Arguments();
        CodecOptions.Builder options = settings.toCodecOptions().toBuilder();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            int equals = arg.indexOf('=');
            if (arg.startsWith("--") && equals > 0) {
                inlineValue = arg.substring(equals + 1);
                arg = arg.substring(0, equals);
            }
            switch (arg) {
                case "-o", "--output" ->
                        arguments.output = Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg));
                case "--from" -> arguments.from = inlineValue != null ? inlineValue : value(args, ++i, arg);
                case "--to" -> arguments.to = inlineValue != null ? inlineValue : value(args, ++i, arg);
                case "--fps" -> {
                    String fps = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    try {
                        options.frameRate(Double.parseDouble(fps));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid frame rate: " + fps, e);
                    }
                }
                case "--lenient" -> options.lenient(true);
                case "--keep-html-tags" -> options.keepHtmlTags(true);
                case "--keep-unknown-html-tags" -> options.keepUnknownHtmlTags(true);
                case "--detect-language" -> options.detectLanguage(true);
                case "--no-styles" -> options.applyStyles(false);
                case "--keep-ssa-tags" -> options.keepSsaTags(true);
                case "--crlf" -> options.lineBreakStyle(LineBreakStyle.CRLF);
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (arguments.input != null) {
                        throw new IllegalArgumentException("More than one input file: " + arg);
                    }
                    arguments.input = Path.of(arg);
                }
            }
        }
        if (arguments.input == null) {
            throw new IllegalArgumentException("No input file");
        }
        if (arguments.to == null && arguments.output == null) {
            throw new IllegalArgumentException("Either --to or -o is required");
        }
        arguments.options = options.build();
        return arguments;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static final class Arguments {
        private Path input;
        private Path output;
        private String from;
        private String to;
        private CodecOptions options;
    }
}
