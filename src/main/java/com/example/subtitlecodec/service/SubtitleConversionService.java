package com.example.subtitlecodec.service;

import com.example.subtitlecodec.format.CodecOptions;
import com.example.subtitlecodec.format.ConversionResult;
import com.example.subtitlecodec.format.SubtitleFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Converts subtitle files and uploaded bytes between formats. Input encoding is
 * detected; output is always UTF-8.
 */
@Service
public class SubtitleConversionService {

    private static final Logger log = LoggerFactory.getLogger(SubtitleConversionService.class);

    private final SubtitleFormats formats;
    private final EncodingDetector encodingDetector;

    public SubtitleConversionService(SubtitleFormats formats, EncodingDetector encodingDetector) {
        this.formats = formats;
        this.encodingDetector = encodingDetector;
    }

    /**
     * Converts raw subtitle bytes.
     *
     * @param fileName     original file name, used to infer the source format when {@code sourceFormat}
     *                     is null; may be null
     * @param sourceFormat source format identifier, or null to infer it from the file name or content
     * @param targetFormat target format identifier
     */
    public ConversionResult convert(byte[] content, String fileName, String sourceFormat, String targetFormat,
                                    CodecOptions options) {
        DecodedText decoded = encodingDetector.decode(content);
        log.debug("Decoded {} bytes as {}", content.length, decoded.charset());
        String source = sourceFormat;
        if (source == null && fileName != null) {
            source = formats.findIdentifierForExtension(getExtension(fileName)).orElse(null);
        }
        return formats.convert(decoded.text(), source, targetFormat, options);
    }

    /**
     * Converts {@code input} into {@code output}. Null formats are inferred from the file extensions,
     * falling back to content detection for the source.
     */
    public ConversionResult convertFile(Path input, Path output, String sourceFormat, String targetFormat,
                                        CodecOptions options) throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new IOException("Not a file: " + input);
        }
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new IOException("Output would overwrite input: " + input);
        }
        String target = targetFormat != null ? targetFormat
                : formats.identifierForExtension(getExtension(output.getFileName().toString()));
        ConversionResult result = convert(Files.readAllBytes(input), input.getFileName().toString(),
                sourceFormat, target, options);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, result.text(), StandardCharsets.UTF_8);
        log.info("Saved {} subtitle to: {}", result.targetFormat(), output);
        return result;
    }

    /**
     * Converts {@code input} into a file next to it, named after the input with the target
     * format's extension.
     */
    public ConversionResult convertFile(Path input, String targetFormat, CodecOptions options) throws IOException {
        return convertFile(input, outputPathFor(input, targetFormat), null, targetFormat, options);
    }

    public Path outputPathFor(Path input, String targetFormat) {
        String extension = formats.extensionFor(targetFormat);
        if (extension.isEmpty()) {
            extension = "." + formats.codec(targetFormat).identifier();
        }
        String baseName = getBaseName(input.getFileName().toString());
        return input.resolveSibling(baseName + extension);
    }

    static String getExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    static String getBaseName(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
