package com.example.subtitlecodec.controller;

import com.example.subtitlecodec.config.ConversionSettings;
import com.example.subtitlecodec.exception.SubtitleException;
import com.example.subtitlecodec.exception.UnknownFormatException;
import com.example.subtitlecodec.format.CodecOptions;
import com.example.subtitlecodec.format.ConversionResult;
import com.example.subtitlecodec.format.ConversionWarning;
import com.example.subtitlecodec.format.JsonCodec;
import com.example.subtitlecodec.format.SubripCodec;
import com.example.subtitlecodec.format.SubtitleFormats;
import com.example.subtitlecodec.format.WebVttCodec;
import com.example.subtitlecodec.model.LineBreakStyle;
import com.example.subtitlecodec.service.SubtitleConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Conversion endpoint: accepts a subtitle file and returns it in another format.
 * The lossy-mapping count and warning count travel in response headers.
 */
@RestController
@RequestMapping("/api/v1")
public class ConversionController {

    private static final Logger log = LoggerFactory.getLogger(ConversionController.class);

    static final String LOSSY_MAPPINGS_HEADER = "X-Lossy-Mappings";
    static final String WARNINGS_HEADER = "X-Warnings";
    static final String SOURCE_FORMAT_HEADER = "X-Source-Format";

    private final SubtitleConversionService conversionService;
    private final SubtitleFormats formats;
    private final ConversionSettings settings;

    public ConversionController(SubtitleConversionService conversionService, SubtitleFormats formats,
                                ConversionSettings settings) {
        this.conversionService = conversionService;
        this.formats = formats;
        this.settings = settings;
    }

    /**
     * POST /api/v1/convert - Convert an uploaded subtitle file.
     */
    @PostMapping(value = "/convert", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> convertUpload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Double fps,
            @RequestParam(required = false) Boolean lenient,
            @RequestParam(required = false) Boolean detectLanguage,
            @RequestParam(required = false) Boolean keepHtmlTags,
            @RequestParam(required = false) Boolean keepUnknownHtmlTags,
            @RequestParam(required = false) Boolean applyStyles,
            @RequestParam(required = false) Boolean keepSsaTags,
            @RequestParam(required = false) String lineBreakStyle) {

        log.info("Converting uploaded file {} ({} bytes) to {}", file.getOriginalFilename(), file.getSize(), to);
        try {
            CodecOptions options = options(fps, lenient, detectLanguage, keepHtmlTags, keepUnknownHtmlTags,
                    applyStyles, keepSsaTags, lineBreakStyle);
            return convert(file.getBytes(), file.getOriginalFilename(), from, to, options);
        } catch (IOException e) {
            log.error("Upload failed for file: {}", file.getOriginalFilename(), e);
            return ResponseEntity.badRequest().body(Map.of(
                    "message", "Upload failed: " + e.getMessage(),
                    "status", 400));
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }
    }

    /**
     * POST /api/v1/convert - Convert a subtitle file sent as the raw request body.
     */
    @PostMapping(value = "/convert", consumes = {MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_OCTET_STREAM_VALUE,
            MediaType.APPLICATION_JSON_VALUE, "text/*", "application/*"})
    public ResponseEntity<?> convertBody(
            @RequestBody byte[] body,
            @RequestParam(required = false) String filename,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Double fps,
            @RequestParam(required = false) Boolean lenient,
            @RequestParam(required = false) Boolean detectLanguage,
            @RequestParam(required = false) Boolean keepHtmlTags,
            @RequestParam(required = false) Boolean keepUnknownHtmlTags,
            @RequestParam(required = false) Boolean applyStyles,
            @RequestParam(required = false) Boolean keepSsaTags,
            @RequestParam(required = false) String lineBreakStyle) {

        log.info("Converting {} byte request body to {}", body.length, to);
        try {
            CodecOptions options = options(fps, lenient, detectLanguage, keepHtmlTags, keepUnknownHtmlTags,
                    applyStyles, keepSsaTags, lineBreakStyle);
            return convert(body, filename, from, to, options);
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }
    }

    private ResponseEntity<?> convert(byte[] content, String fileName, String from, String to,
                                      CodecOptions options) {
        String target = to != null && !to.isBlank() ? to : settings.getDefaultTargetFormat();
        try {
            ConversionResult result = conversionService.convert(content, fileName,
                    from == null || from.isBlank() ? null : from, target, options);
            for (ConversionWarning warning : result.allWarnings()) {
                log.debug("Conversion warning: {}", warning);
            }
            ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                    .header("Content-Type", contentType(result.targetFormat()))
                    .header(LOSSY_MAPPINGS_HEADER, String.valueOf(result.lossyMappings()))
                    .header(WARNINGS_HEADER, String.valueOf(result.allWarnings().size()))
                    .header(SOURCE_FORMAT_HEADER, result.sourceFormat());
            if (fileName != null && !fileName.isBlank()) {
                response.header("Content-Disposition", "attachment; filename=\""
                        + outputName(fileName, result.targetFormat()) + "\"");
            }
            return response.body(result.text());
        } catch (UnknownFormatException e) {
            log.error("Conversion to {} failed: {}", target, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "message", e.getMessage(),
                    "status", 400));
        } catch (SubtitleException e) {
            log.error("Conversion to {} failed: {}", target, e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                    "message", e.getMessage(),
                    "status", 422));
        }
    }

    private CodecOptions options(Double fps, Boolean lenient, Boolean detectLanguage, Boolean keepHtmlTags,
                                 Boolean keepUnknownHtmlTags, Boolean applyStyles, Boolean keepSsaTags,
                                 String lineBreakStyle) {
        CodecOptions defaults = settings.toCodecOptions();
        CodecOptions.Builder builder = defaults.toBuilder();
        if (fps != null) {
            builder.frameRate(fps);
        }
        if (lenient != null) {
            builder.lenient(lenient);
        }
        if (detectLanguage != null) {
            builder.detectLanguage(detectLanguage);
        }
        if (keepHtmlTags != null) {
            builder.keepHtmlTags(keepHtmlTags);
        }
        if (keepUnknownHtmlTags != null) {
            builder.keepUnknownHtmlTags(keepUnknownHtmlTags);
        }
        if (applyStyles != null) {
            builder.applyStyles(applyStyles);
        }
        if (keepSsaTags != null) {
            builder.keepSsaTags(keepSsaTags);
        }
        if (lineBreakStyle != null && !lineBreakStyle.isBlank()) {
            builder.lineBreakStyle(LineBreakStyle.valueOf(lineBreakStyle.strip().toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    private String outputName(String fileName, String targetFormat) {
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = formats.extensionFor(targetFormat);
        return baseName + (extension.isEmpty() ? "." + targetFormat : extension);
    }

    private static String contentType(String format) {
        return switch (format) {
            case JsonCodec.ID -> "application/json; charset=utf-8";
            case WebVttCodec.ID -> "text/vtt; charset=utf-8";
            case SubripCodec.ID -> "application/x-subrip; charset=utf-8";
            default -> "text/plain; charset=utf-8";
        };
    }

    private static ResponseEntity<?> badRequest(IllegalArgumentException e) {
        log.error("Invalid conversion request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "message", "Invalid request: " + e.getMessage(),
                "status", 400));
    }
}
