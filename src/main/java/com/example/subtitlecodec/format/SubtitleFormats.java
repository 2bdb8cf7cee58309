package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.UnknownFormatException;
import com.example.subtitlecodec.model.LineBreaks;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.service.JsoupHtmlStripper;
import com.example.subtitlecodec.service.LanguageDetector;
import com.example.subtitlecodec.service.LinguaLanguageDetector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the available codecs, keyed by identifier and file extension, with
 * content autodetection and one-call conversion between formats.
 */
@Service
public class SubtitleFormats {

    private static final Logger log = LoggerFactory.getLogger(SubtitleFormats.class);

    private final Map<String, SubtitleCodec> codecs = new LinkedHashMap<>();
    private final Map<String, String> extensions = new LinkedHashMap<>();
    private final LanguageDetector languageDetector;

    public SubtitleFormats(List<SubtitleCodec> codecs, LanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
        for (SubtitleCodec codec : codecs) {
            String id = codec.identifier().toLowerCase(Locale.ROOT);
            if (this.codecs.putIfAbsent(id, codec) != null) {
                throw new IllegalStateException("Duplicate subtitle format identifier: " + id);
            }
            for (String extension : codec.fileExtensions()) {
                this.extensions.putIfAbsent(extension.toLowerCase(Locale.ROOT), id);
            }
        }
        log.debug("Registered subtitle formats {}", this.codecs.keySet());
    }

    /**
     * All built-in formats, for use without a Spring context.
     */
    public static SubtitleFormats createDefault() {
        JsoupHtmlStripper htmlStripper = new JsoupHtmlStripper();
        List<SubtitleCodec> codecs = List.of(
                new AssCodec(),
                new SsaCodec(),
                new SubripCodec(htmlStripper),
                new WebVttCodec(htmlStripper),
                new MicroDvdCodec(),
                new Mpl2Codec(),
                new TmpCodec(),
                new JsonCodec(new ObjectMapper()));
        return new SubtitleFormats(codecs, new LinguaLanguageDetector());
    }

    // ==================== LOOKUP ====================

    public Set<String> identifiers() {
        return Collections.unmodifiableSet(codecs.keySet());
    }

    public List<SubtitleCodec> codecs() {
        return List.copyOf(codecs.values());
    }

    public SubtitleCodec codec(String identifier) {
        SubtitleCodec codec = identifier == null ? null : codecs.get(identifier.toLowerCase(Locale.ROOT));
        if (codec == null) {
            throw new UnknownFormatException("Unknown subtitle format: " + identifier
                    + " (known formats: " + String.join(", ", codecs.keySet()) + ")");
        }
        return codec;
    }

    /**
     * Format identifier for a file extension, with or without the leading dot.
     */
    public String identifierForExtension(String extension) {
        return findIdentifierForExtension(extension)
                .orElseThrow(() -> new UnknownFormatException("No subtitle format for extension: " + extension));
    }

    public Optional<String> findIdentifierForExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        String key = extension.toLowerCase(Locale.ROOT).strip();
        if (!key.startsWith(".")) {
            key = "." + key;
        }
        return Optional.ofNullable(extensions.get(key));
    }

    /**
     * Preferred file extension of a format, or an empty string if it has none.
     */
    public String extensionFor(String identifier) {
        List<String> known = codec(identifier).fileExtensions();
        return known.isEmpty() ? "" : known.get(0);
    }

    /**
     * Identifier of the only format that claims {@code content}.
     *
     * @throws UnknownFormatException if no format or more than one format claims it
     */
    public String autodetect(String content) {
        String text = LineBreaks.normalize(content);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        List<String> matches = new ArrayList<>();
        for (SubtitleCodec codec : codecs.values()) {
            if (codec.canRead(text)) {
                matches.add(codec.identifier());
            }
        }
        if (matches.isEmpty()) {
            throw new UnknownFormatException("Content does not match any known subtitle format");
        }
        if (matches.size() > 1) {
            throw new UnknownFormatException("Content matches several subtitle formats: " + matches);
        }
        log.debug("Detected subtitle format {}", matches.get(0));
        return matches.get(0);
    }

    // ==================== READ / WRITE ====================

    public ReadResult read(String text, String format, CodecOptions options) {
        ReadResult result = codec(format).read(text, options);
        if (options.detectLanguage()) {
            detectLanguages(result.document());
        }
        return result;
    }

    /**
     * Reads {@code text} in whatever format it is detected as.
     */
    public ReadResult read(String text, CodecOptions options) {
        return read(text, autodetect(text), options);
    }

    public WriteResult write(SubtitleDocument document, String format, CodecOptions options) {
        return codec(format).write(document, options);
    }

    /**
     * Reads {@code text} as {@code sourceFormat}, or as the detected format when that is
     * {@code null}, and writes it as {@code targetFormat}.
     */
    public ConversionResult convert(String text, String sourceFormat, String targetFormat, CodecOptions options) {
        String source = sourceFormat != null ? sourceFormat.toLowerCase(Locale.ROOT) : autodetect(text);
        SubtitleCodec target = codec(targetFormat);
        ReadResult read = read(text, source, options);
        WriteResult written = target.write(read.document(), options);
        log.info("Converted {} events from {} to {} ({} lossy mappings, {} warnings)",
                read.document().size(), source, target.identifier(), written.lossyMappings(),
                read.warnings().size() + written.warnings().size());
        return new ConversionResult(source, target.identifier(), written.text(), read.document().size(),
                written.lossyMappings(), read.warnings(), written.warnings());
    }

    private void detectLanguages(SubtitleDocument document) {
        for (int i = 0; i < document.size(); i++) {
            SubtitleEvent event = document.getEvent(i);
            if (event.getLanguage() != null) {
                continue;
            }
            String language = languageDetector.detect(event.plainText());
            if (language != null) {
                document.setEvent(i, event.withLanguage(language));
            }
        }
    }
}
