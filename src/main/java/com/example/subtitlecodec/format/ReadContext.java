package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-read state shared by codec helpers: the options and the warnings collected so far.
 */
final class ReadContext {

    private static final Logger log = LoggerFactory.getLogger(ReadContext.class);

    private final String format;
    private final CodecOptions options;
    private final List<ConversionWarning> warnings = new ArrayList<>();

    ReadContext(String format, CodecOptions options) {
        this.format = format;
        this.options = options;
    }

    CodecOptions options() {
        return options;
    }

    /**
     * Reports a structurally invalid record. In strict mode this throws; in lenient mode the
     * caller skips the record and carries on.
     *
     * @throws MalformedInputException unless reading leniently
     */
    void malformed(int lineNumber, String message, Throwable cause) {
        if (!options.lenient()) {
            throw cause == null
                    ? new MalformedInputException(lineNumber, message)
                    : new MalformedInputException(lineNumber, message, cause);
        }
        log.warn("{} line {}: skipping malformed record: {}", format, lineNumber, message);
        warnings.add(new ConversionWarning(ConversionWarning.Kind.MALFORMED_INPUT, lineNumber, message));
    }

    void malformed(int lineNumber, String message) {
        malformed(lineNumber, message, null);
    }

    void warn(ConversionWarning.Kind kind, int lineNumber, String message) {
        log.warn("{} line {}: {}", format, lineNumber, message);
        warnings.add(new ConversionWarning(kind, lineNumber, message));
    }

    List<ConversionWarning> warnings() {
        return warnings;
    }
}
