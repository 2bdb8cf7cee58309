package com.example.subtitlecodec.format;

import com.example.subtitlecodec.model.SubtitleDocument;

import java.util.List;
import java.util.Objects;

/**
 * A parsed document and the problems skipped over while reading it.
 */
public record ReadResult(SubtitleDocument document, List<ConversionWarning> warnings) {

    public ReadResult {
        Objects.requireNonNull(document, "document");
        warnings = List.copyOf(warnings);
    }
}
