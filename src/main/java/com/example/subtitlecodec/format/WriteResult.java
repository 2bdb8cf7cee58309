package com.example.subtitlecodec.format;

import java.util.List;
import java.util.Objects;

/**
 * Written text plus the number of lossy mappings applied to produce it.
 */
public record WriteResult(String text, int lossyMappings, List<ConversionWarning> warnings) {

    public WriteResult {
        Objects.requireNonNull(text, "text");
        warnings = List.copyOf(warnings);
    }

    public boolean isLossless() {
        return lossyMappings == 0;
    }
}
