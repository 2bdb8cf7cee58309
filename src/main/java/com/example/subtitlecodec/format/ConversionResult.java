package com.example.subtitlecodec.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of converting text from one format to another.
 */
public record ConversionResult(String sourceFormat, String targetFormat, String text, int eventCount,
                               int lossyMappings, List<ConversionWarning> readWarnings,
                               List<ConversionWarning> writeWarnings) {

    public ConversionResult {
        readWarnings = List.copyOf(readWarnings);
        writeWarnings = List.copyOf(writeWarnings);
    }

    public List<ConversionWarning> allWarnings() {
        List<ConversionWarning> all = new ArrayList<>(readWarnings);
        all.addAll(writeWarnings);
        return all;
    }
}
