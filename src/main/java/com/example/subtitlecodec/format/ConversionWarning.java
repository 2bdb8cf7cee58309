package com.example.subtitlecodec.format;

/**
 * A recovered problem reported alongside a read or write result.
 *
 * @param location 1-based line number for read warnings, 0-based event index for write warnings,
 *                 or -1 when the warning concerns a style
 */
public record ConversionWarning(Kind kind, int location, String message) {

    public enum Kind {
        MALFORMED_INPUT,
        UNTERMINATED_OVERRIDE_BLOCK,
        UNRESOLVED_STYLE_REFERENCE,
        UNSUPPORTED_FEATURE_DROPPED,
        UNSUPPORTED_FEATURE_APPROXIMATED
    }

    @Override
    public String toString() {
        return location < 0 ? kind + ": " + message : kind + " at " + location + ": " + message;
    }
}
