package com.example.subtitlecodec.model;

/**
 * Line-break conventions. Event text always uses a bare {@code \n} internally.
 */
public final class LineBreaks {

    /** Forced line break inside SubStation text. */
    public static final String SUBSTATION_HARD_BREAK = "\\N";
    /** Soft line break inside SubStation text, only honored with wrap style 2. */
    public static final String SUBSTATION_SOFT_BREAK = "\\n";
    /** Hard space inside SubStation text. */
    public static final String SUBSTATION_HARD_SPACE = "\\h";

    private LineBreaks() {
    }

    /**
     * Converts CRLF and CR line endings to {@code \n}.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Replaces internal line breaks with a format-specific marker.
     */
    public static String render(String text, String marker) {
        return text.replace("\n", marker);
    }

    /**
     * Replaces a format-specific marker with internal line breaks.
     */
    public static String parse(String text, String marker) {
        return normalize(text).replace(marker, "\n");
    }

    /**
     * SubStation text escapes rendered for formats without them: soft breaks become
     * newlines, hard spaces become spaces.
     */
    public static String flattenSubstationEscapes(String text) {
        return text.replace(SUBSTATION_HARD_SPACE, " ")
                .replace(SUBSTATION_SOFT_BREAK, "\n")
                .replace(SUBSTATION_HARD_BREAK, "\n");
    }
}
