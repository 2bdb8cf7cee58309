package com.example.subtitlecodec.model;

/**
 * Line terminator used for written output.
 */
public enum LineBreakStyle {
    LF("\n"),
    CRLF("\r\n");

    private final String separator;

    LineBreakStyle(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    /**
     * Converts text written with {@code \n} terminators to this style.
     */
    public String apply(String text) {
        return this == LF ? text : text.replace("\n", separator);
    }
}
