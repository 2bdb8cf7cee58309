package com.example.subtitlecodec.tags;

import com.example.subtitlecodec.model.StyleOverride;

import java.util.Objects;

/**
 * One element of a parsed event text.
 * <p>
 * A {@link Kind#TEXT} run carries the attribute changes that take effect just before its
 * (possibly empty) text. A {@link Kind#PASSTHROUGH} run carries an unrecognized directive
 * (with its backslash) or a brace comment verbatim, so it can be written back unchanged.
 */
public record OverrideRun(Kind kind, StyleOverride delta, String text) {

    public enum Kind {
        TEXT,
        PASSTHROUGH
    }

    public OverrideRun {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(delta, "delta");
        Objects.requireNonNull(text, "text");
    }

    public static OverrideRun text(StyleOverride delta, String text) {
        return new OverrideRun(Kind.TEXT, delta, text);
    }

    public static OverrideRun text(String text) {
        return new OverrideRun(Kind.TEXT, StyleOverride.empty(), text);
    }

    public static OverrideRun passthrough(String raw) {
        return new OverrideRun(Kind.PASSTHROUGH, StyleOverride.empty(), raw);
    }

    public boolean isPassthrough() {
        return kind == Kind.PASSTHROUGH;
    }

    /**
     * Brace comments are passthrough content not starting with a backslash.
     */
    public boolean isComment() {
        return kind == Kind.PASSTHROUGH && !text.startsWith("\\");
    }
}
