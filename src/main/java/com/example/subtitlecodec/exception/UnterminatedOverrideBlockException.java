package com.example.subtitlecodec.exception;

/**
 * An override block opened with '{' that is never closed.
 */
public class UnterminatedOverrideBlockException extends SubtitleException {

    private final int offset;

    public UnterminatedOverrideBlockException(int offset) {
        super("Unterminated override block starting at offset " + offset);
        this.offset = offset;
    }

    /**
     * Character offset of the orphan '{' in the event text.
     */
    public int getOffset() {
        return offset;
    }
}
