package com.example.subtitlecodec.exception;

/**
 * A structurally invalid record in subtitle input.
 * Line numbers are 1-based.
 */
public class MalformedInputException extends SubtitleException {

    private final int lineNumber;

    public MalformedInputException(int lineNumber, String message) {
        super(String.format("Line %d: %s", lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public MalformedInputException(int lineNumber, String message, Throwable cause) {
        super(String.format("Line %d: %s", lineNumber, message), cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
