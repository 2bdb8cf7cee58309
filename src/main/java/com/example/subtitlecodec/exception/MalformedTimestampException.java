package com.example.subtitlecodec.exception;

/**
 * Thrown when a timestamp does not match the grammar of its format.
 */
public class MalformedTimestampException extends SubtitleException {

    private final String timestamp;

    public MalformedTimestampException(String timestamp, String reason) {
        super(String.format("Malformed timestamp '%s': %s", timestamp, reason));
        this.timestamp = timestamp;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
