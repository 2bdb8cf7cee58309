package com.example.subtitlecodec.exception;

/**
 * Base class for all subtitle reading, writing and timing failures.
 */
public class SubtitleException extends RuntimeException {

    public SubtitleException(String message) {
        super(message);
    }

    public SubtitleException(String message, Throwable cause) {
        super(message, cause);
    }
}
