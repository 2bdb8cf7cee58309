package com.example.subtitlecodec.exception;

/**
 * Unknown format identifier, unknown file extension, or content no codec recognizes.
 */
public class UnknownFormatException extends SubtitleException {

    public UnknownFormatException(String message) {
        super(message);
    }
}
