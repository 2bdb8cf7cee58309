package com.example.subtitlecodec.exception;

/**
 * Thrown by frame-based formats when no frame rate was supplied or declared.
 */
public class MissingFrameRateException extends SubtitleException {

    public MissingFrameRateException(String context) {
        super("Frame rate is required for " + context);
    }
}
