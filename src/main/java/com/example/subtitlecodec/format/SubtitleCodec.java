package com.example.subtitlecodec.format;

import com.example.subtitlecodec.model.SubtitleDocument;

import java.util.List;

/**
 * Reader and writer for one subtitle file format.
 * <p>
 * Implementations hold no per-call state, so one instance can serve concurrent calls
 * with different {@link CodecOptions}.
 */
public interface SubtitleCodec {

    /**
     * Short format identifier such as {@code srt} or {@code ass}.
     */
    String identifier();

    /**
     * File extensions (with the dot) that map to this format; may be empty.
     */
    List<String> fileExtensions();

    /**
     * Human-readable format name.
     */
    String displayName();

    /**
     * Whether {@code text} looks like this format. Used for autodetection.
     */
    boolean canRead(String text);

    /**
     * How this format treats features it cannot represent.
     */
    ConversionPolicy policy();

    /**
     * Parses {@code text} into a new document.
     *
     * @throws com.example.subtitlecodec.exception.MalformedInputException       on the first invalid record
     *                                                                           unless reading leniently
     * @throws com.example.subtitlecodec.exception.MissingFrameRateException     for frame-based formats without
     *                                                                           a frame rate
     */
    ReadResult read(String text, CodecOptions options);

    /**
     * Serializes {@code document}. Features the format cannot hold are mapped through
     * {@link #policy()} and counted in the result.
     */
    WriteResult write(SubtitleDocument document, CodecOptions options);
}
