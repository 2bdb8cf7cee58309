package com.example.subtitlecodec.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Best-guess decoding of subtitle files: byte order mark first, then strict UTF-8,
 * then windows-1252, which accepts any byte sequence.
 */
@Component
public class EncodingDetector {

    private static final Logger log = LoggerFactory.getLogger(EncodingDetector.class);

    static final Charset FALLBACK = Charset.forName("windows-1252");

    public DecodedText decode(byte[] bytes) {
        if (startsWith(bytes, 0xEF, 0xBB, 0xBF)) {
            return new DecodedText(StandardCharsets.UTF_8.name(), decode(bytes, 3, StandardCharsets.UTF_8));
        }
        if (startsWith(bytes, 0xFF, 0xFE)) {
            return new DecodedText(StandardCharsets.UTF_16LE.name(), decode(bytes, 2, StandardCharsets.UTF_16LE));
        }
        if (startsWith(bytes, 0xFE, 0xFF)) {
            return new DecodedText(StandardCharsets.UTF_16BE.name(), decode(bytes, 2, StandardCharsets.UTF_16BE));
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return new DecodedText(StandardCharsets.UTF_8.name(), text);
        } catch (CharacterCodingException e) {
            log.debug("Input is not valid UTF-8, decoding as {}", FALLBACK.name());
            return new DecodedText(FALLBACK.name(), new String(bytes, FALLBACK));
        }
    }

    private static String decode(byte[] bytes, int offset, Charset charset) {
        return new String(bytes, offset, bytes.length - offset, charset);
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
