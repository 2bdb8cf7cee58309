package com.example.subtitlecodec.service;

/**
 * Text decoded from raw bytes and the charset it was decoded with.
 */
public record DecodedText(String charset, String text) {
}
