package com.example.subtitlecodec.service;

/**
 * Removes markup from subtitle text read from formats that commonly embed HTML.
 */
public interface HtmlStripper {

    /**
     * Returns {@code text} without markup tags, with character entities decoded.
     * Text other than tags, including SubStation override blocks, is left alone.
     */
    String strip(String text);
}
