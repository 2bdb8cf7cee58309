package com.example.subtitlecodec.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupHtmlStripperTest {

    private final JsoupHtmlStripper stripper = new JsoupHtmlStripper();

    @Test
    void removesTagsAndKeepsText() {
        assertThat(stripper.strip("<font color=\"red\">Hi</font> <span>there</span>")).isEqualTo("Hi there");
    }

    @Test
    void keepsOverrideBlocksAndEntities() {
        assertThat(stripper.strip("{\\i1}Tom &amp; <b>Jerry</b>")).isEqualTo("{\\i1}Tom & Jerry");
    }

    @Test
    void textWithoutMarkupIsUnchanged() {
        assertThat(stripper.strip("a < b")).isEqualTo("a < b");
        assertThat(stripper.strip("plain")).isEqualTo("plain");
        assertThat(stripper.strip(null)).isNull();
    }
}
