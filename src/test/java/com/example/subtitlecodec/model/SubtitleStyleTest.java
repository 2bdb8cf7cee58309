package com.example.subtitlecodec.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubtitleStyleTest {

    @Test
    void defaultsFollowSubStation() {
        SubtitleStyle style = new SubtitleStyle();
        assertThat(style.getFontName()).isEqualTo("Arial");
        assertThat(style.getFontSize()).isEqualTo(20.0);
        assertThat(style.getPrimaryColor()).isEqualTo(Color.WHITE);
        assertThat(style.getSecondaryColor()).isEqualTo(Color.RED);
        assertThat(style.getAlignment()).isEqualTo(Alignment.BOTTOM_CENTER);
        assertThat(style.getMarginV()).isEqualTo(10);
    }

    @Test
    void resolveEffectiveLeavesBaseUntouched() {
        SubtitleStyle base = new SubtitleStyle();
        StyleOverride override = StyleOverride.of(StyleAttribute.BOLD, true)
                .with(StyleAttribute.PRIMARY_COLOR, Color.RED)
                .with(StyleAttribute.ITALIC, null);

        SubtitleStyle effective = base.resolveEffective(override);

        assertThat(effective.isBold()).isTrue();
        assertThat(effective.getPrimaryColor()).isEqualTo(Color.RED);
        assertThat(effective.isItalic()).isFalse();
        assertThat(base.isBold()).isFalse();
        assertThat(base.getPrimaryColor()).isEqualTo(Color.WHITE);
    }

    @Test
    void copyIsEqualButIndependent() {
        SubtitleStyle style = new SubtitleStyle();
        style.setFontName("Verdana");
        SubtitleStyle copy = style.copy();
        assertThat(copy).isEqualTo(style);
        copy.setUnderline(true);
        assertThat(style.isUnderline()).isFalse();
        assertThat(copy).isNotEqualTo(style);
    }

    @Test
    void alignmentNumberings() {
        assertThat(Alignment.fromSsa(6)).isEqualTo(Alignment.TOP_CENTER);
        assertThat(Alignment.TOP_CENTER.numpad()).isEqualTo(8);
        assertThat(Alignment.fromNumpad(5).ssa()).isEqualTo(10);
    }
}
