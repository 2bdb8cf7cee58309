package com.example.subtitlecodec.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubtitleDocumentTest {

    @Test
    void alwaysHasDefaultStyle() {
        SubtitleDocument document = new SubtitleDocument();
        assertThat(document.getStyles()).containsOnlyKeys(SubtitleStyle.DEFAULT_NAME);
        assertThatThrownBy(() -> document.removeStyle(SubtitleStyle.DEFAULT_NAME))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateStyleNamesFailFast() {
        SubtitleDocument document = new SubtitleDocument();
        document.addStyle("Sign", new SubtitleStyle());
        assertThatThrownBy(() -> document.addStyle("Sign", new SubtitleStyle()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> document.addStyle("a,b", new SubtitleStyle()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unresolvedStyleFallsBackToDefault() {
        SubtitleDocument document = new SubtitleDocument();
        SubtitleEvent event = SubtitleEvent.builder().start(0).end(1000).text("x").style("Missing").build();
        document.addEvent(event);
        assertThat(document.resolveStyleName(event)).isEqualTo(SubtitleStyle.DEFAULT_NAME);
        assertThat(document.unresolvedStyleReferences()).containsExactly("Missing");
    }

    @Test
    void renameStyleUpdatesEvents() {
        SubtitleDocument document = new SubtitleDocument();
        document.addStyle("Old", new SubtitleStyle());
        document.addEvent(SubtitleEvent.builder().start(0).end(1000).text("x").style("Old").build());
        document.renameStyle("Old", "New");
        assertThat(document.hasStyle("Old")).isFalse();
        assertThat(document.getEvent(0).getStyle()).isEqualTo("New");
    }

    @Test
    void sortOrdersByStartThenEnd() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(2000, 3000, "c"));
        document.addEvent(SubtitleEvent.of(1000, 2500, "b"));
        document.addEvent(SubtitleEvent.of(1000, 2000, "a"));
        document.sort();
        assertThat(document.getEvents()).extracting(SubtitleEvent::getText).containsExactly("a", "b", "c");
    }

    @Test
    void shiftAndFrameRateTransform() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(1000, 2000, "x"));
        document.shift(500);
        assertThat(document.getEvent(0).getStart().millis()).isEqualTo(1500);
        document.shiftFrames(-25, 25.0);
        assertThat(document.getEvent(0).getStart().millis()).isEqualTo(500);
        document.transformFrameRate(25.0, 50.0);
        assertThat(document.getEvent(0).getStart().millis()).isEqualTo(250);
        assertThat(document.getEvent(0).getEnd().millis()).isEqualTo(750);
    }

    @Test
    void removesMiscellaneousEvents() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "keep"));
        document.addEvent(SubtitleEvent.of(0, 1000, ""));
        document.addEvent(SubtitleEvent.builder().start(0).end(1000).text("note").comment(true).build());
        document.addEvent(SubtitleEvent.of(0, 1000, "{\\p1}m 0 0 l 1 1"));
        assertThat(document.removeMiscellaneousEvents()).isEqualTo(3);
        assertThat(document.size()).isEqualTo(1);
    }

    @Test
    void copyDoesNotShareStyles() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "x"));
        SubtitleDocument copy = document.copy();
        assertThat(copy.equalsStructurally(document)).isTrue();

        copy.getDefaultStyle().setBold(true);
        assertThat(document.getDefaultStyle().isBold()).isFalse();
        assertThat(copy.equalsStructurally(document)).isFalse();
    }

    @Test
    void explicitDefaultStyleTakesItsRegistrationPosition() {
        SubtitleDocument document = new SubtitleDocument();
        document.putStyle("Top", new SubtitleStyle());
        document.putStyle(SubtitleStyle.DEFAULT_NAME, new SubtitleStyle());
        document.putStyle("Bottom", new SubtitleStyle());

        assertThat(document.getStyles().keySet()).containsExactly("Top", "Default", "Bottom");

        document.putStyle(SubtitleStyle.DEFAULT_NAME, new SubtitleStyle());
        assertThat(document.getStyles().keySet()).containsExactly("Top", "Default", "Bottom");
        assertThat(document.copy().getStyles().keySet()).containsExactly("Top", "Default", "Bottom");
    }

    @Test
    void placeholderDefaultStyleStaysFirst() {
        SubtitleDocument document = new SubtitleDocument();
        document.putStyle("Top", new SubtitleStyle());

        assertThat(document.getStyles().keySet()).containsExactly("Default", "Top");
    }

    @Test
    void structuralEqualityCoversExtraSectionsAndFrameRate() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "x"));
        document.getExtraSections().put("[Fonts]", List.of("fontname: a.ttf"));

        SubtitleDocument copy = document.copy();
        assertThat(copy.equalsStructurally(document)).isTrue();

        copy.getExtraSections().put("[Fonts]", List.of("fontname: b.ttf"));
        assertThat(copy.equalsStructurally(document)).isFalse();

        SubtitleDocument retimed = document.copy();
        retimed.setFrameRate(25.0);
        assertThat(retimed.equalsStructurally(document)).isFalse();
    }

    @Test
    void mergeKeepsStyleOrderOfFirstDocument() {
        SubtitleDocument first = new SubtitleDocument();
        first.putStyle("Top", new SubtitleStyle());
        first.putStyle(SubtitleStyle.DEFAULT_NAME, new SubtitleStyle());

        SubtitleDocument merged = SubtitleDocument.merge(first, new SubtitleDocument());

        assertThat(merged.getStyles().keySet()).containsExactly("Top", "Default");
    }

    @Test
    void mergeRekeysConflictingStyles() {
        SubtitleDocument first = new SubtitleDocument();
        SubtitleStyle plain = new SubtitleStyle();
        first.addStyle("Sign", plain);
        first.addEvent(SubtitleEvent.builder().start(0).end(1000).text("a").style("Sign").build());

        SubtitleDocument second = new SubtitleDocument();
        SubtitleStyle bold = new SubtitleStyle();
        bold.setBold(true);
        second.addStyle("Sign", bold);
        second.addEvent(SubtitleEvent.builder().start(1000).end(2000).text("b").style("Sign").build());

        SubtitleDocument merged = SubtitleDocument.merge(first, second);

        assertThat(merged.size()).isEqualTo(2);
        assertThat(merged.getStyles()).containsKeys("Default", "Sign", "Sign (2)");
        assertThat(merged.getEvent(1).getStyle()).isEqualTo("Sign (2)");
        assertThat(merged.getStyle("Sign (2)").isBold()).isTrue();
    }

    @Test
    void videoResolutionIsStoredInScriptInfo() {
        SubtitleDocument document = new SubtitleDocument();
        assertThat(document.getVideoWidth()).isEmpty();
        document.setVideoResolution(1920, 1080);
        assertThat(document.getInfo()).containsEntry(SubtitleDocument.PLAY_RES_X, "1920");
        assertThat(document.getVideoHeight()).contains(1080);
    }
}
