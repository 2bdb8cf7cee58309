package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedInputException;
import com.example.subtitlecodec.model.LineBreakStyle;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleTime;
import com.example.subtitlecodec.service.JsoupHtmlStripper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SubripCodecTest {

    private static final CodecOptions STRICT = CodecOptions.DEFAULTS;
    private static final CodecOptions LENIENT = CodecOptions.builder().lenient(true).build();

    private final SubripCodec codec = new SubripCodec(new JsoupHtmlStripper());

    @Test
    void readsAndWritesSingleBlockByteForByte() {
        String input = "1\n00:00:01,000 --> 00:00:02,500\nHello\n\n";

        ReadResult read = codec.read(input, STRICT);

        assertThat(read.warnings()).isEmpty();
        SubtitleDocument document = read.document();
        assertThat(document.size()).isEqualTo(1);
        SubtitleEvent event = document.getEvent(0);
        assertThat(event.getStart()).isEqualTo(SubtitleTime.ofMillis(1000));
        assertThat(event.getEnd()).isEqualTo(SubtitleTime.ofMillis(2500));
        assertThat(event.getText()).isEqualTo("Hello");

        WriteResult written = codec.write(document, STRICT);
        assertThat(written.text()).isEqualTo(input);
        assertThat(written.lossyMappings()).isZero();
    }

    @Test
    void nextBlockNumberIsNotPartOfText() {
        String input = "1\n00:00:01,000 --> 00:00:02,000\nFirst line\nSecond line\n\n"
                + "2\n00:00:03,000 --> 00:00:04,000\nNext\n";

        SubtitleDocument document = codec.read(input, STRICT).document();

        assertThat(document.getEvents()).extracting(SubtitleEvent::getText)
                .containsExactly("First line\nSecond line", "Next");
    }

    @Test
    void readsCrlfInputAndWritesCrlfOnRequest() {
        String input = "1\r\n00:00:01,000 --> 00:00:02,000\r\nHi\r\n\r\n";
        SubtitleDocument document = codec.read(input, STRICT).document();
        assertThat(document.getEvent(0).getText()).isEqualTo("Hi");

        CodecOptions crlf = CodecOptions.builder().lineBreakStyle(LineBreakStyle.CRLF).build();
        assertThat(codec.write(document, crlf).text()).isEqualTo(input);
    }

    @Test
    void convertsKnownMarkupToOverrideTags() {
        String input = "1\n00:00:01,000 --> 00:00:02,000\n<i>Hi</i> <font color=\"red\">there</font>\n";

        SubtitleDocument document = codec.read(input, STRICT).document();

        assertThat(document.getEvent(0).getText()).isEqualTo("{\\i1}Hi{\\i0} there");
        assertThat(codec.write(document, STRICT).text())
                .isEqualTo("1\n00:00:01,000 --> 00:00:02,000\n<i>Hi</i> there\n\n");
    }

    @Test
    void keepsUnknownMarkupWhenAsked() {
        String input = "1\n00:00:01,000 --> 00:00:02,000\n<b>Hi</b> <font color=\"red\">there</font>\n";

        String text = codec.read(input, CodecOptions.builder().keepUnknownHtmlTags(true).build())
                .document().getEvent(0).getText();
        assertThat(text).isEqualTo("{\\b1}Hi{\\b0} <font color=\"red\">there</font>");

        String verbatim = codec.read(input, CodecOptions.builder().keepHtmlTags(true).build())
                .document().getEvent(0).getText();
        assertThat(verbatim).isEqualTo("<b>Hi</b> <font color=\"red\">there</font>");
    }

    @Test
    void malformedTimingLineFailsInStrictMode() {
        String input = "1\n00:00:01,000 --> 00:00:02,000\nGood\n\n2\n00:00:03,000 --> later\nBad\n";

        MalformedInputException error = catchThrowableOfType(() -> codec.read(input, STRICT),
                MalformedInputException.class);

        assertThat(error).isNotNull();
        assertThat(error.getLineNumber()).isEqualTo(6);
    }

    @Test
    void malformedTimingLineIsSkippedInLenientMode() {
        String input = "1\n00:00:01,000 --> 00:00:02,000\nGood\n\n2\n00:00:03,000 --> later\nBad\n";

        ReadResult read = codec.read(input, LENIENT);

        assertThat(read.document().getEvents()).extracting(SubtitleEvent::getText).containsExactly("Good");
        assertThat(read.warnings()).singleElement()
                .satisfies(warning -> {
                    assertThat(warning.kind()).isEqualTo(ConversionWarning.Kind.MALFORMED_INPUT);
                    assertThat(warning.location()).isEqualTo(6);
                });
    }

    @Test
    void endBeforeStartIsMalformed() {
        String input = "1\n00:00:02,000 --> 00:00:01,000\nBackwards\n";

        MalformedInputException error = catchThrowableOfType(() -> codec.read(input, STRICT),
                MalformedInputException.class);

        assertThat(error).isNotNull();
        assertThat(error.getLineNumber()).isEqualTo(2);
        assertThat(codec.read(input, LENIENT).document().isEmpty()).isTrue();
    }

    @Test
    void colorOverrideCountsExactlyOneLossyMapping() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(1000, 2000, "{\\c&H0000FF&}Red{\\c} text"));

        WriteResult written = codec.write(document, STRICT);

        assertThat(written.lossyMappings()).isEqualTo(1);
        assertThat(written.text()).isEqualTo("1\n00:00:01,000 --> 00:00:02,000\nRed text\n\n");
        assertThat(written.warnings()).extracting(ConversionWarning::kind)
                .containsExactly(ConversionWarning.Kind.UNSUPPORTED_FEATURE_DROPPED);
    }

    @Test
    void skipsCommentsAndDrawings() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.builder().start(0).end(1000).text("note").comment(true).build());
        document.addEvent(SubtitleEvent.of(0, 1000, "{\\p1}m 0 0 l 100 0 100 100{\\p0}"));
        document.addEvent(SubtitleEvent.of(1000, 2000, "Shown"));

        WriteResult written = codec.write(document, STRICT);

        assertThat(written.text()).isEqualTo("1\n00:00:01,000 --> 00:00:02,000\nShown\n\n");
        assertThat(written.lossyMappings()).isEqualTo(2);
    }

    @Test
    void writesTextFlagsAsHtml() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "{\\b1}Bold{\\b0} and {\\u1\\s1}marked{\\u0\\s0}\nline two"));

        WriteResult written = codec.write(document, STRICT);

        assertThat(written.text()).isEqualTo(
                "1\n00:00:00,000 --> 00:00:01,000\n<b>Bold</b> and <s><u>marked</u></s>\nline two\n\n");
        assertThat(written.isLossless()).isTrue();
    }

    @Test
    void canCopyOverrideTagsVerbatim() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "{\\an8}Top"));

        WriteResult written = codec.write(document, CodecOptions.builder().keepSsaTags(true).build());

        assertThat(written.text()).contains("{\\an8}Top");
        assertThat(written.lossyMappings()).isZero();
    }

    @Test
    void styleFormattingIsCountedOncePerStyle() {
        SubtitleDocument document = new SubtitleDocument();
        document.getDefaultStyle().setFontName("Verdana");
        document.addEvent(SubtitleEvent.of(0, 1000, "a"));
        document.addEvent(SubtitleEvent.of(1000, 2000, "b"));

        assertThat(codec.write(document, STRICT).lossyMappings()).isEqualTo(1);
    }

    @Test
    void recognizesSubripContent() {
        assertThat(codec.canRead("1\n00:00:01,000 --> 00:00:02,000\nHi\n")).isTrue();
        assertThat(codec.canRead("WEBVTT\n\n00:00:01.000 --> 00:00:02.000\nHi\n")).isFalse();
        assertThat(codec.canRead("[Script Info]\nTitle: x\n")).isFalse();
    }
}
