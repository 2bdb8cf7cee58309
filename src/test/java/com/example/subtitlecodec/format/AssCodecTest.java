package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedInputException;
import com.example.subtitlecodec.model.Alignment;
import com.example.subtitlecodec.model.EventMargins;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleStyle;
import com.example.subtitlecodec.model.SubtitleTime;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssCodecTest {

    private static final String SCRIPT = """
            [Script Info]
            ; comment line
            Title: Sample
            ScriptType: v4.00+
            PlayResX: 1280
            PlayResY: 720

            [V4+ Styles]
            Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour, BackColour, Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle, BorderStyle, Outline, Shadow, Alignment, MarginL, MarginR, MarginV, Encoding
            Style: Default,Arial,20,&H00FFFFFF,&H000000FF,&H00000000,&H00000000,0,0,0,0,100,100,0,0,1,2,2,2,10,10,10,1
            Style: Sign,Verdana,36,&H0000FFFF,&H000000FF,&H00000000,&H80000000,-1,0,0,0,100,100,0,0,1,2,0,8,10,10,30,1

            [Events]
            Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text
            Dialogue: 0,0:00:01.00,0:00:02.50,Default,,0,0,0,,Hello, world\\Nsecond line
            Dialogue: 1,0:00:03.00,0:00:04.00,Sign,Sam,5,0,0,,{\\pos(640,50)}Sign text
            Comment: 0,0:00:05.00,0:00:06.00,Default,,0,0,0,,a note

            [Fonts]
            fontname: custom.ttf
            """;

    private final AssCodec codec = new AssCodec();

    @Test
    void readsScript() {
        ReadResult read = codec.read(SCRIPT, CodecOptions.DEFAULTS);
        SubtitleDocument document = read.document();

        assertThat(read.warnings()).isEmpty();
        assertThat(document.getInfo()).containsEntry("Title", "Sample").doesNotContainKey("ScriptType");
        assertThat(document.getVideoWidth()).contains(1280);
        assertThat(document.getStyles()).containsOnlyKeys("Default", "Sign");

        SubtitleStyle sign = document.getStyle("Sign");
        assertThat(sign.getFontName()).isEqualTo("Verdana");
        assertThat(sign.isBold()).isTrue();
        assertThat(sign.getAlignment()).isEqualTo(Alignment.fromNumpad(8));

        assertThat(document.size()).isEqualTo(3);
        SubtitleEvent first = document.getEvent(0);
        assertThat(first.getStart()).isEqualTo(SubtitleTime.ofMillis(1000));
        assertThat(first.getEnd()).isEqualTo(SubtitleTime.ofMillis(2500));
        assertThat(first.getText()).isEqualTo("Hello, world\nsecond line");

        SubtitleEvent second = document.getEvent(1);
        assertThat(second.getLayer()).isEqualTo(1);
        assertThat(second.getName()).isEqualTo("Sam");
        assertThat(second.getMargins()).isEqualTo(new EventMargins(5, 0, 0));
        assertThat(document.getEvent(2).isComment()).isTrue();

        assertThat(document.getExtraSections()).containsEntry("[Fonts]", List.of("fontname: custom.ttf"));
    }

    @Test
    void writeThenReadPreservesDocument() {
        SubtitleDocument document = codec.read(SCRIPT, CodecOptions.DEFAULTS).document();

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);
        SubtitleDocument reread = codec.read(written.text(), CodecOptions.DEFAULTS).document();

        assertThat(written.lossyMappings()).isZero();
        assertThat(written.text()).contains("ScriptType: v4.00+", "[V4+ Styles]", "Hello, world\\Nsecond line");
        assertThat(reread.equalsStructurally(document)).isTrue();
        assertThat(reread.getExtraSections()).isEqualTo(document.getExtraSections());
    }

    @Test
    void keepsStyleOrderOfTheFile() {
        String script = SCRIPT.replace(
                "Style: Default,Arial,20,&H00FFFFFF,&H000000FF,&H00000000,&H00000000,0,0,0,0,100,100,0,0,1,2,2,2,10,10,10,1\n",
                "");
        script = script.replace("[Events]", "Style: Default,Arial,20,&H00FFFFFF,&H000000FF,&H00000000,&H00000000,"
                + "0,0,0,0,100,100,0,0,1,2,2,2,10,10,10,1\n\n[Events]");

        SubtitleDocument document = codec.read(script, CodecOptions.DEFAULTS).document();
        String written = codec.write(document, CodecOptions.DEFAULTS).text();

        assertThat(document.getStyles().keySet()).containsExactly("Sign", "Default");
        assertThat(written.indexOf("Style: Sign,")).isLessThan(written.indexOf("Style: Default,"));
    }

    @Test
    void warnsAboutUnterminatedOverrideBlock() {
        String script = "[Script Info]\nScriptType: v4.00+\n\n[Events]\n"
                + "Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n"
                + "Dialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,{\\b1 broken\n";

        ReadResult read = codec.read(script, CodecOptions.DEFAULTS);

        assertThat(read.document().getEvent(0).getText()).isEqualTo("{\\b1 broken");
        assertThat(read.warnings()).extracting(ConversionWarning::kind)
                .containsExactly(ConversionWarning.Kind.UNTERMINATED_OVERRIDE_BLOCK);
    }

    @Test
    void malformedTimeFailsWithLineNumber() {
        String script = "[Script Info]\nScriptType: v4.00+\n\n[Events]\n"
                + "Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n"
                + "Dialogue: 0,soon,0:00:02.00,Default,,0,0,0,,text\n";

        assertThatThrownBy(() -> codec.read(script, CodecOptions.DEFAULTS))
                .isInstanceOfSatisfying(MalformedInputException.class,
                        e -> assertThat(e.getLineNumber()).isEqualTo(6));
        assertThat(codec.read(script, CodecOptions.builder().lenient(true).build()).document().isEmpty()).isTrue();
    }

    @Test
    void reportsMissingStyleAndFallsBackToDefault() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.builder().start(0).end(1000).text("x").style("Gone").build());

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);

        assertThat(written.text()).contains("Dialogue: 0,0:00:00.00,0:00:01.00,Default,,0,0,0,,x");
        assertThat(written.warnings()).extracting(ConversionWarning::kind)
                .containsExactly(ConversionWarning.Kind.UNRESOLVED_STYLE_REFERENCE);
        assertThat(written.lossyMappings()).isZero();
    }

    @Test
    void claimsOnlyAdvancedScripts() {
        assertThat(codec.canRead(SCRIPT)).isTrue();
        assertThat(codec.canRead("[Script Info]\nScriptType: v4.00\n\n[V4 Styles]\n")).isFalse();
    }
}
