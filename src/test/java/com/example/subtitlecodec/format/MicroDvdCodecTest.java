package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MissingFrameRateException;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleTime;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MicroDvdCodecTest {

    private final MicroDvdCodec codec = new MicroDvdCodec();

    @Test
    void takesFrameRateFromDeclarationLine() {
        String input = "{1}{1}25\n{25}{50}{y:i}Hello|World\n";

        SubtitleDocument document = codec.read(input, CodecOptions.DEFAULTS).document();

        assertThat(document.getFrameRate()).isEqualTo(25.0);
        assertThat(document.size()).isEqualTo(1);
        SubtitleEvent event = document.getEvent(0);
        assertThat(event.getStart()).isEqualTo(SubtitleTime.ofMillis(1000));
        assertThat(event.getEnd()).isEqualTo(SubtitleTime.ofMillis(2000));
        assertThat(event.getText()).isEqualTo("{\\i1}Hello\nWorld");

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);
        assertThat(written.text()).isEqualTo(input);
        assertThat(written.lossyMappings()).isZero();
    }

    @Test
    void frameRateOptionWinsOverDeclaration() {
        CodecOptions options = CodecOptions.builder().frameRate(10.0).build();

        SubtitleDocument document = codec.read("{1}{1}25\n{25}{50}Hi\n", options).document();

        assertThat(document.getEvent(0).getStart()).isEqualTo(SubtitleTime.ofMillis(2500));
        assertThat(document.getFrameRate()).isEqualTo(10.0);
    }

    @Test
    void failsWithoutAnyFrameRate() {
        assertThatThrownBy(() -> codec.read("{25}{50}Hi\n", CodecOptions.DEFAULTS))
                .isInstanceOf(MissingFrameRateException.class);

        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "Hi"));
        assertThatThrownBy(() -> codec.write(document, CodecOptions.DEFAULTS))
                .isInstanceOf(MissingFrameRateException.class);
    }

    @Test
    void declarationLineCanBeLeftOut() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(1000, 2000, "Hi"));
        CodecOptions options = CodecOptions.builder().frameRate(25.0).writeFrameRateDeclaration(false).build();

        assertThat(codec.write(document, options).text()).isEqualTo("{25}{50}Hi\n");
    }

    @Test
    void appliesFirstFragmentStyleToWholeLine() {
        SubtitleDocument document = new SubtitleDocument();
        document.setFrameRate(25.0);
        document.addEvent(SubtitleEvent.of(1000, 2000, "{\\b1}Bold{\\b0} normal"));

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);

        assertThat(written.text()).isEqualTo("{1}{1}25\n{25}{50}{y:b}Bold normal\n");
        assertThat(written.lossyMappings()).isEqualTo(1);
        assertThat(written.warnings()).extracting(ConversionWarning::kind)
                .containsExactly(ConversionWarning.Kind.UNSUPPORTED_FEATURE_APPROXIMATED);
    }

    @Test
    void writesWholeLineColor() {
        SubtitleDocument document = new SubtitleDocument();
        document.setFrameRate(25.0);
        document.addEvent(SubtitleEvent.of(1000, 2000, "{\\c&H0000FF&}Red"));

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);

        assertThat(written.text()).isEqualTo("{1}{1}25\n{25}{50}{c:$0000FF}Red\n");
        assertThat(written.lossyMappings()).isZero();

        SubtitleDocument reread = codec.read(written.text(), CodecOptions.DEFAULTS).document();
        assertThat(reread.getEvent(0).getText()).isEqualTo("{\\c&H0000FF&}Red");
    }

    @Test
    void recognizesFrameLines() {
        assertThat(codec.canRead("{0}{25}Hello\n")).isTrue();
        assertThat(codec.canRead("[0][25]Hello\n")).isFalse();
    }
}
