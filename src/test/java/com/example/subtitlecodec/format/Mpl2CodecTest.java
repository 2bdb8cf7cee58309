package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedInputException;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleTime;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class Mpl2CodecTest {

    private final Mpl2Codec codec = new Mpl2Codec();

    @Test
    void readsDecisecondsAndItalicLines() {
        String input = "[10][25]/Italic line|Normal line\n";

        SubtitleDocument document = codec.read(input, CodecOptions.DEFAULTS).document();

        SubtitleEvent event = document.getEvent(0);
        assertThat(event.getStart()).isEqualTo(SubtitleTime.ofMillis(1000));
        assertThat(event.getEnd()).isEqualTo(SubtitleTime.ofMillis(2500));
        assertThat(event.getText()).isEqualTo("{\\i1}Italic line\n{\\i0}Normal line");

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);
        assertThat(written.text()).isEqualTo(input);
        assertThat(written.lossyMappings()).isZero();
    }

    @Test
    void italicWithinLineIsWidenedToWholeLine() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "{\\i1}Half{\\i0} plain"));

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);

        assertThat(written.text()).isEqualTo("[0][10]/Half plain\n");
        assertThat(written.lossyMappings()).isEqualTo(1);
    }

    @Test
    void dropsBold() {
        SubtitleDocument document = new SubtitleDocument();
        document.addEvent(SubtitleEvent.of(0, 1000, "{\\b1}Bold"));

        WriteResult written = codec.write(document, CodecOptions.DEFAULTS);

        assertThat(written.text()).isEqualTo("[0][10]Bold\n");
        assertThat(written.lossyMappings()).isEqualTo(1);
    }

    @Test
    void reportsLineOfMalformedRecord() {
        MalformedInputException error = catchThrowableOfType(
                () -> codec.read("[10][20]ok\nnot a line\n", CodecOptions.DEFAULTS), MalformedInputException.class);

        assertThat(error).isNotNull();
        assertThat(error.getLineNumber()).isEqualTo(2);
    }
}
