package com.example.subtitlecodec.tags;

import com.example.subtitlecodec.exception.UnterminatedOverrideBlockException;
import com.example.subtitlecodec.model.Alignment;
import com.example.subtitlecodec.model.Color;
import com.example.subtitlecodec.model.Position;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.StyleOverride;
import com.example.subtitlecodec.model.SubtitleStyle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class OverrideTagEngineTest {

    @Test
    void parsesBoldToggle() {
        List<OverrideRun> runs = OverrideTagEngine.parseToList("{\\b1}Bold{\\b0} normal", false);

        assertThat(runs).containsExactly(
                OverrideRun.text(StyleOverride.of(StyleAttribute.BOLD, true), "Bold"),
                OverrideRun.text(StyleOverride.of(StyleAttribute.BOLD, false), " normal"));
    }

    @Test
    void serializesBoldToggleMinimally() {
        String text = "{\\b1}Bold{\\b0} normal";
        assertThat(OverrideTagEngine.serialize(OverrideTagEngine.parse(text))).isEqualTo(text);
    }

    @Test
    void coalescesAdjacentBlocksAndDropsNoOps() {
        String serialized = OverrideTagEngine.serialize(OverrideTagEngine.parse("{\\i1}{\\b1}a{\\i1}b"));
        assertThat(serialized).isEqualTo("{\\b1\\i1}ab");
    }

    @Test
    void reparsingSerializedRunsIsSemanticallyStable() {
        String text = "{\\an8\\pos(320,50)\\c&H0000FF&}Sign{\\fnVerdana\\fs30}\\Ntext{\\r}end";
        List<OverrideRun> runs = OverrideTagEngine.parseToList(text, false);
        String serialized = OverrideTagEngine.serialize(runs);
        assertThat(OverrideTagEngine.parseToList(serialized, false)).isEqualTo(runs);
    }

    @Test
    void recognizesCommonDirectives() {
        OverrideRun run = OverrideTagEngine.parseToList("{\\an8\\pos(320,50)\\c&H0000FF&\\fs30}x", false).get(0);
        StyleOverride delta = run.delta();
        assertThat(delta.get(StyleAttribute.ALIGNMENT)).isEqualTo(Alignment.TOP_CENTER);
        assertThat(delta.get(StyleAttribute.POSITION)).isEqualTo(new Position(320, 50));
        assertThat(delta.get(StyleAttribute.PRIMARY_COLOR)).isEqualTo(Color.RED);
        assertThat(delta.get(StyleAttribute.FONT_SIZE)).isEqualTo(30.0);
    }

    @Test
    void unknownDirectivesAndCommentsPassThrough() {
        String text = "{\\blur3}soft{note to self}";
        List<OverrideRun> runs = OverrideTagEngine.parseToList(text, false);

        assertThat(runs).filteredOn(OverrideRun::isPassthrough)
                .extracting(OverrideRun::text)
                .containsExactly("\\blur3", "note to self");
        assertThat(OverrideTagEngine.serialize(runs)).isEqualTo(text);
    }

    @Test
    void keepsTransformArgumentsInOneDirective() {
        List<OverrideRun> runs = OverrideTagEngine.parseToList("{\\t(0,500,\\fs30)}grow", false);
        assertThat(runs.get(0).text()).isEqualTo("\\t(0,500,\\fs30)");
        assertThat(runs.get(0).isPassthrough()).isTrue();
    }

    @Test
    void unterminatedBlockFailsInStrictMode() {
        UnterminatedOverrideBlockException error = catchThrowableOfType(
                () -> OverrideTagEngine.parseToList("Hi {\\b1 there", false), UnterminatedOverrideBlockException.class);
        assertThat(error).isNotNull();
        assertThat(error.getOffset()).isEqualTo(3);
        assertThat(OverrideTagEngine.findUnterminatedBlock("Hi {\\b1 there")).hasValue(3);
        assertThat(OverrideTagEngine.findUnterminatedBlock("{\\b1}ok")).isEmpty();
    }

    @Test
    void unterminatedBlockIsLiteralInLenientMode() {
        List<OverrideRun> runs = OverrideTagEngine.parseToList("Hi {\\b1 there", true);
        assertThat(runs).extracting(OverrideRun::text).containsExactly("Hi ", "{\\b1 there");
    }

    @Test
    void parseIsRestartable() {
        Iterable<OverrideRun> runs = OverrideTagEngine.parse("{\\i1}a{\\i0}b");
        assertThat(runs).hasSize(2);
        assertThat(runs).hasSize(2);
    }

    @Test
    void resolveAppliesDeltasAndResets() {
        SubtitleStyle base = new SubtitleStyle();
        SubtitleStyle sign = new SubtitleStyle();
        sign.setFontName("Verdana");

        List<StyledFragment> fragments = OverrideTagEngine.resolve("{\\b1}a{\\rSign}b{\\r}c{\\i1\\b}d",
                base, Map.of("Default", base, "Sign", sign));

        assertThat(fragments).extracting(StyledFragment::text).containsExactly("a", "b", "c", "d");
        assertThat(fragments.get(0).style().isBold()).isTrue();
        assertThat(fragments.get(1).style().getFontName()).isEqualTo("Verdana");
        assertThat(fragments.get(1).style().isBold()).isFalse();
        assertThat(fragments.get(2).style().getFontName()).isEqualTo("Arial");
        assertThat(fragments.get(3).style().isItalic()).isTrue();
        assertThat(fragments.get(3).style().isBold()).isFalse();
    }

    @Test
    void stripsTags() {
        assertThat(OverrideTagEngine.stripTags("{\\b1}Hello{\\b0} {\\i1}world")).isEqualTo("Hello world");
    }
}
