package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedTimestampException;
import com.example.subtitlecodec.format.ConversionPolicy.Feature;
import com.example.subtitlecodec.model.LineBreaks;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleStyle;
import com.example.subtitlecodec.model.TimeFormat;
import com.example.subtitlecodec.tags.OverrideTagEngine;
import com.example.subtitlecodec.tags.StyledFragment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MPL2: {@code [start][end]text} with times in deciseconds, {@code |} between lines and a
 * leading {@code /} marking an italic line.
 */
@Component
public class Mpl2Codec extends AbstractSubtitleCodec {

    public static final String ID = "mpl2";

    private static final String LINE_BREAK = "|";
    private static final String ITALIC_MARK = "/";
    private static final Pattern LINE = Pattern.compile("^\\[(\\d+)\\]\\[(\\d+)\\](.*)$");
    private static final Set<StyleAttribute> CARRIED = EnumSet.of(StyleAttribute.ITALIC);

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of();
    }

    @Override
    public String displayName() {
        return "MPL2";
    }

    @Override
    public boolean canRead(String text) {
        return LineBreaks.normalize(text).lines().anyMatch(line -> LINE.matcher(line.strip()).matches());
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.MPL2;
    }

    @Override
    protected void readInto(String text, SubtitleDocument document, ReadContext context) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher matcher = LINE.matcher(line);
            if (!matcher.matches()) {
                context.malformed(lineNumber, "Expected [start][end]text");
                continue;
            }
            try {
                document.addEvent(SubtitleEvent.builder()
                        .start(TimeFormat.DECISECONDS.parse(matcher.group(1)))
                        .end(TimeFormat.DECISECONDS.parse(matcher.group(2)))
                        .text(convertItalics(matcher.group(3)))
                        .build());
            } catch (MalformedTimestampException | IllegalArgumentException e) {
                context.malformed(lineNumber, e.getMessage(), e);
            }
        }
    }

    private static String convertItalics(String raw) {
        String[] lines = raw.split(Pattern.quote(LINE_BREAK), -1);
        StringBuilder text = new StringBuilder();
        boolean italic = false;
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                text.append('\n');
            }
            String line = lines[i];
            if (line.startsWith(ITALIC_MARK)) {
                if (!italic) {
                    text.append("{\\i1}");
                    italic = true;
                }
                text.append(line.substring(ITALIC_MARK.length()));
            } else {
                if (italic) {
                    text.append("{\\i0}");
                    italic = false;
                }
                text.append(line);
            }
        }
        return text.toString();
    }

    @Override
    protected String writeText(SubtitleDocument document, CodecOptions options, ConversionReport report) {
        StringBuilder out = new StringBuilder();
        List<SubtitleEvent> events = document.getEvents();
        for (int i = 0; i < events.size(); i++) {
            SubtitleEvent event = events.get(i);
            if (event.isComment()) {
                report.record(i, Feature.COMMENT);
                continue;
            }
            if (event.isDrawing()) {
                report.record(i, Feature.DRAWING);
                continue;
            }
            out.append('[').append(TimeFormat.DECISECONDS.format(event.getStart())).append(']')
                    .append('[').append(TimeFormat.DECISECONDS.format(event.getEnd())).append(']')
                    .append(renderText(document, event, i, options, report))
                    .append('\n');
        }
        return out.toString();
    }

    private String renderText(SubtitleDocument document, SubtitleEvent event, int index, CodecOptions options,
                              ConversionReport report) {
        String styleName = resolveStyleName(document, event, index, report);
        SubtitleStyle style = document.getStyle(styleName);
        FeatureScan.fieldFeatures(event).forEach(feature -> report.record(index, feature));
        EnumSet<Feature> tagFeatures = FeatureScan.tagFeatures(event.getText());
        tagFeatures.stream()
                .filter(feature -> feature != Feature.ITALIC)
                .forEach(feature -> report.record(index, feature));
        recordStyleFormatting(styleName, style,
                options.applyStyles() ? CARRIED : EnumSet.noneOf(StyleAttribute.class), report);
        if (!options.applyStyles() && tagFeatures.contains(Feature.ITALIC)) {
            report.discard(index, Feature.ITALIC);
        }

        // split fragments into output lines, remembering which pieces are italic
        List<List<StyledFragment>> lines = new ArrayList<>();
        lines.add(new ArrayList<>());
        for (StyledFragment fragment : OverrideTagEngine.resolve(event.getText(), style, document.getStyles())) {
            String[] parts = LineBreaks.flattenSubstationEscapes(fragment.text()).split("\n", -1);
            for (int p = 0; p < parts.length; p++) {
                if (p > 0) {
                    lines.add(new ArrayList<>());
                }
                if (!parts[p].isEmpty()) {
                    lines.get(lines.size() - 1).add(new StyledFragment(parts[p], fragment.style(), fragment.position()));
                }
            }
        }

        List<String> rendered = new ArrayList<>();
        for (List<StyledFragment> line : lines) {
            StringBuilder text = new StringBuilder();
            line.forEach(piece -> text.append(piece.text()));
            long italicPieces = line.stream().filter(piece -> piece.style().isItalic()).count();
            if (options.applyStyles() && italicPieces > 0) {
                if (italicPieces < line.size()) {
                    report.record(index, Feature.ITALIC);
                }
                text.insert(0, ITALIC_MARK);
            }
            rendered.add(text.toString());
        }
        return String.join(LINE_BREAK, rendered);
    }
}
