package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedTimestampException;
import com.example.subtitlecodec.exception.MissingFrameRateException;
import com.example.subtitlecodec.format.ConversionPolicy.Feature;
import com.example.subtitlecodec.model.Color;
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
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MicroDVD: one {@code {startFrame}{endFrame}text} line per event, {@code |} between lines.
 * Styling is whole-line only: {@code {y:i,b,u,s}} and {@code {c:$BBGGRR}}. An optional first
 * line {@code {1}{1}fps} declares the frame rate.
 */
@Component
public class MicroDvdCodec extends AbstractSubtitleCodec {

    public static final String ID = "microdvd";

    private static final String LINE_BREAK = "|";
    private static final Pattern LINE = Pattern.compile("^\\{(\\d+)\\}\\{(\\d+)\\}(.*)$");
    private static final Pattern FRAME_RATE = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern CONTROL_CODE = Pattern.compile("\\{([A-Za-z]):([^}]*)\\}");
    private static final Set<StyleAttribute> CARRIED = EnumSet.of(StyleAttribute.BOLD, StyleAttribute.ITALIC,
            StyleAttribute.UNDERLINE, StyleAttribute.STRIKEOUT, StyleAttribute.PRIMARY_COLOR);
    private static final Set<Feature> LINE_FEATURES = EnumSet.of(Feature.BOLD, Feature.ITALIC, Feature.UNDERLINE,
            Feature.STRIKEOUT, Feature.COLOR);

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of(".sub");
    }

    @Override
    public String displayName() {
        return "MicroDVD";
    }

    @Override
    public boolean canRead(String text) {
        return LineBreaks.normalize(text).lines().anyMatch(line -> LINE.matcher(line.strip()).matches());
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.MICRODVD;
    }

    // ==================== READ ====================

    @Override
    protected void readInto(String text, SubtitleDocument document, ReadContext context) {
        Double frameRate = context.options().frameRate();
        boolean first = true;
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher matcher = LINE.matcher(line);
            if (!matcher.matches()) {
                context.malformed(lineNumber, "Expected {start}{end}text");
                continue;
            }
            boolean declaration = first && matcher.group(1).equals("1") && matcher.group(2).equals("1")
                    && FRAME_RATE.matcher(matcher.group(3).strip()).matches();
            first = false;
            if (declaration) {
                double declared = Double.parseDouble(matcher.group(3).strip());
                if (frameRate == null) {
                    frameRate = declared;
                }
                log.debug("MicroDVD file declares {} fps, using {}", declared, frameRate);
                continue;
            }
            if (frameRate == null) {
                throw new MissingFrameRateException("MicroDVD input without a {1}{1}fps line");
            }
            try {
                SubtitleEvent event = SubtitleEvent.builder()
                        .start(TimeFormat.FRAMES.parse(matcher.group(1), frameRate))
                        .end(TimeFormat.FRAMES.parse(matcher.group(2), frameRate))
                        .text(convertControlCodes(matcher.group(3)))
                        .build();
                document.addEvent(event);
            } catch (MalformedTimestampException | IllegalArgumentException e) {
                context.malformed(lineNumber, e.getMessage(), e);
            }
        }
        document.setFrameRate(frameRate);
    }

    private String convertControlCodes(String raw) {
        Set<StyleAttribute> flags = EnumSet.noneOf(StyleAttribute.class);
        Color color = null;
        Matcher matcher = CONTROL_CODE.matcher(raw);
        StringBuilder text = new StringBuilder();
        while (matcher.find()) {
            String code = matcher.group(1).toLowerCase(Locale.ROOT);
            String value = matcher.group(2).strip();
            if (code.equals("y")) {
                for (String letter : value.toLowerCase(Locale.ROOT).split(",")) {
                    switch (letter.strip()) {
                        case "b" -> flags.add(StyleAttribute.BOLD);
                        case "i" -> flags.add(StyleAttribute.ITALIC);
                        case "u" -> flags.add(StyleAttribute.UNDERLINE);
                        case "s" -> flags.add(StyleAttribute.STRIKEOUT);
                        default -> log.debug("Ignoring MicroDVD style letter '{}'", letter);
                    }
                }
            } else if (code.equals("c")) {
                try {
                    color = Color.parseMicroDvdColor(value);
                } catch (IllegalArgumentException e) {
                    log.debug("Ignoring MicroDVD color '{}'", value);
                }
            } else {
                log.debug("Dropping MicroDVD control code {} with value {}", code, value);
            }
            matcher.appendReplacement(text, "");
        }
        matcher.appendTail(text);

        StringBuilder prefix = new StringBuilder();
        if (flags.contains(StyleAttribute.BOLD)) {
            prefix.append("\\b1");
        }
        if (flags.contains(StyleAttribute.ITALIC)) {
            prefix.append("\\i1");
        }
        if (flags.contains(StyleAttribute.UNDERLINE)) {
            prefix.append("\\u1");
        }
        if (flags.contains(StyleAttribute.STRIKEOUT)) {
            prefix.append("\\s1");
        }
        if (color != null) {
            prefix.append("\\c").append(color.toTag());
        }
        String body = LineBreaks.parse(text.toString(), LINE_BREAK);
        return prefix.length() == 0 ? body : "{" + prefix + "}" + body;
    }

    // ==================== WRITE ====================

    @Override
    protected String writeText(SubtitleDocument document, CodecOptions options, ConversionReport report) {
        Double frameRate = options.frameRate() != null ? options.frameRate() : document.getFrameRate();
        if (frameRate == null) {
            throw new MissingFrameRateException("MicroDVD output");
        }
        StringBuilder out = new StringBuilder();
        if (options.writeFrameRateDeclaration()) {
            out.append("{1}{1}").append(SubstationCodec.formatNumber(frameRate)).append('\n');
        }
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
            out.append('{').append(TimeFormat.FRAMES.format(event.getStart(), frameRate)).append('}')
                    .append('{').append(TimeFormat.FRAMES.format(event.getEnd(), frameRate)).append('}')
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
                .filter(feature -> !LINE_FEATURES.contains(feature))
                .forEach(feature -> report.record(index, feature));
        recordStyleFormatting(styleName, style,
                options.applyStyles() ? CARRIED : EnumSet.noneOf(StyleAttribute.class), report);

        List<StyledFragment> fragments = OverrideTagEngine.resolve(event.getText(), style, document.getStyles());
        StringBuilder text = new StringBuilder();
        fragments.forEach(fragment -> text.append(LineBreaks.flattenSubstationEscapes(fragment.text())));
        String body = LineBreaks.render(text.toString(), LINE_BREAK);

        if (!options.applyStyles()) {
            tagFeatures.stream().filter(LINE_FEATURES::contains).forEach(feature -> report.discard(index, feature));
            return body;
        }
        if (fragments.isEmpty()) {
            return body;
        }
        // the first fragment's styling is applied to the whole line
        SubtitleStyle line = fragments.get(0).style();
        List<String> letters = new ArrayList<>();
        addFlag(letters, "b", line.isBold(), fragments, SubtitleStyle::isBold, Feature.BOLD, index, report);
        addFlag(letters, "i", line.isItalic(), fragments, SubtitleStyle::isItalic, Feature.ITALIC, index, report);
        addFlag(letters, "u", line.isUnderline(), fragments, SubtitleStyle::isUnderline, Feature.UNDERLINE, index,
                report);
        addFlag(letters, "s", line.isStrikeout(), fragments, SubtitleStyle::isStrikeout, Feature.STRIKEOUT, index,
                report);
        if (fragments.stream().anyMatch(fragment -> !fragment.style().getPrimaryColor().sameRgb(line.getPrimaryColor()))) {
            report.record(index, Feature.COLOR);
        }

        StringBuilder codes = new StringBuilder();
        if (!letters.isEmpty()) {
            codes.append("{y:").append(String.join(",", letters)).append('}');
        }
        if (!line.getPrimaryColor().sameRgb(Color.WHITE)) {
            codes.append("{c:").append(line.getPrimaryColor().toMicroDvd()).append('}');
        }
        return codes + body;
    }

    private static void addFlag(List<String> letters, String letter, boolean on, List<StyledFragment> fragments,
                                Predicate<SubtitleStyle> flag, Feature feature, int index, ConversionReport report) {
        if (on) {
            letters.add(letter);
        }
        if (fragments.stream().anyMatch(fragment -> flag.test(fragment.style()) != on)) {
            report.record(index, feature);
        }
    }
}
