package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedTimestampException;
import com.example.subtitlecodec.format.ConversionPolicy.Feature;
import com.example.subtitlecodec.model.LineBreaks;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleStyle;
import com.example.subtitlecodec.model.SubtitleTime;
import com.example.subtitlecodec.model.TimeFormat;
import com.example.subtitlecodec.service.HtmlStripper;
import com.example.subtitlecodec.tags.OverrideTagEngine;
import com.example.subtitlecodec.tags.StyledFragment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SubRip: numbered blocks of a {@code start --> end} timing line followed by text.
 * <p>
 * Reading converts {@code <b> <i> <u> <s>} to override tags and strips other markup unless told
 * to keep it. Writing renders bold, italic, underline and strikeout as HTML tags; comments and
 * vector drawings are skipped.
 */
@Component
public class SubripCodec extends AbstractSubtitleCodec {

    public static final String ID = "srt";

    private static final Pattern TRAILING_INDEX = Pattern.compile("\n+ *\\d+ *$");
    private static final Pattern INDEX_LINE = Pattern.compile("\\s*\\d+\\s*");
    private static final Pattern KNOWN_TAG = Pattern.compile("<\\s*(/?)\\s*([bius])\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Set<Feature> TEXT_FLAGS = EnumSet.of(Feature.BOLD, Feature.ITALIC, Feature.UNDERLINE,
            Feature.STRIKEOUT);

    private final HtmlStripper htmlStripper;

    public SubripCodec(HtmlStripper htmlStripper) {
        this.htmlStripper = htmlStripper;
    }

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of(".srt");
    }

    @Override
    public String displayName() {
        return "SubRip";
    }

    @Override
    public boolean canRead(String text) {
        if (SubstationCodec.looksLikeScript(text) || WebVttCodec.hasHeader(text)) {
            return false;
        }
        return LineBreaks.normalize(text).lines().anyMatch(line -> countTimestamps(line) == 2);
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.SUBRIP;
    }

    protected TimeFormat timeFormat() {
        return TimeFormat.SUBRIP;
    }

    /**
     * Style attributes the written markup can express.
     */
    protected Set<StyleAttribute> carriedStyleAttributes() {
        return EnumSet.of(StyleAttribute.BOLD, StyleAttribute.ITALIC, StyleAttribute.UNDERLINE,
                StyleAttribute.STRIKEOUT);
    }

    // ==================== READ ====================

    private int countTimestamps(String line) {
        Matcher matcher = timeFormat().pattern().matcher(line);
        int count = 0;
        while (matcher.find() && count < 3) {
            count++;
        }
        return count;
    }

    @Override
    protected void readInto(String text, SubtitleDocument document, ReadContext context) {
        String[] lines = text.split("\n", -1);
        PendingCue cue = null;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i];
            List<String> stamps = findTimestamps(line);
            if (stamps.size() == 2) {
                addCue(cue, document, context);
                cue = null;
                try {
                    SubtitleTime start = timeFormat().parse(stamps.get(0));
                    SubtitleTime end = timeFormat().parse(stamps.get(1));
                    cue = new PendingCue(lineNumber, start, end);
                } catch (MalformedTimestampException e) {
                    context.malformed(lineNumber, e.getMessage(), e);
                }
            } else if (isBrokenTimingLine(line)) {
                addCue(cue, document, context);
                cue = null;
                context.malformed(lineNumber, "Malformed timing line: " + line.strip());
            } else if (cue != null) {
                cue.lines.add(line);
            }
        }
        addCue(cue, document, context);
    }

    private List<String> findTimestamps(String line) {
        Matcher matcher = timeFormat().pattern().matcher(line);
        List<String> stamps = new ArrayList<>(2);
        while (matcher.find() && stamps.size() < 3) {
            stamps.add(matcher.group());
        }
        return stamps;
    }

    private static boolean isBrokenTimingLine(String line) {
        String trimmed = line.strip();
        return trimmed.contains("-->") && !trimmed.isEmpty() && Character.isDigit(trimmed.charAt(0));
    }

    private void addCue(PendingCue cue, SubtitleDocument document, ReadContext context) {
        if (cue == null) {
            return;
        }
        String text = convertMarkup(cueText(cue.lines), context.options());
        try {
            document.addEvent(SubtitleEvent.builder().start(cue.start).end(cue.end).text(text).build());
        } catch (IllegalArgumentException e) {
            context.malformed(cue.lineNumber, e.getMessage(), e);
        }
    }

    /**
     * Joins the lines following a timing line into event text, leaving out the index line of the next block.
     */
    protected String cueText(List<String> lines) {
        int last = lines.size() - 1;
        if (lines.size() >= 2 && INDEX_LINE.matcher(lines.get(last)).matches()
                && lines.subList(0, last).stream().allMatch(String::isBlank)) {
            return "";
        }
        String joined = String.join("\n", lines).strip();
        return TRAILING_INDEX.matcher(joined).replaceFirst("");
    }

    private String convertMarkup(String text, CodecOptions options) {
        if (options.keepHtmlTags()) {
            return text;
        }
        Matcher matcher = KNOWN_TAG.matcher(text);
        StringBuilder converted = new StringBuilder();
        while (matcher.find()) {
            String tag = matcher.group(2).toLowerCase(Locale.ROOT);
            String value = matcher.group(1).isEmpty() ? "1" : "0";
            matcher.appendReplacement(converted, Matcher.quoteReplacement("{\\" + tag + value + "}"));
        }
        matcher.appendTail(converted);
        String result = converted.toString();
        if (!options.keepUnknownHtmlTags()) {
            result = htmlStripper.strip(result);
        }
        return result.strip();
    }

    // ==================== WRITE ====================

    /**
     * Events in output order, with their index in the document.
     */
    protected List<IndexedEvent> outputOrder(SubtitleDocument document) {
        List<IndexedEvent> ordered = new ArrayList<>();
        List<SubtitleEvent> events = document.getEvents();
        for (int i = 0; i < events.size(); i++) {
            ordered.add(new IndexedEvent(i, events.get(i)));
        }
        return ordered;
    }

    protected String header() {
        return "";
    }

    @Override
    protected String writeText(SubtitleDocument document, CodecOptions options, ConversionReport report) {
        StringBuilder out = new StringBuilder(header());
        int number = 1;
        for (IndexedEvent indexed : outputOrder(document)) {
            SubtitleEvent event = indexed.event();
            int index = indexed.index();
            if (event.isComment()) {
                report.record(index, Feature.COMMENT);
                continue;
            }
            String text = renderText(document, event, index, options, report);
            if (text == null) {
                continue;
            }
            out.append(number++).append('\n');
            out.append(timeFormat().format(event.getStart()))
                    .append(" --> ")
                    .append(timeFormat().format(event.getEnd()))
                    .append('\n');
            out.append(text).append("\n\n");
        }
        return out.toString();
    }

    /**
     * Event text as markup, or {@code null} if the event is a drawing and cannot be written.
     */
    private String renderText(SubtitleDocument document, SubtitleEvent event, int index, CodecOptions options,
                              ConversionReport report) {
        if (options.keepSsaTags()) {
            recordEventFeatures(event, index, true, report);
            return collapseBreaks(LineBreaks.flattenSubstationEscapes(event.getText()));
        }
        if (event.isDrawing()) {
            report.record(index, Feature.DRAWING);
            return null;
        }
        String styleName = resolveStyleName(document, event, index, report);
        SubtitleStyle style = document.getStyle(styleName);
        recordEventFeatures(event, index, false, report);
        Set<StyleAttribute> carried = options.applyStyles() ? carriedStyleAttributes() : EnumSet.noneOf(StyleAttribute.class);
        recordStyleFormatting(styleName, style, carried, report);
        if (!options.applyStyles()) {
            FeatureScan.tagFeatures(event.getText()).stream()
                    .filter(TEXT_FLAGS::contains)
                    .forEach(feature -> report.discard(index, feature));
        }

        StringBuilder body = new StringBuilder();
        for (StyledFragment fragment : OverrideTagEngine.resolve(event.getText(), style, document.getStyles())) {
            String text = LineBreaks.flattenSubstationEscapes(fragment.text());
            body.append(options.applyStyles() ? wrap(text, fragment.style(), carried) : text);
        }
        return collapseBreaks(body.toString());
    }

    private static String wrap(String text, SubtitleStyle style, Set<StyleAttribute> carried) {
        String result = text;
        if (style.isBold() && carried.contains(StyleAttribute.BOLD)) {
            result = "<b>" + result + "</b>";
        }
        if (style.isItalic() && carried.contains(StyleAttribute.ITALIC)) {
            result = "<i>" + result + "</i>";
        }
        if (style.isUnderline() && carried.contains(StyleAttribute.UNDERLINE)) {
            result = "<u>" + result + "</u>";
        }
        if (style.isStrikeout() && carried.contains(StyleAttribute.STRIKEOUT)) {
            result = "<s>" + result + "</s>";
        }
        return result;
    }

    private static String collapseBreaks(String text) {
        return text.strip().replaceAll("\n+", "\n");
    }

    protected record IndexedEvent(int index, SubtitleEvent event) {
    }

    private static final class PendingCue {

        private final int lineNumber;
        private final SubtitleTime start;
        private final SubtitleTime end;
        private final List<String> lines = new ArrayList<>();

        private PendingCue(int lineNumber, SubtitleTime start, SubtitleTime end) {
            this.lineNumber = lineNumber;
            this.start = start;
            this.end = end;
        }
    }
}
