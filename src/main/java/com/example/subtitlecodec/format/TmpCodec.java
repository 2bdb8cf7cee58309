package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedTimestampException;
import com.example.subtitlecodec.format.ConversionPolicy.Feature;
import com.example.subtitlecodec.model.LineBreaks;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleTime;
import com.example.subtitlecodec.model.TimeFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TMP plain text: {@code HH:MM:SS:text} lines carrying start times only. Each event lasts
 * until the next one starts, but at most {@value #DEFAULT_DURATION_MILLIS} ms.
 */
@Component
public class TmpCodec extends AbstractSubtitleCodec {

    public static final String ID = "tmp";

    static final long DEFAULT_DURATION_MILLIS = 5000;

    private static final String LINE_BREAK = "|";
    private static final Pattern LINE = Pattern.compile("^(\\d{1,2}:\\d{2}:\\d{2})[:=](.*)$");

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of(".txt");
    }

    @Override
    public String displayName() {
        return "TMP Player";
    }

    @Override
    public boolean canRead(String text) {
        // SubRip timing lines also start with a clock time
        if (SubstationCodec.looksLikeScript(text) || text.contains("-->")) {
            return false;
        }
        return LineBreaks.normalize(text).lines().anyMatch(line -> LINE.matcher(line.strip()).matches());
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.TMP;
    }

    @Override
    protected void readInto(String text, SubtitleDocument document, ReadContext context) {
        List<SubtitleTime> starts = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher matcher = LINE.matcher(line);
            if (!matcher.matches()) {
                context.malformed(lineNumber, "Expected HH:MM:SS:text");
                continue;
            }
            try {
                starts.add(TimeFormat.TMP.parse(matcher.group(1)));
                texts.add(LineBreaks.parse(matcher.group(2), LINE_BREAK));
            } catch (MalformedTimestampException e) {
                context.malformed(lineNumber, e.getMessage(), e);
            }
        }
        for (int k = 0; k < starts.size(); k++) {
            SubtitleTime start = starts.get(k);
            SubtitleTime end = implicitEnd(start, k + 1 < starts.size() ? starts.get(k + 1) : null);
            document.addEvent(SubtitleEvent.builder().start(start).end(end).text(texts.get(k)).build());
        }
    }

    /**
     * End time implied by a start time and the start of the following line, if any.
     */
    static SubtitleTime implicitEnd(SubtitleTime start, SubtitleTime next) {
        long end = start.millis() + DEFAULT_DURATION_MILLIS;
        if (next != null && next.millis() < end) {
            end = Math.max(start.millis(), next.millis());
        }
        return SubtitleTime.ofMillis(end);
    }

    @Override
    protected String writeText(SubtitleDocument document, CodecOptions options, ConversionReport report) {
        List<Integer> written = new ArrayList<>();
        List<SubtitleEvent> events = document.getEvents();
        for (int i = 0; i < events.size(); i++) {
            SubtitleEvent event = events.get(i);
            if (event.isComment()) {
                report.record(i, Feature.COMMENT);
            } else if (event.isDrawing()) {
                report.record(i, Feature.DRAWING);
            } else {
                written.add(i);
            }
        }

        StringBuilder out = new StringBuilder();
        for (int k = 0; k < written.size(); k++) {
            int index = written.get(k);
            SubtitleEvent event = events.get(index);
            String styleName = resolveStyleName(document, event, index, report);
            recordEventFeatures(event, index, false, report);
            recordStyleFormatting(styleName, document.getStyle(styleName), EnumSet.noneOf(StyleAttribute.class),
                    report);

            SubtitleTime next = k + 1 < written.size() ? wholeSeconds(events.get(written.get(k + 1)).getStart()) : null;
            SubtitleTime expected = implicitEnd(wholeSeconds(event.getStart()), next);
            if (!expected.equals(wholeSeconds(event.getEnd()))) {
                report.record(index, Feature.END_TIME);
            }

            out.append(TimeFormat.TMP.format(event.getStart()))
                    .append(':')
                    .append(LineBreaks.render(event.plainText(), LINE_BREAK))
                    .append('\n');
        }
        return out.toString();
    }

    private static SubtitleTime wholeSeconds(SubtitleTime time) {
        return SubtitleTime.ofMillis(time.millis() / 1000 * 1000);
    }
}
