package com.example.subtitlecodec.format;

import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.TimeFormat;
import com.example.subtitlecodec.service.HtmlStripper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * WebVTT. Shares the block layout with SubRip; differs in the {@code WEBVTT} header,
 * '.' before milliseconds, optional hours, no strikeout markup, and cues ordered by start time.
 * Cue identifiers, cue settings, {@code NOTE} and {@code STYLE} blocks are ignored on read.
 */
@Component
public class WebVttCodec extends SubripCodec {

    public static final String ID = "vtt";

    static final String HEADER = "WEBVTT";

    public WebVttCodec(HtmlStripper htmlStripper) {
        super(htmlStripper);
    }

    static boolean hasHeader(String text) {
        String content = text.startsWith("\uFEFF") ? text.substring(1) : text;
        return content.stripLeading().startsWith(HEADER);
    }

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of(".vtt");
    }

    @Override
    public String displayName() {
        return "WebVTT";
    }

    @Override
    public boolean canRead(String text) {
        return hasHeader(text);
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.WEBVTT;
    }

    @Override
    protected TimeFormat timeFormat() {
        return TimeFormat.WEBVTT;
    }

    @Override
    protected Set<StyleAttribute> carriedStyleAttributes() {
        return EnumSet.of(StyleAttribute.BOLD, StyleAttribute.ITALIC, StyleAttribute.UNDERLINE);
    }

    /**
     * Cue payload ends at the first blank line.
     */
    @Override
    protected String cueText(List<String> lines) {
        List<String> payload = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                break;
            }
            payload.add(line);
        }
        return String.join("\n", payload).strip();
    }

    @Override
    protected List<IndexedEvent> outputOrder(SubtitleDocument document) {
        List<IndexedEvent> ordered = super.outputOrder(document);
        ordered.sort(Comparator.comparing(indexed -> indexed.event().getStart()));
        return ordered;
    }

    @Override
    protected String header() {
        return HEADER + "\n\n";
    }
}
