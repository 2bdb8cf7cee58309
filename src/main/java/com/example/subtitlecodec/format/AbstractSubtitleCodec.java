package com.example.subtitlecodec.format;

import com.example.subtitlecodec.model.LineBreaks;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared read/write plumbing: line-ending normalization, result assembly, summary logging
 * and the style lookups every writer needs.
 */
abstract class AbstractSubtitleCodec implements SubtitleCodec {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public final ReadResult read(String text, CodecOptions options) {
        ReadContext context = new ReadContext(identifier(), options);
        SubtitleDocument document = new SubtitleDocument();
        String normalized = LineBreaks.normalize(text);
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }
        readInto(normalized, document, context);
        log.info("Read {} events and {} styles as {} ({} warnings)",
                document.size(), document.getStyles().size(), identifier(), context.warnings().size());
        return new ReadResult(document, context.warnings());
    }

    @Override
    public final WriteResult write(SubtitleDocument document, CodecOptions options) {
        ConversionReport report = new ConversionReport(identifier(), policy());
        String text = options.lineBreakStyle().apply(writeText(document, options, report));
        log.info("Wrote {} events as {} ({} lossy mappings)", document.size(), identifier(), report.lossyMappings());
        return report.toResult(text);
    }

    /**
     * Parses LF-terminated text into an empty document.
     */
    protected abstract void readInto(String text, SubtitleDocument document, ReadContext context);

    /**
     * Produces LF-terminated output.
     */
    protected abstract String writeText(SubtitleDocument document, CodecOptions options, ConversionReport report);

    /**
     * The style an event is written with. An unresolved reference falls back to the default style
     * and is reported once per event.
     */
    protected SubtitleStyle styleOf(SubtitleDocument document, SubtitleEvent event, int index,
                                    ConversionReport report) {
        String name = resolveStyleName(document, event, index, report);
        return document.getStyle(name);
    }

    protected String resolveStyleName(SubtitleDocument document, SubtitleEvent event, int index,
                                      ConversionReport report) {
        String name = document.resolveStyleName(event);
        if (!name.equals(event.getStyle())) {
            report.warn(ConversionWarning.Kind.UNRESOLVED_STYLE_REFERENCE, index,
                    "Event " + index + " refers to missing style '" + event.getStyle() + "', using "
                            + SubtitleStyle.DEFAULT_NAME);
        }
        return name;
    }

    /**
     * Counts the event's non-text fields and override tags against the policy.
     *
     * @param tagsCarried whether the writer copies the override tags verbatim
     */
    protected void recordEventFeatures(SubtitleEvent event, int index, boolean tagsCarried,
                                       ConversionReport report) {
        FeatureScan.fieldFeatures(event).forEach(feature -> report.record(index, feature));
        if (!tagsCarried) {
            FeatureScan.tagFeatures(event.getText()).forEach(feature -> report.record(index, feature));
        }
    }

    /**
     * Counts style formatting the format cannot carry, once per style.
     */
    protected void recordStyleFormatting(String styleName, SubtitleStyle style, Set<StyleAttribute> carried,
                                         ConversionReport report) {
        List<StyleAttribute> lost = FeatureScan.lostStyleAttributes(style, carried);
        if (!lost.isEmpty()) {
            report.recordStyle(styleName, lost.stream().map(Enum::name).collect(Collectors.joining(", ")));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + identifier() + "]";
    }
}
