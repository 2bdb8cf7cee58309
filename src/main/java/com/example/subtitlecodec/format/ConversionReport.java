package com.example.subtitlecodec.format;

import com.example.subtitlecodec.format.ConversionPolicy.Action;
import com.example.subtitlecodec.format.ConversionPolicy.Feature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the lossy mappings and warnings of one write.
 */
final class ConversionReport {

    private static final Logger log = LoggerFactory.getLogger(ConversionReport.class);

    private final String format;
    private final ConversionPolicy policy;
    private final Set<String> counted = new HashSet<>();
    private final List<ConversionWarning> warnings = new ArrayList<>();

    ConversionReport(String format, ConversionPolicy policy) {
        this.format = format;
        this.policy = policy;
    }

    /**
     * Records that event {@code eventIndex} uses {@code feature}.
     *
     * @return true if the target format cannot carry it exactly
     */
    boolean record(int eventIndex, Feature feature) {
        Action action = policy.actionFor(feature);
        if (action == Action.KEEP) {
            return false;
        }
        count("event:" + eventIndex + ":" + feature, eventIndex, feature, action);
        return true;
    }

    /**
     * Records a feature lost because of the write options rather than the format.
     */
    void discard(int eventIndex, Feature feature) {
        count("event:" + eventIndex + ":" + feature, eventIndex, feature, Action.DROP);
    }

    /**
     * Records style-level formatting of {@code styleName} that the format cannot carry.
     */
    void recordStyle(String styleName, String detail) {
        Action action = policy.actionFor(Feature.STYLE_FORMATTING);
        if (action == Action.KEEP || !counted.add("style:" + styleName)) {
            return;
        }
        log.debug("{}: style {} loses {}", format, styleName, detail);
        warnings.add(new ConversionWarning(kindOf(action), -1, "Style " + styleName + ": " + detail + " dropped"));
    }

    void warn(ConversionWarning.Kind kind, int location, String message) {
        log.warn("{}: {}", format, message);
        warnings.add(new ConversionWarning(kind, location, message));
    }

    private void count(String key, int eventIndex, Feature feature, Action action) {
        if (!counted.add(key)) {
            return;
        }
        String verb = switch (action) {
            case APPROXIMATE -> "approximated";
            case REJECT -> "not representable, event skipped";
            default -> "dropped";
        };
        log.debug("{}: event {} {} {}", format, eventIndex, feature, verb);
        warnings.add(new ConversionWarning(kindOf(action), eventIndex, feature + " " + verb));
    }

    private static ConversionWarning.Kind kindOf(Action action) {
        return action == Action.APPROXIMATE
                ? ConversionWarning.Kind.UNSUPPORTED_FEATURE_APPROXIMATED
                : ConversionWarning.Kind.UNSUPPORTED_FEATURE_DROPPED;
    }

    int lossyMappings() {
        return counted.size();
    }

    WriteResult toResult(String text) {
        return new WriteResult(text, lossyMappings(), warnings);
    }
}
