package com.example.subtitlecodec.format;

import com.example.subtitlecodec.format.ConversionPolicy.Feature;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleStyle;
import com.example.subtitlecodec.tags.OverrideRun;
import com.example.subtitlecodec.tags.OverrideTagEngine;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds the features an event or style uses, for conversion reporting.
 */
final class FeatureScan {

    private static final SubtitleStyle DEFAULT_STYLE = new SubtitleStyle();

    private FeatureScan() {
    }

    /**
     * Features used by the override tags in {@code text}.
     */
    static EnumSet<Feature> tagFeatures(String text) {
        EnumSet<Feature> features = EnumSet.noneOf(Feature.class);
        if (text.indexOf('{') < 0) {
            return features;
        }
        for (OverrideRun run : OverrideTagEngine.parseLenient(text)) {
            if (run.isPassthrough()) {
                features.add(Feature.UNKNOWN_TAG);
                continue;
            }
            for (StyleAttribute attribute : run.delta().attributes()) {
                Feature feature = featureOf(attribute, run.delta().get(attribute));
                if (feature != null) {
                    features.add(feature);
                }
            }
        }
        return features;
    }

    /**
     * Features carried by event fields rather than text.
     */
    static EnumSet<Feature> fieldFeatures(SubtitleEvent event) {
        EnumSet<Feature> features = EnumSet.noneOf(Feature.class);
        if (event.getLayer() != 0) {
            features.add(Feature.LAYER);
        }
        if (event.getMargins() != null) {
            features.add(Feature.MARGINS);
        }
        if (!event.getName().isEmpty()) {
            features.add(Feature.ACTOR);
        }
        if (!event.getEffect().isEmpty()) {
            features.add(Feature.EFFECT);
        }
        return features;
    }

    static Feature featureOf(StyleAttribute attribute, Object value) {
        return switch (attribute) {
            case BOLD -> Feature.BOLD;
            case ITALIC -> Feature.ITALIC;
            case UNDERLINE -> Feature.UNDERLINE;
            case STRIKEOUT -> Feature.STRIKEOUT;
            case DRAWING -> Feature.DRAWING;
            case PRIMARY_COLOR, SECONDARY_COLOR, OUTLINE_COLOR, BACK_COLOR -> Feature.COLOR;
            case FONT_NAME, FONT_SIZE, SCALE_X, SCALE_Y, SPACING, ANGLE, OUTLINE, SHADOW -> Feature.FONT;
            case ALIGNMENT -> Feature.ALIGNMENT;
            case POSITION -> Feature.POSITION;
            case MARGIN_L, MARGIN_R, MARGIN_V -> Feature.MARGINS;
            // switching to another named style brings in formatting the target may not have
            case RESET -> value == null || value.toString().isEmpty() ? null : Feature.FONT;
        };
    }

    /**
     * Attributes of {@code style} that differ from the SubStation defaults and are not in {@code carried}.
     */
    static List<StyleAttribute> lostStyleAttributes(SubtitleStyle style, Set<StyleAttribute> carried) {
        List<StyleAttribute> lost = new ArrayList<>();
        for (StyleAttribute attribute : StyleAttribute.values()) {
            if (carried.contains(attribute)) {
                continue;
            }
            Object value = style.get(attribute);
            if (value != null && !Objects.equals(value, DEFAULT_STYLE.get(attribute))) {
                lost.add(attribute);
            }
        }
        return lost;
    }
}
