package com.example.subtitlecodec.format;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What a target format does with each feature a document may use.
 * <p>
 * Anything other than {@link Action#KEEP} is a lossy mapping and is counted once per
 * (event, feature) pair, or once per style for {@link Feature#STYLE_FORMATTING}.
 * Rounding timestamps to a coarser resolution is never counted.
 */
public final class ConversionPolicy {

    public enum Feature {
        COMMENT,
        DRAWING,
        COLOR,
        FONT,
        POSITION,
        ALIGNMENT,
        BOLD,
        ITALIC,
        UNDERLINE,
        STRIKEOUT,
        LAYER,
        MARGINS,
        ACTOR,
        EFFECT,
        UNKNOWN_TAG,
        END_TIME,
        STYLE_FORMATTING
    }

    public enum Action {
        /** Represented exactly. */
        KEEP,
        /** No representation; omitted. */
        DROP,
        /** Mapped to the nearest value the format can hold. */
        APPROXIMATE,
        /** The whole event cannot be carried and is skipped. */
        REJECT
    }

    public static final ConversionPolicy LOSSLESS = builder().build();

    public static final ConversionPolicy SUBSTATION_V4 = builder()
            .set(Action.DROP, Feature.LAYER, Feature.STYLE_FORMATTING)
            .build();

    public static final ConversionPolicy SUBRIP = builder()
            .set(Action.DROP, Feature.COMMENT, Feature.COLOR, Feature.FONT, Feature.POSITION, Feature.ALIGNMENT,
                    Feature.LAYER, Feature.MARGINS, Feature.ACTOR, Feature.EFFECT, Feature.UNKNOWN_TAG,
                    Feature.STYLE_FORMATTING)
            .set(Action.REJECT, Feature.DRAWING)
            .build();

    public static final ConversionPolicy WEBVTT = SUBRIP.toBuilder()
            .set(Action.DROP, Feature.STRIKEOUT)
            .build();

    public static final ConversionPolicy MICRODVD = SUBRIP.toBuilder()
            .set(Action.APPROXIMATE, Feature.COLOR, Feature.BOLD, Feature.ITALIC, Feature.UNDERLINE, Feature.STRIKEOUT)
            .build();

    public static final ConversionPolicy MPL2 = SUBRIP.toBuilder()
            .set(Action.DROP, Feature.BOLD, Feature.UNDERLINE, Feature.STRIKEOUT)
            .set(Action.APPROXIMATE, Feature.ITALIC)
            .build();

    public static final ConversionPolicy TMP = SUBRIP.toBuilder()
            .set(Action.DROP, Feature.BOLD, Feature.ITALIC, Feature.UNDERLINE, Feature.STRIKEOUT)
            .set(Action.APPROXIMATE, Feature.END_TIME)
            .build();

    private final Map<Feature, Action> actions;

    private ConversionPolicy(Map<Feature, Action> actions) {
        this.actions = Collections.unmodifiableMap(new EnumMap<>(actions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.actions.putAll(actions);
        return builder;
    }

    public Action actionFor(Feature feature) {
        return actions.getOrDefault(feature, Action.KEEP);
    }

    public boolean isLossy(Feature feature) {
        return actionFor(feature) != Action.KEEP;
    }

    /**
     * Whether every feature is kept.
     */
    public boolean isLossless() {
        return actions.isEmpty();
    }

    public Map<Feature, Action> asMap() {
        Map<Feature, Action> all = new EnumMap<>(Feature.class);
        for (Feature feature : Feature.values()) {
            all.put(feature, actionFor(feature));
        }
        return all;
    }

    @Override
    public String toString() {
        return "ConversionPolicy" + actions;
    }

    public static final class Builder {

        private final Map<Feature, Action> actions = new EnumMap<>(Feature.class);

        private Builder() {
        }

        public Builder set(Action action, Feature... features) {
            for (Feature feature : features) {
                if (action == Action.KEEP) {
                    actions.remove(feature);
                } else {
                    actions.put(feature, action);
                }
            }
            return this;
        }

        public ConversionPolicy build() {
            return new ConversionPolicy(actions);
        }
    }
}
