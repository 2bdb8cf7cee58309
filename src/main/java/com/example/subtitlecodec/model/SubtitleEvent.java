package com.example.subtitlecodec.model;

import com.example.subtitlecodec.tags.OverrideTagEngine;

import java.util.Objects;

/**
 * One subtitle line. Events are immutable values; edits return a new event which the
 * owning {@link SubtitleDocument} stores in place of the old one.
 * <p>
 * Text may embed SubStation override tags and uses {@code \n} for line breaks whatever
 * the source format was.
 */
public final class SubtitleEvent {

    private final SubtitleTime start;
    private final SubtitleTime end;
    private final String text;
    private final String style;
    private final int layer;
    private final String name;
    private final EventMargins margins;
    private final String effect;
    private final boolean comment;
    private final boolean marked;
    private final String language;

    private SubtitleEvent(Builder builder) {
        this.start = Objects.requireNonNull(builder.start, "start");
        this.end = Objects.requireNonNull(builder.end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException(
                    String.format("Event end %s precedes start %s", end, start));
        }
        this.text = LineBreaks.normalize(builder.text);
        this.style = builder.style == null || builder.style.isEmpty() ? SubtitleStyle.DEFAULT_NAME : builder.style;
        this.layer = builder.layer;
        this.name = builder.name == null ? "" : builder.name;
        this.margins = builder.margins == null || builder.margins.isNone() ? null : builder.margins;
        this.effect = builder.effect == null ? "" : builder.effect;
        this.comment = builder.comment;
        this.marked = builder.marked;
        this.language = builder.language;
    }

    public static SubtitleEvent of(long startMillis, long endMillis, String text) {
        return builder().start(startMillis).end(endMillis).text(text).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.start = start;
        builder.end = end;
        builder.text = text;
        builder.style = style;
        builder.layer = layer;
        builder.name = name;
        builder.margins = margins;
        builder.effect = effect;
        builder.comment = comment;
        builder.marked = marked;
        builder.language = language;
        return builder;
    }

    public long duration() {
        return end.millis() - start.millis();
    }

    /**
     * Moves both ends by {@code deltaMillis}, clamping each at zero.
     */
    public SubtitleEvent shift(long deltaMillis) {
        return toBuilder().start(start.shift(deltaMillis)).end(end.shift(deltaMillis)).build();
    }

    /**
     * Stretches timing around {@code pivot}: {@code t' = pivot + (t - pivot) * factor}.
     */
    public SubtitleEvent scale(double factor, SubtitleTime pivot) {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Scale factor must be positive: " + factor);
        }
        return toBuilder()
                .start(scaleTime(start, factor, pivot))
                .end(scaleTime(end, factor, pivot))
                .build();
    }

    private static SubtitleTime scaleTime(SubtitleTime time, double factor, SubtitleTime pivot) {
        double scaled = pivot.millis() + (time.millis() - pivot.millis()) * factor;
        return SubtitleTime.ofMillis(Math.max(0, Math.round(scaled)));
    }

    public SubtitleEvent withText(String text) {
        return toBuilder().text(text).build();
    }

    public SubtitleEvent withStyle(String style) {
        return toBuilder().style(style).build();
    }

    public SubtitleEvent withTimes(SubtitleTime start, SubtitleTime end) {
        return toBuilder().start(start).end(end).build();
    }

    public SubtitleEvent withLanguage(String language) {
        return toBuilder().language(language).build();
    }

    /**
     * Text with every internal line break replaced by {@code marker}.
     */
    public String textWithBreaks(String marker) {
        return LineBreaks.render(text, marker);
    }

    /**
     * Text without override tags, with SubStation escapes turned into whitespace.
     */
    public String plainText() {
        return LineBreaks.flattenSubstationEscapes(OverrideTagEngine.stripTags(text));
    }

    /**
     * True if any part of the text is in {@code \p} drawing mode.
     */
    public boolean isDrawing() {
        return OverrideTagEngine.containsDrawing(text);
    }

    /**
     * Margin changes as an override on top of the event's style.
     */
    public StyleOverride marginOverride() {
        StyleOverride override = StyleOverride.empty();
        if (margins == null) {
            return override;
        }
        if (margins.left() != 0) {
            override = override.with(StyleAttribute.MARGIN_L, margins.left());
        }
        if (margins.right() != 0) {
            override = override.with(StyleAttribute.MARGIN_R, margins.right());
        }
        if (margins.vertical() != 0) {
            override = override.with(StyleAttribute.MARGIN_V, margins.vertical());
        }
        return override;
    }

    public SubtitleTime getStart() {
        return start;
    }

    public SubtitleTime getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }

    public String getStyle() {
        return style;
    }

    public int getLayer() {
        return layer;
    }

    /**
     * Actor name.
     */
    public String getName() {
        return name;
    }

    /**
     * Margin override, or {@code null} when the style's margins apply.
     */
    public EventMargins getMargins() {
        return margins;
    }

    public String getEffect() {
        return effect;
    }

    public boolean isComment() {
        return comment;
    }

    /**
     * SSA "Marked" flag.
     */
    public boolean isMarked() {
        return marked;
    }

    /**
     * Language tag attached by language detection, or {@code null}.
     */
    public String getLanguage() {
        return language;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubtitleEvent other)) {
            return false;
        }
        return layer == other.layer
                && comment == other.comment
                && marked == other.marked
                && start.equals(other.start)
                && end.equals(other.end)
                && text.equals(other.text)
                && style.equals(other.style)
                && name.equals(other.name)
                && Objects.equals(margins, other.margins)
                && effect.equals(other.effect)
                && Objects.equals(language, other.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, text, style, layer, name, margins, effect, comment, marked, language);
    }

    @Override
    public String toString() {
        return String.format("SubtitleEvent[%s%s --> %s style=%s text=%s]",
                comment ? "comment " : "", start, end, style, text.replace("\n", "\\n"));
    }

    public static final class Builder {

        private SubtitleTime start = SubtitleTime.ZERO;
        private SubtitleTime end = SubtitleTime.ZERO;
        private String text = "";
        private String style = SubtitleStyle.DEFAULT_NAME;
        private int layer;
        private String name = "";
        private EventMargins margins;
        private String effect = "";
        private boolean comment;
        private boolean marked;
        private String language;

        private Builder() {
        }

        public Builder start(SubtitleTime start) {
            this.start = start;
            return this;
        }

        public Builder start(long millis) {
            return start(SubtitleTime.ofMillis(millis));
        }

        public Builder end(SubtitleTime end) {
            this.end = end;
            return this;
        }

        public Builder end(long millis) {
            return end(SubtitleTime.ofMillis(millis));
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder style(String style) {
            this.style = style;
            return this;
        }

        public Builder layer(int layer) {
            this.layer = layer;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder margins(EventMargins margins) {
            this.margins = margins;
            return this;
        }

        public Builder effect(String effect) {
            this.effect = effect;
            return this;
        }

        public Builder comment(boolean comment) {
            this.comment = comment;
            return this;
        }

        public Builder marked(boolean marked) {
            this.marked = marked;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        /**
         * @throws IllegalArgumentException if end precedes start
         */
        public SubtitleEvent build() {
            return new SubtitleEvent(this);
        }
    }
}
