package com.example.subtitlecodec.format;

import com.example.subtitlecodec.model.LineBreakStyle;

import java.util.Objects;

/**
 * Knobs for one read or write call. Codecs only look at the options that apply to them.
 *
 * @param frameRate                 frames per second for frame-based formats, or {@code null}
 * @param lenient                   skip and report malformed records instead of failing on the first one
 * @param keepHtmlTags              SubRip/WebVTT read: keep all markup verbatim
 * @param keepUnknownHtmlTags       SubRip/WebVTT read: convert known tags but keep other markup verbatim
 * @param detectLanguage            attach a detected language tag to every event on read
 * @param applyStyles               write styling (line styles and override tags) where the format can carry it
 * @param keepSsaTags               SubRip/WebVTT write: copy override blocks into the output unchanged
 * @param writeFrameRateDeclaration MicroDVD write: emit the leading {@code {1}{1}fps} line
 * @param lineBreakStyle            line terminator of written output
 */
public record CodecOptions(
        Double frameRate,
        boolean lenient,
        boolean keepHtmlTags,
        boolean keepUnknownHtmlTags,
        boolean detectLanguage,
        boolean applyStyles,
        boolean keepSsaTags,
        boolean writeFrameRateDeclaration,
        LineBreakStyle lineBreakStyle) {

    public static final CodecOptions DEFAULTS = builder().build();

    public CodecOptions {
        if (frameRate != null && (!(frameRate > 0) || frameRate.isInfinite())) {
            throw new IllegalArgumentException("Frame rate must be positive: " + frameRate);
        }
        Objects.requireNonNull(lineBreakStyle, "lineBreakStyle");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .frameRate(frameRate)
                .lenient(lenient)
                .keepHtmlTags(keepHtmlTags)
                .keepUnknownHtmlTags(keepUnknownHtmlTags)
                .detectLanguage(detectLanguage)
                .applyStyles(applyStyles)
                .keepSsaTags(keepSsaTags)
                .writeFrameRateDeclaration(writeFrameRateDeclaration)
                .lineBreakStyle(lineBreakStyle);
    }

    public static final class Builder {

        private Double frameRate;
        private boolean lenient;
        private boolean keepHtmlTags;
        private boolean keepUnknownHtmlTags;
        private boolean detectLanguage;
        private boolean applyStyles = true;
        private boolean keepSsaTags;
        private boolean writeFrameRateDeclaration = true;
        private LineBreakStyle lineBreakStyle = LineBreakStyle.LF;

        private Builder() {
        }

        public Builder frameRate(Double frameRate) {
            this.frameRate = frameRate;
            return this;
        }

        public Builder lenient(boolean lenient) {
            this.lenient = lenient;
            return this;
        }

        public Builder keepHtmlTags(boolean keepHtmlTags) {
            this.keepHtmlTags = keepHtmlTags;
            return this;
        }

        public Builder keepUnknownHtmlTags(boolean keepUnknownHtmlTags) {
            this.keepUnknownHtmlTags = keepUnknownHtmlTags;
            return this;
        }

        public Builder detectLanguage(boolean detectLanguage) {
            this.detectLanguage = detectLanguage;
            return this;
        }

        public Builder applyStyles(boolean applyStyles) {
            this.applyStyles = applyStyles;
            return this;
        }

        public Builder keepSsaTags(boolean keepSsaTags) {
            this.keepSsaTags = keepSsaTags;
            return this;
        }

        public Builder writeFrameRateDeclaration(boolean writeFrameRateDeclaration) {
            this.writeFrameRateDeclaration = writeFrameRateDeclaration;
            return this;
        }

        public Builder lineBreakStyle(LineBreakStyle lineBreakStyle) {
            this.lineBreakStyle = lineBreakStyle;
            return this;
        }

        public CodecOptions build() {
            return new CodecOptions(frameRate, lenient, keepHtmlTags, keepUnknownHtmlTags, detectLanguage,
                    applyStyles, keepSsaTags, writeFrameRateDeclaration, lineBreakStyle);
        }
    }
}
