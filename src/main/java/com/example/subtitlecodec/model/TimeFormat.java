package com.example.subtitlecodec.model;

import com.example.subtitlecodec.exception.MalformedTimestampException;
import com.example.subtitlecodec.exception.MissingFrameRateException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual timestamp grammars of the supported formats.
 * Formatting rounds to the grammar's resolution, so parse(format(t)) is stable
 * within one grammar but lossy across grammars of different resolution.
 */
public enum TimeFormat {

    /**
     * {@code HH:MM:SS,mmm}. Reading also accepts '.' and 1-3 fraction digits.
     */
    SUBRIP(Pattern.compile("(\\d{1,2}):(\\d{1,2}):(\\d{1,2})[.,](\\d{1,3})")) {
        @Override
        public String format(SubtitleTime time, Double frameRate) {
            long ms = Math.min(time.millis(), MAX_TWO_DIGIT_HOURS);
            SubtitleTime t = SubtitleTime.ofMillis(ms);
            return String.format("%02d:%02d:%02d,%03d", t.hoursPart(), t.minutesPart(), t.secondsPart(),
                    t.millisPart());
        }
    },

    /**
     * {@code [HH:]MM:SS.mmm}.
     */
    WEBVTT(Pattern.compile("(?:(\\d{1,4}):)?(\\d{2}):(\\d{2})\\.(\\d{2,3})")) {
        @Override
        public String format(SubtitleTime time, Double frameRate) {
            SubtitleTime t = SubtitleTime.ofMillis(Math.min(time.millis(), MAX_FOUR_DIGIT_HOURS));
            return String.format("%02d:%02d:%02d.%03d", t.hoursPart(), t.minutesPart(), t.secondsPart(),
                    t.millisPart());
        }
    },

    /**
     * {@code H:MM:SS.cc}, centisecond resolution.
     */
    SUBSTATION(Pattern.compile("(\\d{1,2}):(\\d{1,2}):(\\d{1,2})[.,](\\d{1,3})")) {
        @Override
        public String format(SubtitleTime time, Double frameRate) {
            long centis = Math.min((time.millis() + 5) / 10, MAX_SUBSTATION_CENTIS);
            return String.format("%d:%02d:%02d.%02d", centis / 360_000, centis / 6000 % 60, centis / 100 % 60,
                    centis % 100);
        }
    },

    /**
     * {@code HH:MM:SS}, whole seconds (TMP format). Formatting truncates.
     */
    TMP(Pattern.compile("(\\d{1,2}):(\\d{2}):(\\d{2})")) {
        @Override
        public String format(SubtitleTime time, Double frameRate) {
            long ms = Math.min(time.millis(), MAX_TWO_DIGIT_HOURS);
            SubtitleTime t = SubtitleTime.ofMillis(ms);
            return String.format("%02d:%02d:%02d", t.hoursPart(), t.minutesPart(), t.secondsPart());
        }
    },

    /**
     * Decimal count of deciseconds (MPL2).
     */
    DECISECONDS(Pattern.compile("\\d+")) {
        @Override
        public SubtitleTime parse(String text, Double frameRate) {
            return SubtitleTime.ofMillis(parseCount(text) * 100L);
        }

        @Override
        public String format(SubtitleTime time, Double frameRate) {
            return Long.toString((time.millis() + 50) / 100);
        }
    },

    /**
     * Decimal frame number (MicroDVD). Needs a frame rate.
     */
    FRAMES(Pattern.compile("\\d+")) {
        @Override
        public SubtitleTime parse(String text, Double frameRate) {
            long frames = parseCount(text);
            return SubtitleTime.ofMillis(framesToMillis(frames, requireFrameRate(frameRate)));
        }

        @Override
        public String format(SubtitleTime time, Double frameRate) {
            return Long.toString(millisToFrames(time.millis(), requireFrameRate(frameRate)));
        }

        @Override
        public boolean requiresFrameRate() {
            return true;
        }
    };

    /** 99:59:59.999 */
    static final long MAX_TWO_DIGIT_HOURS = 100L * 3_600_000L - 1;
    /** 9999:59:59.999 */
    static final long MAX_FOUR_DIGIT_HOURS = 10_000L * 3_600_000L - 1;
    /** 9:59:59.99 */
    static final long MAX_SUBSTATION_CENTIS = 10L * 360_000L - 1;

    private final Pattern pattern;

    TimeFormat(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Pattern matching one timestamp of this grammar, usable with {@link Matcher#find()}.
     */
    public Pattern pattern() {
        return pattern;
    }

    public boolean requiresFrameRate() {
        return false;
    }

    public SubtitleTime parse(String text) {
        return parse(text, null);
    }

    public String format(SubtitleTime time) {
        return format(time, null);
    }

    /**
     * Parses a timestamp of this grammar.
     *
     * @throws MalformedTimestampException on grammar mismatch or field overflow
     * @throws MissingFrameRateException   for frame-based grammars without a frame rate
     */
    public SubtitleTime parse(String text, Double frameRate) {
        if (text == null) {
            throw new MalformedTimestampException("null", "no timestamp");
        }
        Matcher matcher = pattern.matcher(text.trim());
        if (!matcher.matches()) {
            throw new MalformedTimestampException(text, "does not match " + name() + " grammar");
        }
        return fromGroups(text, matcher);
    }

    public abstract String format(SubtitleTime time, Double frameRate);

    /**
     * Converts an H/M/S[/fraction] match of this grammar to a time, checking field ranges.
     */
    SubtitleTime fromGroups(String text, Matcher matcher) {
        String hours = matcher.group(1);
        long h = hours == null ? 0 : Long.parseLong(hours);
        int m = Integer.parseInt(matcher.group(2));
        int s = Integer.parseInt(matcher.group(3));
        if (m >= 60) {
            throw new MalformedTimestampException(text, "minutes out of range");
        }
        if (s >= 60) {
            throw new MalformedTimestampException(text, "seconds out of range");
        }
        long ms = 0;
        if (matcher.groupCount() >= 4 && matcher.group(4) != null) {
            String fraction = matcher.group(4);
            ms = Long.parseLong(fraction);
            for (int i = fraction.length(); i < 3; i++) {
                ms *= 10;
            }
        }
        return SubtitleTime.of(h, m, s, ms);
    }

    public static long framesToMillis(long frames, double frameRate) {
        checkFrameRate(frameRate);
        return Math.round(frames * 1000.0 / frameRate);
    }

    public static long millisToFrames(long millis, double frameRate) {
        checkFrameRate(frameRate);
        return Math.round(millis * frameRate / 1000.0);
    }

    private static long parseCount(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (!trimmed.matches("\\d{1,15}")) {
            throw new MalformedTimestampException(String.valueOf(text), "expected a non-negative integer");
        }
        return Long.parseLong(trimmed);
    }

    private static double requireFrameRate(Double frameRate) {
        if (frameRate == null) {
            throw new MissingFrameRateException("frame-based timestamps");
        }
        checkFrameRate(frameRate);
        return frameRate;
    }

    private static void checkFrameRate(double frameRate) {
        if (!(frameRate > 0) || Double.isInfinite(frameRate)) {
            throw new IllegalArgumentException("Frame rate must be positive: " + frameRate);
        }
    }
}
