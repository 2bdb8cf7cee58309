package com.example.subtitlecodec.model;

/**
 * A point on the subtitle timeline, in whole milliseconds.
 * Each format has its own textual grammar, see {@link TimeFormat}.
 */
public record SubtitleTime(long millis) implements Comparable<SubtitleTime> {

    public static final SubtitleTime ZERO = new SubtitleTime(0);

    public SubtitleTime {
        if (millis < 0) {
            throw new IllegalArgumentException("Time cannot be negative: " + millis);
        }
    }

    public static SubtitleTime ofMillis(long millis) {
        return new SubtitleTime(millis);
    }

    public static SubtitleTime of(long hours, long minutes, long seconds, long millis) {
        return new SubtitleTime(hours * 3_600_000L + minutes * 60_000L + seconds * 1000L + millis);
    }

    public static SubtitleTime parse(String text, TimeFormat format) {
        return format.parse(text);
    }

    public String format(TimeFormat format) {
        return format.format(this);
    }

    /**
     * Moves this time by the given delta, clamping at zero.
     */
    public SubtitleTime shift(long deltaMillis) {
        return new SubtitleTime(Math.max(0, millis + deltaMillis));
    }

    public long hoursPart() {
        return millis / 3_600_000L;
    }

    public int minutesPart() {
        return (int) (millis / 60_000L % 60);
    }

    public int secondsPart() {
        return (int) (millis / 1000L % 60);
    }

    public int millisPart() {
        return (int) (millis % 1000);
    }

    public boolean isBefore(SubtitleTime other) {
        return millis < other.millis;
    }

    @Override
    public int compareTo(SubtitleTime other) {
        return Long.compare(millis, other.millis);
    }

    @Override
    public String toString() {
        return String.format("%d:%02d:%02d.%03d", hoursPart(), minutesPart(), secondsPart(), millisPart());
    }
}
