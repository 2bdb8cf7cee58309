package com.example.subtitlecodec.model;

import java.util.Locale;

/**
 * 8-bit RGBA color. Alpha follows SubStation convention: 0 is opaque, 255 is transparent.
 */
public record Color(int r, int g, int b, int a) {

    public static final Color WHITE = new Color(255, 255, 255, 0);
    public static final Color BLACK = new Color(0, 0, 0, 0);
    public static final Color RED = new Color(255, 0, 0, 0);

    public Color {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
        checkChannel("a", a);
    }

    public Color(int r, int g, int b) {
        this(r, g, b, 0);
    }

    /**
     * Parses a style color: ASS {@code &HAABBGGRR} or SSA decimal BGR.
     */
    public static Color parseStyleColor(String text) {
        String value = text.trim();
        long packed;
        try {
            if (value.regionMatches(true, 0, "&H", 0, 2)) {
                String hex = value.substring(2);
                if (hex.endsWith("&")) {
                    hex = hex.substring(0, hex.length() - 1);
                }
                packed = Long.parseLong(hex, 16);
            } else {
                packed = Long.parseLong(value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid color: " + text, e);
        }
        return fromPacked(packed);
    }

    /**
     * Parses an override-tag color {@code &HBBGGRR&}; alpha is left opaque.
     */
    public static Color parseTagColor(String text) {
        Color color = parseStyleColor(text);
        return new Color(color.r, color.g, color.b, 0);
    }

    /**
     * Parses a MicroDVD color {@code $BBGGRR}.
     */
    public static Color parseMicroDvdColor(String text) {
        String hex = text.trim();
        if (hex.startsWith("$")) {
            hex = hex.substring(1);
        }
        try {
            return fromPacked(Long.parseLong(hex, 16) & 0xFFFFFFL);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid MicroDVD color: " + text, e);
        }
    }

    private static Color fromPacked(long packed) {
        int r = (int) (packed & 0xFF);
        int g = (int) ((packed >> 8) & 0xFF);
        int b = (int) ((packed >> 16) & 0xFF);
        int a = (int) ((packed >> 24) & 0xFF);
        return new Color(r, g, b, a);
    }

    public String toAssStyle() {
        return String.format(Locale.ROOT, "&H%02X%02X%02X%02X", a, b, g, r);
    }

    public String toSsaStyle() {
        return Integer.toString((b << 16) | (g << 8) | r);
    }

    public String toTag() {
        return String.format(Locale.ROOT, "&H%02X%02X%02X&", b, g, r);
    }

    public String toMicroDvd() {
        return String.format(Locale.ROOT, "$%02X%02X%02X", b, g, r);
    }

    public boolean sameRgb(Color other) {
        return other != null && r == other.r && g == other.g && b == other.b;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Color channel " + name + " out of range 0-255: " + value);
        }
    }
}
