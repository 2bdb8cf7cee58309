package com.example.subtitlecodec.tags;

import com.example.subtitlecodec.model.Alignment;
import com.example.subtitlecodec.model.Color;
import com.example.subtitlecodec.model.Position;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.StyleOverride;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The recognized SubStation override directives and their textual form.
 */
final class OverrideDirectives {

    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";

    private static final Pattern FLAG = Pattern.compile("([bius])(\\d*)");
    private static final Pattern DRAWING = Pattern.compile("p(\\d+)");
    private static final Pattern RESET = Pattern.compile("r(.*)", Pattern.DOTALL);
    private static final Pattern FONT_NAME = Pattern.compile("fn(.*)", Pattern.DOTALL);
    private static final Pattern FONT_SIZE = Pattern.compile("fs" + NUMBER + "?");
    private static final Pattern SCALE_X = Pattern.compile("fscx" + NUMBER + "?");
    private static final Pattern SCALE_Y = Pattern.compile("fscy" + NUMBER + "?");
    private static final Pattern SPACING = Pattern.compile("fsp" + NUMBER + "?");
    private static final Pattern ANGLE = Pattern.compile("frz?" + NUMBER + "?");
    private static final Pattern OUTLINE = Pattern.compile("bord" + NUMBER + "?");
    private static final Pattern SHADOW = Pattern.compile("shad" + NUMBER + "?");
    private static final Pattern COLOR = Pattern.compile("([1234]?)c(&H[0-9A-Fa-f]{1,8}&?)?");
    private static final Pattern ALIGNMENT_NUMPAD = Pattern.compile("an([1-9])");
    private static final Pattern ALIGNMENT_LEGACY = Pattern.compile("a(\\d+)");
    private static final Pattern POSITION = Pattern.compile("pos\\(\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*\\)");

    private OverrideDirectives() {
    }

    /**
     * Interprets one directive (without its leading backslash).
     *
     * @return the attribute change, or {@code null} if the directive is not recognized
     */
    static StyleOverride parse(String body) {
        Matcher m;
        if ((m = FLAG.matcher(body)).matches()) {
            StyleAttribute attribute = switch (m.group(1)) {
                case "b" -> StyleAttribute.BOLD;
                case "i" -> StyleAttribute.ITALIC;
                case "u" -> StyleAttribute.UNDERLINE;
                default -> StyleAttribute.STRIKEOUT;
            };
            Boolean value = m.group(2).isEmpty() ? null : nonZero(m.group(2));
            return StyleOverride.of(attribute, value);
        }
        if ((m = DRAWING.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.DRAWING, nonZero(m.group(1)));
        }
        if ((m = POSITION.matcher(body)).matches()) {
            Position position = new Position(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)));
            return StyleOverride.of(StyleAttribute.POSITION, position);
        }
        if ((m = FONT_NAME.matcher(body)).matches()) {
            String name = m.group(1).trim();
            return StyleOverride.of(StyleAttribute.FONT_NAME, name.isEmpty() ? null : name);
        }
        if ((m = SCALE_X.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.SCALE_X, parseNumber(m.group(1)));
        }
        if ((m = SCALE_Y.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.SCALE_Y, parseNumber(m.group(1)));
        }
        if ((m = SPACING.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.SPACING, parseNumber(m.group(1)));
        }
        if ((m = FONT_SIZE.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.FONT_SIZE, parseNumber(m.group(1)));
        }
        if ((m = ANGLE.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.ANGLE, parseNumber(m.group(1)));
        }
        if ((m = OUTLINE.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.OUTLINE, parseNumber(m.group(1)));
        }
        if ((m = SHADOW.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.SHADOW, parseNumber(m.group(1)));
        }
        if ((m = COLOR.matcher(body)).matches()) {
            StyleAttribute attribute = switch (m.group(1)) {
                case "2" -> StyleAttribute.SECONDARY_COLOR;
                case "3" -> StyleAttribute.OUTLINE_COLOR;
                case "4" -> StyleAttribute.BACK_COLOR;
                default -> StyleAttribute.PRIMARY_COLOR;
            };
            Color color = m.group(2) == null ? null : Color.parseTagColor(m.group(2));
            return StyleOverride.of(attribute, color);
        }
        if ((m = ALIGNMENT_NUMPAD.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.ALIGNMENT, Alignment.fromNumpad(Integer.parseInt(m.group(1))));
        }
        if ((m = ALIGNMENT_LEGACY.matcher(body)).matches()) {
            try {
                return StyleOverride.of(StyleAttribute.ALIGNMENT, Alignment.fromSsa(Integer.parseInt(m.group(1))));
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        if ((m = RESET.matcher(body)).matches()) {
            return StyleOverride.of(StyleAttribute.RESET, m.group(1).trim());
        }
        return null;
    }

    /**
     * Textual form of one attribute change, or {@code null} for attributes that have no tag.
     */
    static String format(StyleAttribute attribute, Object value) {
        return switch (attribute) {
            case RESET -> "\\r" + value;
            case BOLD -> "\\b" + flag(value);
            case ITALIC -> "\\i" + flag(value);
            case UNDERLINE -> "\\u" + flag(value);
            case STRIKEOUT -> "\\s" + flag(value);
            case DRAWING -> Boolean.TRUE.equals(value) ? "\\p1" : "\\p0";
            case FONT_NAME -> "\\fn" + (value == null ? "" : value);
            case FONT_SIZE -> "\\fs" + number(value);
            case SCALE_X -> "\\fscx" + number(value);
            case SCALE_Y -> "\\fscy" + number(value);
            case SPACING -> "\\fsp" + number(value);
            case ANGLE -> "\\frz" + number(value);
            case OUTLINE -> "\\bord" + number(value);
            case SHADOW -> "\\shad" + number(value);
            case PRIMARY_COLOR -> "\\c" + color(value);
            case SECONDARY_COLOR -> "\\2c" + color(value);
            case OUTLINE_COLOR -> "\\3c" + color(value);
            case BACK_COLOR -> "\\4c" + color(value);
            case ALIGNMENT -> value == null ? null : "\\an" + ((Alignment) value).numpad();
            case POSITION -> value == null ? null
                    : "\\pos(" + number(((Position) value).x()) + "," + number(((Position) value).y()) + ")";
            case MARGIN_L, MARGIN_R, MARGIN_V -> null;
        };
    }

    private static boolean nonZero(String digits) {
        return digits.chars().anyMatch(c -> c != '0');
    }

    private static Double parseNumber(String text) {
        return text == null ? null : Double.valueOf(text);
    }

    private static String flag(Object value) {
        if (value == null) {
            return "";
        }
        return Boolean.TRUE.equals(value) ? "1" : "0";
    }

    private static String color(Object value) {
        return value == null ? "" : ((Color) value).toTag();
    }

    static String number(Object value) {
        if (value == null) {
            return "";
        }
        double d = ((Number) value).doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
