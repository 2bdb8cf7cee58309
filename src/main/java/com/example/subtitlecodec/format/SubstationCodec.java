package com.example.subtitlecodec.format;

import com.example.subtitlecodec.exception.MalformedTimestampException;
import com.example.subtitlecodec.model.Alignment;
import com.example.subtitlecodec.model.Color;
import com.example.subtitlecodec.model.EventMargins;
import com.example.subtitlecodec.model.LineBreaks;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleStyle;
import com.example.subtitlecodec.model.TimeFormat;
import com.example.subtitlecodec.tags.OverrideTagEngine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SubStation Alpha scripts: {@code [Script Info]}, a styles section and {@code [Events]},
 * each record a comma-separated field line described by the section's {@code Format:} line.
 * Subclasses pick the v4 (SSA) or v4+ (ASS) dialect.
 */
abstract class SubstationCodec extends AbstractSubtitleCodec {

    static final String SCRIPT_INFO = "[Script Info]";
    static final String EVENTS = "[Events]";
    static final String SCRIPT_TYPE = "ScriptType";

    private static final Pattern ADVANCED_SCRIPT_TYPE = Pattern.compile("(?im)^\\s*ScriptType:\\s*v4\\.00\\+");

    private static final List<String> ASS_STYLE_FIELDS = List.of("Name", "Fontname", "Fontsize",
            "PrimaryColour", "SecondaryColour", "OutlineColour", "BackColour", "Bold", "Italic", "Underline",
            "StrikeOut", "ScaleX", "ScaleY", "Spacing", "Angle", "BorderStyle", "Outline", "Shadow", "Alignment",
            "MarginL", "MarginR", "MarginV", "Encoding");
    private static final List<String> SSA_STYLE_FIELDS = List.of("Name", "Fontname", "Fontsize",
            "PrimaryColour", "SecondaryColour", "TertiaryColour", "BackColour", "Bold", "Italic", "BorderStyle",
            "Outline", "Shadow", "Alignment", "MarginL", "MarginR", "MarginV", "AlphaLevel", "Encoding");
    private static final List<String> ASS_EVENT_FIELDS = List.of("Layer", "Start", "End", "Style", "Name",
            "MarginL", "MarginR", "MarginV", "Effect", "Text");
    private static final List<String> SSA_EVENT_FIELDS = List.of("Marked", "Start", "End", "Style", "Name",
            "MarginL", "MarginR", "MarginV", "Effect", "Text");

    /** Style attributes a v4 style line can hold. */
    private static final Set<StyleAttribute> SSA_STYLE_ATTRIBUTES = EnumSet.complementOf(EnumSet.of(
            StyleAttribute.UNDERLINE, StyleAttribute.STRIKEOUT, StyleAttribute.SCALE_X, StyleAttribute.SCALE_Y,
            StyleAttribute.SPACING, StyleAttribute.ANGLE));

    private final boolean advanced;

    protected SubstationCodec(boolean advanced) {
        this.advanced = advanced;
    }

    static boolean looksAdvanced(String text) {
        return text.contains("[V4+ Styles]") || ADVANCED_SCRIPT_TYPE.matcher(text).find();
    }

    static boolean looksLikeScript(String text) {
        return text.contains(SCRIPT_INFO) || text.contains("[V4 Styles]") || text.contains("[V4+ Styles]");
    }

    // ==================== READ ====================

    @Override
    protected void readInto(String text, SubtitleDocument document, ReadContext context) {
        String[] lines = text.split("\n", -1);
        String section = null;
        boolean advancedStyles = advanced;
        List<String> styleFormat = null;
        List<String> eventFormat = null;
        boolean infoCleared = false;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i];
            String trimmed = line.strip();

            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                section = trimmed;
                String key = section.toLowerCase(Locale.ROOT);
                if (key.equals("[v4+ styles]")) {
                    advancedStyles = true;
                } else if (key.equals("[v4 styles]")) {
                    advancedStyles = false;
                } else if (!key.equals("[script info]") && !key.equals("[events]")) {
                    document.getExtraSections().putIfAbsent(section, new ArrayList<>());
                }
                continue;
            }
            if (trimmed.isEmpty()) {
                continue;
            }
            if (section == null) {
                context.malformed(lineNumber, "Content before the first section header");
                continue;
            }

            switch (section.toLowerCase(Locale.ROOT)) {
                case "[script info]" -> {
                    if (!infoCleared) {
                        document.getInfo().clear();
                        infoCleared = true;
                    }
                    readInfoLine(trimmed, document);
                }
                case "[v4+ styles]", "[v4 styles]" -> {
                    if (startsWithKey(trimmed, "Format")) {
                        styleFormat = parseFormat(trimmed);
                    } else if (startsWithKey(trimmed, "Style")) {
                        List<String> format = styleFormat != null ? styleFormat
                                : advancedStyles ? ASS_STYLE_FIELDS : SSA_STYLE_FIELDS;
                        readStyle(valueOf(trimmed), format, advancedStyles, lineNumber, document, context);
                    }
                }
                case "[events]" -> {
                    if (startsWithKey(trimmed, "Format")) {
                        eventFormat = parseFormat(trimmed);
                    } else if (startsWithKey(trimmed, "Dialogue") || startsWithKey(trimmed, "Comment")) {
                        List<String> format = eventFormat != null ? eventFormat
                                : advanced ? ASS_EVENT_FIELDS : SSA_EVENT_FIELDS;
                        boolean comment = startsWithKey(trimmed, "Comment");
                        readEvent(valueOf(line.stripLeading()), format, comment, lineNumber, document, context);
                    } else {
                        log.debug("Ignoring event line {}: {}", lineNumber, trimmed);
                    }
                }
                default -> document.getExtraSections().get(section).add(line);
            }
        }
    }

    private void readInfoLine(String line, SubtitleDocument document) {
        if (line.startsWith(";") || line.startsWith("!:")) {
            return;
        }
        int colon = line.indexOf(':');
        if (colon < 0) {
            log.debug("Ignoring script info line without a key: {}", line);
            return;
        }
        String key = line.substring(0, colon).strip();
        String value = line.substring(colon + 1).strip();
        // the script type follows from the codec used to write
        if (!key.equalsIgnoreCase(SCRIPT_TYPE)) {
            document.getInfo().put(key, value);
        }
    }

    private void readStyle(String value, List<String> format, boolean advancedStyles, int lineNumber,
                           SubtitleDocument document, ReadContext context) {
        String[] fields = splitFields(value, format.size());
        if (fields.length < format.size()) {
            context.malformed(lineNumber, "Style line has " + fields.length + " fields, expected " + format.size());
            return;
        }
        String name = null;
        SubtitleStyle style = new SubtitleStyle();
        for (int f = 0; f < format.size(); f++) {
            String field = format.get(f);
            String raw = fields[f].strip();
            try {
                switch (field.toLowerCase(Locale.ROOT)) {
                    case "name" -> name = raw;
                    case "fontname" -> style.setFontName(raw);
                    case "fontsize" -> style.setFontSize(Double.parseDouble(raw));
                    case "primarycolour" -> style.setPrimaryColor(Color.parseStyleColor(raw));
                    case "secondarycolour" -> style.setSecondaryColor(Color.parseStyleColor(raw));
                    case "outlinecolour", "tertiarycolour" -> style.setOutlineColor(Color.parseStyleColor(raw));
                    case "backcolour" -> style.setBackColor(Color.parseStyleColor(raw));
                    case "bold" -> style.setBold(flag(raw));
                    case "italic" -> style.setItalic(flag(raw));
                    case "underline" -> style.setUnderline(flag(raw));
                    case "strikeout" -> style.setStrikeout(flag(raw));
                    case "scalex" -> style.setScaleX(Double.parseDouble(raw));
                    case "scaley" -> style.setScaleY(Double.parseDouble(raw));
                    case "spacing" -> style.setSpacing(Double.parseDouble(raw));
                    case "angle" -> style.setAngle(Double.parseDouble(raw));
                    case "borderstyle" -> style.setBorderStyle(Integer.parseInt(raw));
                    case "outline" -> style.setOutline(Double.parseDouble(raw));
                    case "shadow" -> style.setShadow(Double.parseDouble(raw));
                    case "alignment" -> style.setAlignment(advancedStyles
                            ? Alignment.fromNumpad(Integer.parseInt(raw))
                            : Alignment.fromSsa(Integer.parseInt(raw)));
                    case "marginl" -> style.setMarginL(Integer.parseInt(raw));
                    case "marginr" -> style.setMarginR(Integer.parseInt(raw));
                    case "marginv" -> style.setMarginV(Integer.parseInt(raw));
                    case "alphalevel" -> style.setAlphaLevel(Integer.parseInt(raw));
                    case "encoding" -> style.setEncoding(Integer.parseInt(raw));
                    default -> log.debug("Ignoring unknown style field {}", field);
                }
            } catch (IllegalArgumentException e) {
                context.malformed(lineNumber, "Invalid value '" + raw + "' for style field " + field, e);
                return;
            }
        }
        if (name == null || name.isEmpty()) {
            context.malformed(lineNumber, "Style without a name");
            return;
        }
        // "*Default" is how some SSA editors mark the default style
        if (name.startsWith("*")) {
            name = name.substring(1);
        }
        try {
            document.putStyle(name, style);
        } catch (IllegalArgumentException e) {
            context.malformed(lineNumber, e.getMessage(), e);
        }
    }

    private void readEvent(String value, List<String> format, boolean comment, int lineNumber,
                           SubtitleDocument document, ReadContext context) {
        String[] fields = splitFields(value, format.size());
        if (fields.length < format.size()) {
            context.malformed(lineNumber, "Event line has " + fields.length + " fields, expected " + format.size());
            return;
        }
        SubtitleEvent.Builder builder = SubtitleEvent.builder().comment(comment);
        Map<String, Integer> margins = new HashMap<>();
        String text = "";
        try {
            for (int f = 0; f < format.size(); f++) {
                String field = format.get(f);
                String raw = fields[f];
                switch (field.toLowerCase(Locale.ROOT)) {
                    case "layer" -> builder.layer(Integer.parseInt(raw.strip()));
                    case "marked" -> builder.marked(raw.strip().endsWith("1"));
                    case "start" -> builder.start(TimeFormat.SUBSTATION.parse(raw));
                    case "end" -> builder.end(TimeFormat.SUBSTATION.parse(raw));
                    case "style" -> {
                        String style = raw.strip();
                        builder.style(style.startsWith("*") ? style.substring(1) : style);
                    }
                    case "name", "actor" -> builder.name(raw.strip());
                    case "marginl", "marginr", "marginv" -> margins.put(field.toLowerCase(Locale.ROOT),
                            raw.isBlank() ? 0 : Integer.parseInt(raw.strip()));
                    case "effect" -> builder.effect(raw.strip());
                    case "text" -> text = raw;
                    default -> log.debug("Ignoring unknown event field {}", field);
                }
            }
        } catch (MalformedTimestampException | NumberFormatException e) {
            context.malformed(lineNumber, e.getMessage(), e);
            return;
        }
        builder.margins(new EventMargins(margins.getOrDefault("marginl", 0), margins.getOrDefault("marginr", 0),
                margins.getOrDefault("marginv", 0)));
        builder.text(LineBreaks.parse(text, LineBreaks.SUBSTATION_HARD_BREAK));
        OverrideTagEngine.findUnterminatedBlock(text).ifPresent(offset ->
                context.warn(ConversionWarning.Kind.UNTERMINATED_OVERRIDE_BLOCK, lineNumber,
                        "Override block opened at column " + (offset + 1) + " is never closed"));
        try {
            document.addEvent(builder.build());
        } catch (IllegalArgumentException e) {
            context.malformed(lineNumber, e.getMessage(), e);
        }
    }

    private static boolean startsWithKey(String line, String key) {
        return line.regionMatches(true, 0, key + ":", 0, key.length() + 1);
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1);
    }

    private static List<String> parseFormat(String line) {
        return Arrays.stream(valueOf(line).split(","))
                .map(String::strip)
                .toList();
    }

    /**
     * Splits on the first {@code count - 1} commas; the last field keeps any further commas.
     */
    private static String[] splitFields(String value, int count) {
        String[] fields = value.split(",", count);
        if (fields.length > 0) {
            fields[0] = fields[0].stripLeading();
        }
        return fields;
    }

    private static boolean flag(String raw) {
        return Integer.parseInt(raw) != 0;
    }

    // ==================== WRITE ====================

    @Override
    protected String writeText(SubtitleDocument document, CodecOptions options, ConversionReport report) {
        StringBuilder out = new StringBuilder();
        out.append(SCRIPT_INFO).append('\n');
        out.append("; Script generated by subtitle-codec\n");
        out.append(SCRIPT_TYPE).append(": ").append(advanced ? "v4.00+" : "v4.00").append('\n');
        document.getInfo().forEach((key, value) -> {
            if (!key.equalsIgnoreCase(SCRIPT_TYPE)) {
                out.append(key).append(": ").append(value).append('\n');
            }
        });

        out.append('\n').append(advanced ? "[V4+ Styles]" : "[V4 Styles]").append('\n');
        out.append("Format: ").append(String.join(", ", advanced ? ASS_STYLE_FIELDS : SSA_STYLE_FIELDS)).append('\n');
        document.getStyles().forEach((name, style) ->
                out.append("Style: ").append(formatStyle(name, style)).append('\n'));

        out.append('\n').append(EVENTS).append('\n');
        out.append("Format: ").append(String.join(", ", advanced ? ASS_EVENT_FIELDS : SSA_EVENT_FIELDS)).append('\n');
        Set<String> checkedStyles = new HashSet<>();
        List<SubtitleEvent> events = document.getEvents();
        for (int i = 0; i < events.size(); i++) {
            SubtitleEvent event = events.get(i);
            String styleName = resolveStyleName(document, event, i, report);
            recordEventFeatures(event, i, true, report);
            if (!advanced && checkedStyles.add(styleName)) {
                recordStyleFormatting(styleName, document.getStyle(styleName), SSA_STYLE_ATTRIBUTES, report);
            }
            out.append(event.isComment() ? "Comment: " : "Dialogue: ")
                    .append(formatEvent(event, styleName))
                    .append('\n');
        }

        document.getExtraSections().forEach((section, lines) -> {
            out.append('\n').append(section).append('\n');
            lines.forEach(line -> out.append(line).append('\n'));
        });
        return out.toString();
    }

    private String formatStyle(String name, SubtitleStyle style) {
        List<String> fields = new ArrayList<>();
        fields.add(name);
        fields.add(style.getFontName());
        fields.add(formatNumber(style.getFontSize()));
        fields.add(color(style.getPrimaryColor()));
        fields.add(color(style.getSecondaryColor()));
        fields.add(color(style.getOutlineColor()));
        fields.add(color(style.getBackColor()));
        fields.add(flag(style.isBold()));
        fields.add(flag(style.isItalic()));
        if (advanced) {
            fields.add(flag(style.isUnderline()));
            fields.add(flag(style.isStrikeout()));
            fields.add(formatNumber(style.getScaleX()));
            fields.add(formatNumber(style.getScaleY()));
            fields.add(formatNumber(style.getSpacing()));
            fields.add(formatNumber(style.getAngle()));
        }
        fields.add(Integer.toString(style.getBorderStyle()));
        fields.add(formatNumber(style.getOutline()));
        fields.add(formatNumber(style.getShadow()));
        fields.add(Integer.toString(advanced ? style.getAlignment().numpad() : style.getAlignment().ssa()));
        fields.add(Integer.toString(style.getMarginL()));
        fields.add(Integer.toString(style.getMarginR()));
        fields.add(Integer.toString(style.getMarginV()));
        if (!advanced) {
            fields.add(Integer.toString(style.getAlphaLevel()));
        }
        fields.add(Integer.toString(style.getEncoding()));
        return String.join(",", fields);
    }

    private String formatEvent(SubtitleEvent event, String styleName) {
        EventMargins margins = event.getMargins() == null ? EventMargins.NONE : event.getMargins();
        List<String> fields = new ArrayList<>();
        fields.add(advanced ? Integer.toString(event.getLayer()) : "Marked=" + (event.isMarked() ? 1 : 0));
        fields.add(TimeFormat.SUBSTATION.format(event.getStart()));
        fields.add(TimeFormat.SUBSTATION.format(event.getEnd()));
        fields.add(styleName);
        fields.add(event.getName());
        fields.add(Integer.toString(margins.left()));
        fields.add(Integer.toString(margins.right()));
        fields.add(Integer.toString(margins.vertical()));
        fields.add(event.getEffect());
        fields.add(event.textWithBreaks(LineBreaks.SUBSTATION_HARD_BREAK));
        return String.join(",", fields);
    }

    private String color(Color color) {
        return advanced ? color.toAssStyle() : color.toSsaStyle();
    }

    private static String flag(boolean value) {
        return value ? "-1" : "0";
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
