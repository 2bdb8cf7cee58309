package com.example.subtitlecodec.tags;

import com.example.subtitlecodec.model.Position;
import com.example.subtitlecodec.model.StyleAttribute;
import com.example.subtitlecodec.model.StyleOverride;
import com.example.subtitlecodec.model.SubtitleStyle;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Parser and writer for the SubStation override-tag language embedded in event text:
 * {@code {...}} blocks of backslash directives interleaved with plain text.
 * <p>
 * Recognized directives become {@link StyleOverride} deltas; anything else inside a block
 * is kept verbatim as a passthrough run so that writing the runs back loses nothing.
 * SubStation text escapes outside blocks ({@code \N}, {@code \n}, {@code \h}) are text,
 * not directives.
 */
public final class OverrideTagEngine {

    private static final Pattern OVERRIDE_BLOCK = Pattern.compile("\\{[^}]*}");

    private OverrideTagEngine() {
    }

    /**
     * Lazily parses {@code text}. Each iteration rescans from the start.
     * Iterating throws {@link com.example.subtitlecodec.exception.UnterminatedOverrideBlockException}
     * when it reaches a '{' that is never closed.
     */
    public static Iterable<OverrideRun> parse(String text) {
        return parse(text, false);
    }

    /**
     * Like {@link #parse(String)} but an unclosed '{' and the rest of the text are read as literal text.
     */
    public static Iterable<OverrideRun> parseLenient(String text) {
        return parse(text, true);
    }

    public static Iterable<OverrideRun> parse(String text, boolean lenient) {
        String source = Objects.requireNonNull(text, "text");
        return () -> new OverrideTagScanner(source, lenient);
    }

    public static List<OverrideRun> parseToList(String text, boolean lenient) {
        List<OverrideRun> runs = new ArrayList<>();
        parse(text, lenient).forEach(runs::add);
        return runs;
    }

    /**
     * Offset of the first '{' without a matching '}', if any.
     */
    public static OptionalInt findUnterminatedBlock(String text) {
        int i = text.indexOf('{');
        while (i >= 0) {
            int close = text.indexOf('}', i + 1);
            if (close < 0) {
                return OptionalInt.of(i);
            }
            i = text.indexOf('{', close + 1);
        }
        return OptionalInt.empty();
    }

    /**
     * Writes runs back as event text, merging consecutive directives into one block and
     * leaving out changes that repeat the value already set by an earlier directive.
     */
    public static String serialize(Iterable<OverrideRun> runs) {
        StringBuilder out = new StringBuilder();
        List<String> comments = new ArrayList<>();
        List<String> directives = new ArrayList<>();
        Map<StyleAttribute, Object> current = new EnumMap<>(StyleAttribute.class);

        for (OverrideRun run : runs) {
            if (run.isPassthrough()) {
                (run.isComment() ? comments : directives).add(run.text());
                continue;
            }
            for (Map.Entry<StyleAttribute, Object> entry : run.delta().asMap().entrySet()) {
                StyleAttribute attribute = entry.getKey();
                Object value = entry.getValue();
                if (attribute == StyleAttribute.RESET) {
                    directives.add(OverrideDirectives.format(attribute, value));
                    current.clear();
                    continue;
                }
                if (current.containsKey(attribute) && Objects.equals(current.get(attribute), value)) {
                    continue;
                }
                String directive = OverrideDirectives.format(attribute, value);
                if (directive != null) {
                    directives.add(directive);
                    current.put(attribute, value);
                }
            }
            if (!run.text().isEmpty()) {
                flushBlock(out, comments, directives);
                out.append(run.text());
            }
        }
        flushBlock(out, comments, directives);
        return out.toString();
    }

    private static void flushBlock(StringBuilder out, List<String> comments, List<String> directives) {
        if (comments.isEmpty() && directives.isEmpty()) {
            return;
        }
        out.append('{');
        comments.forEach(out::append);
        directives.forEach(out::append);
        out.append('}');
        comments.clear();
        directives.clear();
    }

    /**
     * Splits text into fragments with fully resolved styles. Parsing is lenient.
     * A bare directive such as {@code \b} reverts to {@code base}; {@code \r} switches to the
     * named style, or back to {@code base} when the name is empty or unknown.
     */
    public static List<StyledFragment> resolve(String text, SubtitleStyle base, Map<String, SubtitleStyle> styles) {
        List<StyledFragment> fragments = new ArrayList<>();
        SubtitleStyle current = base;
        Position position = null;
        for (OverrideRun run : parseLenient(text)) {
            if (run.isPassthrough()) {
                continue;
            }
            StyleOverride delta = run.delta();
            if (delta.contains(StyleAttribute.RESET)) {
                String name = delta.get(StyleAttribute.RESET, String.class);
                current = name.isEmpty() ? base : styles.getOrDefault(name, base);
            }
            if (delta.contains(StyleAttribute.POSITION)) {
                position = delta.get(StyleAttribute.POSITION, Position.class);
            }
            current = current.resolveEffective(concrete(delta, base));
            if (!run.text().isEmpty()) {
                fragments.add(new StyledFragment(run.text(), current, position));
            }
        }
        return fragments;
    }

    private static StyleOverride concrete(StyleOverride delta, SubtitleStyle base) {
        StyleOverride result = StyleOverride.empty();
        for (Map.Entry<StyleAttribute, Object> entry : delta.asMap().entrySet()) {
            if (entry.getKey() == StyleAttribute.RESET) {
                continue;
            }
            Object value = entry.getValue() != null ? entry.getValue() : base.get(entry.getKey());
            result = result.with(entry.getKey(), value);
        }
        return result;
    }

    /**
     * Removes every {@code {...}} block.
     */
    public static String stripTags(String text) {
        return OVERRIDE_BLOCK.matcher(text).replaceAll("");
    }

    /**
     * True if some non-empty text is in drawing mode.
     */
    public static boolean containsDrawing(String text) {
        if (text.indexOf('{') < 0) {
            return false;
        }
        boolean drawing = false;
        for (OverrideRun run : parseLenient(text)) {
            StyleOverride delta = run.delta();
            if (delta.contains(StyleAttribute.RESET)) {
                drawing = false;
            }
            if (delta.contains(StyleAttribute.DRAWING)) {
                drawing = Boolean.TRUE.equals(delta.get(StyleAttribute.DRAWING));
            }
            if (drawing && !run.isPassthrough() && !run.text().isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
