package com.example.subtitlecodec.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered list of events, a table of named styles and script metadata.
 * <p>
 * Event order is presentation order and is only changed by {@link #sort()}. The style table
 * keeps insertion order and always contains {@value SubtitleStyle#DEFAULT_NAME}. Until the
 * default style is registered explicitly it is a placeholder at the head of the table; the
 * first explicit registration moves it to that position. Events refer
 * to styles by name; a reference that does not resolve is tolerated until write time, where
 * it falls back to the default style.
 * <p>
 * Not thread-safe.
 */
public class SubtitleDocument {

    private static final Logger log = LoggerFactory.getLogger(SubtitleDocument.class);

    public static final String PLAY_RES_X = "PlayResX";
    public static final String PLAY_RES_Y = "PlayResY";

    private final List<SubtitleEvent> events = new ArrayList<>();
    private final LinkedHashMap<String, SubtitleStyle> styles = new LinkedHashMap<>();
    private final LinkedHashMap<String, String> info = new LinkedHashMap<>();
    private final LinkedHashMap<String, List<String>> extraSections = new LinkedHashMap<>();
    private Double frameRate;
    private boolean implicitDefaultStyle = true;

    public SubtitleDocument() {
        styles.put(SubtitleStyle.DEFAULT_NAME, new SubtitleStyle());
        info.put("WrapStyle", "0");
        info.put("ScaledBorderAndShadow", "yes");
        info.put("Collisions", "Normal");
    }

    // ==================== EVENTS ====================

    public List<SubtitleEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public SubtitleEvent getEvent(int index) {
        return events.get(index);
    }

    public void addEvent(SubtitleEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    public void addEvents(Collection<SubtitleEvent> newEvents) {
        newEvents.forEach(this::addEvent);
    }

    public void insertEvent(int index, SubtitleEvent event) {
        events.add(index, Objects.requireNonNull(event, "event"));
    }

    /**
     * Replaces the event at {@code index}, returning the previous one.
     */
    public SubtitleEvent setEvent(int index, SubtitleEvent event) {
        return events.set(index, Objects.requireNonNull(event, "event"));
    }

    public SubtitleEvent removeEvent(int index) {
        return events.remove(index);
    }

    public void clearEvents() {
        events.clear();
    }

    // ==================== STYLES ====================

    public Map<String, SubtitleStyle> getStyles() {
        return Collections.unmodifiableMap(styles);
    }

    public boolean hasStyle(String name) {
        return styles.containsKey(name);
    }

    /**
     * The live style registered under {@code name}, or {@code null}.
     */
    public SubtitleStyle getStyle(String name) {
        return styles.get(name);
    }

    public SubtitleStyle getDefaultStyle() {
        return styles.get(SubtitleStyle.DEFAULT_NAME);
    }

    /**
     * Registers a new style.
     *
     * @throws IllegalStateException if the name is already taken
     */
    public void addStyle(String name, SubtitleStyle style) {
        checkStyleName(name);
        if (styles.containsKey(name)) {
            throw new IllegalStateException("Duplicate style name: " + name);
        }
        styles.put(name, Objects.requireNonNull(style, "style"));
    }

    /**
     * Registers or replaces a style; replacing keeps its position in the table, except for the
     * placeholder default style, which moves to the end.
     */
    public void putStyle(String name, SubtitleStyle style) {
        checkStyleName(name);
        Objects.requireNonNull(style, "style");
        if (SubtitleStyle.DEFAULT_NAME.equals(name) && implicitDefaultStyle) {
            styles.remove(name);
            implicitDefaultStyle = false;
        }
        styles.put(name, style);
    }

    /**
     * Removes a style. Events still referring to it fall back to the default style on write.
     *
     * @throws IllegalArgumentException for the default style
     */
    public SubtitleStyle removeStyle(String name) {
        if (SubtitleStyle.DEFAULT_NAME.equals(name)) {
            throw new IllegalArgumentException("The default style cannot be removed");
        }
        return styles.remove(name);
    }

    /**
     * Renames a style and updates every event referring to it.
     */
    public void renameStyle(String oldName, String newName) {
        checkStyleName(newName);
        if (!styles.containsKey(oldName)) {
            throw new IllegalArgumentException("No style named " + oldName);
        }
        if (SubtitleStyle.DEFAULT_NAME.equals(oldName)) {
            throw new IllegalArgumentException("The default style cannot be renamed");
        }
        if (styles.containsKey(newName)) {
            throw new IllegalStateException("Duplicate style name: " + newName);
        }
        LinkedHashMap<String, SubtitleStyle> reordered = new LinkedHashMap<>();
        styles.forEach((name, style) -> reordered.put(name.equals(oldName) ? newName : name, style));
        styles.clear();
        styles.putAll(reordered);
        for (int i = 0; i < events.size(); i++) {
            SubtitleEvent event = events.get(i);
            if (event.getStyle().equals(oldName)) {
                events.set(i, event.withStyle(newName));
            }
        }
    }

    /**
     * Copies styles from another document.
     *
     * @param overwrite whether styles with an existing name are replaced
     */
    public void importStyles(SubtitleDocument other, boolean overwrite) {
        other.styles.forEach((name, style) -> {
            if (overwrite || !styles.containsKey(name)) {
                styles.put(name, style.copy());
            }
        });
    }

    /**
     * Style name that an event resolves to at write time.
     */
    public String resolveStyleName(SubtitleEvent event) {
        return styles.containsKey(event.getStyle()) ? event.getStyle() : SubtitleStyle.DEFAULT_NAME;
    }

    /**
     * The event's style with its margin override applied.
     */
    public SubtitleStyle effectiveStyle(SubtitleEvent event) {
        return styles.get(resolveStyleName(event)).resolveEffective(event.marginOverride());
    }

    /**
     * Style names referenced by events but missing from the style table, in first-use order.
     */
    public Set<String> unresolvedStyleReferences() {
        Set<String> missing = new LinkedHashSet<>();
        for (SubtitleEvent event : events) {
            if (!styles.containsKey(event.getStyle())) {
                missing.add(event.getStyle());
            }
        }
        return missing;
    }

    private static void checkStyleName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Style name must not be blank");
        }
        if (name.contains(",")) {
            throw new IllegalArgumentException("Style name must not contain a comma: " + name);
        }
    }

    // ==================== METADATA ====================

    /**
     * Script metadata ({@code [Script Info]} entries); unknown keys are preserved as-is.
     */
    public Map<String, String> getInfo() {
        return info;
    }

    /**
     * Raw lines of script sections this library does not interpret, keyed by section header.
     */
    public Map<String, List<String>> getExtraSections() {
        return extraSections;
    }

    public Optional<Integer> getVideoWidth() {
        return intInfo(PLAY_RES_X);
    }

    public Optional<Integer> getVideoHeight() {
        return intInfo(PLAY_RES_Y);
    }

    public void setVideoResolution(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Resolution must be positive: " + width + "x" + height);
        }
        info.put(PLAY_RES_X, Integer.toString(width));
        info.put(PLAY_RES_Y, Integer.toString(height));
    }

    private Optional<Integer> intInfo(String key) {
        String value = info.get(key);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {}: {}", key, value);
            return Optional.empty();
        }
    }

    /**
     * Frame rate declared by a frame-based source file, or {@code null}.
     */
    public Double getFrameRate() {
        return frameRate;
    }

    public void setFrameRate(Double frameRate) {
        this.frameRate = frameRate;
    }

    // ==================== RETIMING ====================

    public void shift(long deltaMillis) {
        events.replaceAll(event -> event.shift(deltaMillis));
    }

    /**
     * Shifts by a whole number of frames at the given frame rate.
     */
    public void shiftFrames(int frames, double frameRate) {
        shift(TimeFormat.framesToMillis(Math.abs(frames), frameRate) * Integer.signum(frames));
    }

    public void scale(double factor, SubtitleTime pivot) {
        events.replaceAll(event -> event.scale(factor, pivot));
    }

    /**
     * Retimes subtitles made for video at {@code inFps} to video at {@code outFps}.
     */
    public void transformFrameRate(double inFps, double outFps) {
        if (!(inFps > 0) || !(outFps > 0)) {
            throw new IllegalArgumentException("Frame rates must be positive: " + inFps + ", " + outFps);
        }
        scale(inFps / outFps, SubtitleTime.ZERO);
    }

    /**
     * Sorts events by (start, end). The sort is stable.
     */
    public void sort() {
        events.sort(Comparator.comparing(SubtitleEvent::getStart).thenComparing(SubtitleEvent::getEnd));
    }

    /**
     * Drops comments, events with empty text and drawings.
     */
    public int removeMiscellaneousEvents() {
        int before = events.size();
        events.removeIf(event -> event.isComment() || event.getText().isEmpty() || event.isDrawing());
        return before - events.size();
    }

    // ==================== COPY / MERGE ====================

    /**
     * Deep copy: styles are duplicated so the copy never aliases this document's styles.
     */
    public SubtitleDocument copy() {
        SubtitleDocument copy = new SubtitleDocument();
        copy.info.clear();
        copy.info.putAll(info);
        copy.styles.clear();
        styles.forEach((name, style) -> copy.styles.put(name, style.copy()));
        extraSections.forEach((name, lines) -> copy.extraSections.put(name, new ArrayList<>(lines)));
        copy.events.addAll(events);
        copy.frameRate = frameRate;
        copy.implicitDefaultStyle = implicitDefaultStyle;
        return copy;
    }

    /**
     * Concatenates documents. Metadata comes from the first document. Styles that are equal
     * attribute-wise are shared; a name clash between different styles is resolved by
     * re-keying the later style and its events.
     */
    public static SubtitleDocument merge(SubtitleDocument... documents) {
        SubtitleDocument merged = new SubtitleDocument();
        if (documents.length == 0) {
            return merged;
        }
        merged.info.clear();
        merged.info.putAll(documents[0].info);
        merged.frameRate = documents[0].frameRate;
        merged.implicitDefaultStyle = documents[0].implicitDefaultStyle;
        // the first document's table always holds the default style
        merged.styles.clear();
        boolean first = true;
        for (SubtitleDocument document : documents) {
            Map<String, String> renames = new HashMap<>();
            for (Map.Entry<String, SubtitleStyle> entry : document.styles.entrySet()) {
                String name = entry.getKey();
                SubtitleStyle style = entry.getValue();
                SubtitleStyle existing = merged.styles.get(name);
                if (existing == null || first) {
                    merged.styles.put(name, style.copy());
                } else if (!existing.equals(style)) {
                    String newName = merged.uniqueStyleName(name);
                    merged.styles.put(newName, style.copy());
                    renames.put(name, newName);
                }
            }
            for (SubtitleEvent event : document.events) {
                String rename = renames.get(event.getStyle());
                merged.events.add(rename == null ? event : event.withStyle(rename));
            }
            document.extraSections.forEach((name, lines) ->
                    merged.extraSections.computeIfAbsent(name, key -> new ArrayList<>(lines)));
            first = false;
        }
        log.debug("Merged {} documents into {} events and {} styles",
                documents.length, merged.events.size(), merged.styles.size());
        return merged;
    }

    private String uniqueStyleName(String base) {
        for (int i = 2; ; i++) {
            String candidate = base + " (" + i + ")";
            if (!styles.containsKey(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * Equality of events (in order), style table (names, order and attributes), script info,
     * uninterpreted sections and frame rate.
     */
    public boolean equalsStructurally(SubtitleDocument other) {
        if (other == null) {
            return false;
        }
        return events.equals(other.events)
                && new ArrayList<>(styles.entrySet()).equals(new ArrayList<>(other.styles.entrySet()))
                && info.equals(other.info)
                && extraSections.equals(other.extraSections)
                && Objects.equals(frameRate, other.frameRate);
    }

    @Override
    public String toString() {
        return String.format("SubtitleDocument[%d events, %d styles]", events.size(), styles.size());
    }
}
