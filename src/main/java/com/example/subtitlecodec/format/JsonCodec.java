package com.example.subtitlecodec.format;

import com.example.subtitlecodec.model.Alignment;
import com.example.subtitlecodec.model.Color;
import com.example.subtitlecodec.model.EventMargins;
import com.example.subtitlecodec.model.SubtitleDocument;
import com.example.subtitlecodec.model.SubtitleEvent;
import com.example.subtitlecodec.model.SubtitleStyle;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Whole-document JSON dump. Every feature of the model is carried, so writes are lossless.
 */
@Component
public class JsonCodec extends AbstractSubtitleCodec {

    public static final String ID = "json";

    private static final String DIALOGUE = "Dialogue";
    private static final String COMMENT = "Comment";

    private final ObjectReader reader;
    private final ObjectWriter writer;

    public JsonCodec(ObjectMapper objectMapper) {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(indenter);
        printer.indentArraysWith(indenter);
        this.reader = objectMapper.readerFor(JsonDocument.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.writer = objectMapper.writerFor(JsonDocument.class).with(printer);
    }

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of(".json");
    }

    @Override
    public String displayName() {
        return "JSON";
    }

    @Override
    public boolean canRead(String text) {
        String content = text.strip();
        return content.startsWith("{") && content.contains("\"events\"");
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.LOSSLESS;
    }

    // ==================== READ ====================

    @Override
    protected void readInto(String text, SubtitleDocument document, ReadContext context) {
        JsonDocument json;
        try {
            json = reader.readValue(text);
        } catch (JsonProcessingException e) {
            int line = e.getLocation() != null ? e.getLocation().getLineNr() : 0;
            context.malformed(line, "Invalid JSON: " + e.getOriginalMessage(), e);
            return;
        }
        if (json == null) {
            context.malformed(1, "Empty JSON document");
            return;
        }

        if (json.info() != null) {
            document.getInfo().clear();
            document.getInfo().putAll(json.info());
        }
        if (json.styles() != null) {
            json.styles().forEach((name, style) -> {
                try {
                    document.putStyle(name, toStyle(style));
                } catch (IllegalArgumentException e) {
                    context.malformed(0, "Style " + name + ": " + e.getMessage(), e);
                }
            });
        }
        if (json.events() != null) {
            for (int i = 0; i < json.events().size(); i++) {
                JsonDocument.Event event = json.events().get(i);
                if (event == null) {
                    context.malformed(0, "Event " + i + " is null");
                    continue;
                }
                try {
                    document.addEvent(toEvent(event));
                } catch (IllegalArgumentException e) {
                    context.malformed(0, "Event " + i + ": " + e.getMessage(), e);
                }
            }
        }
        if (json.extraSections() != null) {
            json.extraSections().forEach((section, lines) ->
                    document.getExtraSections().put(section, new ArrayList<>(lines)));
        }
        document.setFrameRate(json.frameRate());
    }

    private static SubtitleStyle toStyle(JsonDocument.Style json) {
        SubtitleStyle style = new SubtitleStyle();
        if (json == null) {
            return style;
        }
        apply(json.fontName(), style::setFontName);
        apply(json.fontSize(), style::setFontSize);
        apply(color(json.primaryColor()), style::setPrimaryColor);
        apply(color(json.secondaryColor()), style::setSecondaryColor);
        apply(color(json.outlineColor()), style::setOutlineColor);
        apply(color(json.backColor()), style::setBackColor);
        apply(json.bold(), style::setBold);
        apply(json.italic(), style::setItalic);
        apply(json.underline(), style::setUnderline);
        apply(json.strikeout(), style::setStrikeout);
        apply(json.scaleX(), style::setScaleX);
        apply(json.scaleY(), style::setScaleY);
        apply(json.spacing(), style::setSpacing);
        apply(json.angle(), style::setAngle);
        apply(json.borderStyle(), style::setBorderStyle);
        apply(json.outline(), style::setOutline);
        apply(json.shadow(), style::setShadow);
        if (json.alignment() != null) {
            style.setAlignment(Alignment.fromNumpad(json.alignment()));
        }
        apply(json.marginL(), style::setMarginL);
        apply(json.marginR(), style::setMarginR);
        apply(json.marginV(), style::setMarginV);
        apply(json.alphaLevel(), style::setAlphaLevel);
        apply(json.encoding(), style::setEncoding);
        return style;
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    private static Color color(String value) {
        return value == null ? null : Color.parseStyleColor(value);
    }

    private static SubtitleEvent toEvent(JsonDocument.Event json) {
        return SubtitleEvent.builder()
                .start(json.start())
                .end(json.end())
                .text(json.text())
                .style(json.style())
                .layer(json.layer())
                .name(json.name())
                .margins(new EventMargins(json.marginL(), json.marginR(), json.marginV()))
                .effect(json.effect())
                .comment(COMMENT.equalsIgnoreCase(json.type()))
                .marked(json.marked())
                .language(json.language())
                .build();
    }

    // ==================== WRITE ====================

    @Override
    protected String writeText(SubtitleDocument document, CodecOptions options, ConversionReport report) {
        Map<String, JsonDocument.Style> styles = new LinkedHashMap<>();
        document.getStyles().forEach((name, style) -> styles.put(name, fromStyle(style)));
        List<JsonDocument.Event> events = new ArrayList<>();
        for (int i = 0; i < document.size(); i++) {
            SubtitleEvent event = document.getEvent(i);
            events.add(fromEvent(event, resolveStyleName(document, event, i, report)));
        }
        JsonDocument json = new JsonDocument(new LinkedHashMap<>(document.getInfo()), styles, events,
                document.getFrameRate(), new LinkedHashMap<>(document.getExtraSections()));
        try {
            return writer.writeValueAsString(json) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document as JSON", e);
        }
    }

    private static JsonDocument.Style fromStyle(SubtitleStyle style) {
        return new JsonDocument.Style(style.getFontName(), style.getFontSize(),
                style.getPrimaryColor().toAssStyle(), style.getSecondaryColor().toAssStyle(),
                style.getOutlineColor().toAssStyle(), style.getBackColor().toAssStyle(),
                style.isBold(), style.isItalic(), style.isUnderline(), style.isStrikeout(),
                style.getScaleX(), style.getScaleY(), style.getSpacing(), style.getAngle(),
                style.getBorderStyle(), style.getOutline(), style.getShadow(), style.getAlignment().numpad(),
                style.getMarginL(), style.getMarginR(), style.getMarginV(), style.getAlphaLevel(),
                style.getEncoding());
    }

    private static JsonDocument.Event fromEvent(SubtitleEvent event, String styleName) {
        EventMargins margins = event.getMargins() == null ? EventMargins.NONE : event.getMargins();
        return new JsonDocument.Event(event.getStart().millis(), event.getEnd().millis(), event.getText(),
                styleName, event.getLayer(), event.getName(), margins.left(), margins.right(), margins.vertical(),
                event.getEffect(), event.isComment() ? COMMENT : DIALOGUE, event.isMarked(), event.getLanguage());
    }
}
