package com.example.subtitlecodec.format;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of a whole document. Times are milliseconds; colors use the ASS
 * {@code &HAABBGGRR} notation; alignment is the numpad value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record JsonDocument(
        @JsonProperty("info") Map<String, String> info,
        @JsonProperty("styles") Map<String, Style> styles,
        @JsonProperty("events") List<Event> events,
        @JsonProperty("frame_rate") Double frameRate,
        @JsonProperty("extra_sections") Map<String, List<String>> extraSections) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Style(
            @JsonProperty("fontname") String fontName,
            @JsonProperty("fontsize") Double fontSize,
            @JsonProperty("primarycolor") String primaryColor,
            @JsonProperty("secondarycolor") String secondaryColor,
            @JsonProperty("outlinecolor") String outlineColor,
            @JsonProperty("backcolor") String backColor,
            @JsonProperty("bold") Boolean bold,
            @JsonProperty("italic") Boolean italic,
            @JsonProperty("underline") Boolean underline,
            @JsonProperty("strikeout") Boolean strikeout,
            @JsonProperty("scalex") Double scaleX,
            @JsonProperty("scaley") Double scaleY,
            @JsonProperty("spacing") Double spacing,
            @JsonProperty("angle") Double angle,
            @JsonProperty("borderstyle") Integer borderStyle,
            @JsonProperty("outline") Double outline,
            @JsonProperty("shadow") Double shadow,
            @JsonProperty("alignment") Integer alignment,
            @JsonProperty("marginl") Integer marginL,
            @JsonProperty("marginr") Integer marginR,
            @JsonProperty("marginv") Integer marginV,
            @JsonProperty("alphalevel") Integer alphaLevel,
            @JsonProperty("encoding") Integer encoding) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Event(
            @JsonProperty("start") long start,
            @JsonProperty("end") long end,
            @JsonProperty("text") String text,
            @JsonProperty("style") String style,
            @JsonProperty("layer") int layer,
            @JsonProperty("name") String name,
            @JsonProperty("marginl") int marginL,
            @JsonProperty("marginr") int marginR,
            @JsonProperty("marginv") int marginV,
            @JsonProperty("effect") String effect,
            @JsonProperty("type") String type,
            @JsonProperty("marked") boolean marked,
            @JsonProperty("language") String language) {
    }
}
