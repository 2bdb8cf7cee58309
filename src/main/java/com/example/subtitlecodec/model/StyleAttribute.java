package com.example.subtitlecodec.model;

/**
 * Attributes that a style defines and that override tags or event fields may change locally.
 * Declaration order is the order in which a combined override is applied and serialized.
 */
public enum StyleAttribute {
    /** Reset to a named style, or to the event's own style for an empty name. */
    RESET(String.class),
    BOLD(Boolean.class),
    ITALIC(Boolean.class),
    UNDERLINE(Boolean.class),
    STRIKEOUT(Boolean.class),
    DRAWING(Boolean.class),
    FONT_NAME(String.class),
    FONT_SIZE(Double.class),
    SCALE_X(Double.class),
    SCALE_Y(Double.class),
    SPACING(Double.class),
    ANGLE(Double.class),
    OUTLINE(Double.class),
    SHADOW(Double.class),
    PRIMARY_COLOR(Color.class),
    SECONDARY_COLOR(Color.class),
    OUTLINE_COLOR(Color.class),
    BACK_COLOR(Color.class),
    ALIGNMENT(Alignment.class),
    POSITION(Position.class),
    MARGIN_L(Integer.class),
    MARGIN_R(Integer.class),
    MARGIN_V(Integer.class);

    private final Class<?> type;

    StyleAttribute(Class<?> type) {
        this.type = type;
    }

    public Class<?> type() {
        return type;
    }

    public boolean isColor() {
        return type == Color.class;
    }

    public boolean isFontMetric() {
        return this == FONT_NAME || this == FONT_SIZE || this == SCALE_X || this == SCALE_Y
                || this == SPACING || this == ANGLE || this == OUTLINE || this == SHADOW;
    }
}
