package com.example.subtitlecodec.model;

import java.util.Map;
import java.util.Objects;

/**
 * A named bundle of formatting attributes.
 * Styles are mutable and shared: events refer to them by name through their document,
 * so changing a style in place restyles every event that uses it.
 * Equality is attribute-wise.
 */
public class SubtitleStyle {

    public static final String DEFAULT_NAME = "Default";

    private String fontName = "Arial";
    private double fontSize = 20.0;
    private Color primaryColor = Color.WHITE;
    private Color secondaryColor = Color.RED;
    private Color outlineColor = Color.BLACK;
    private Color backColor = Color.BLACK;
    private boolean bold;
    private boolean italic;
    private boolean underline;
    private boolean strikeout;
    private boolean drawing;
    private double scaleX = 100.0;
    private double scaleY = 100.0;
    private double spacing;
    private double angle;
    private int borderStyle = 1;
    private double outline = 2.0;
    private double shadow = 2.0;
    private Alignment alignment = Alignment.BOTTOM_CENTER;
    private int marginL = 10;
    private int marginR = 10;
    private int marginV = 10;
    private int alphaLevel;
    private int encoding = 1;

    public SubtitleStyle() {
    }

    public SubtitleStyle copy() {
        SubtitleStyle copy = new SubtitleStyle();
        copy.fontName = fontName;
        copy.fontSize = fontSize;
        copy.primaryColor = primaryColor;
        copy.secondaryColor = secondaryColor;
        copy.outlineColor = outlineColor;
        copy.backColor = backColor;
        copy.bold = bold;
        copy.italic = italic;
        copy.underline = underline;
        copy.strikeout = strikeout;
        copy.drawing = drawing;
        copy.scaleX = scaleX;
        copy.scaleY = scaleY;
        copy.spacing = spacing;
        copy.angle = angle;
        copy.borderStyle = borderStyle;
        copy.outline = outline;
        copy.shadow = shadow;
        copy.alignment = alignment;
        copy.marginL = marginL;
        copy.marginR = marginR;
        copy.marginV = marginV;
        copy.alphaLevel = alphaLevel;
        copy.encoding = encoding;
        return copy;
    }

    /**
     * Merges local overrides onto this style without mutating either.
     * Attributes mapped to {@code null} keep this style's value; {@link StyleAttribute#RESET}
     * and {@link StyleAttribute#POSITION} are not style attributes and are ignored here
     * (resets are resolved by the override-tag engine, which knows the style table).
     */
    public SubtitleStyle resolveEffective(StyleOverride overrides) {
        SubtitleStyle effective = copy();
        for (Map.Entry<StyleAttribute, Object> entry : overrides.asMap().entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (entry.getKey()) {
                case BOLD -> effective.bold = (Boolean) value;
                case ITALIC -> effective.italic = (Boolean) value;
                case UNDERLINE -> effective.underline = (Boolean) value;
                case STRIKEOUT -> effective.strikeout = (Boolean) value;
                case DRAWING -> effective.drawing = (Boolean) value;
                case FONT_NAME -> effective.fontName = (String) value;
                case FONT_SIZE -> effective.fontSize = (Double) value;
                case SCALE_X -> effective.scaleX = (Double) value;
                case SCALE_Y -> effective.scaleY = (Double) value;
                case SPACING -> effective.spacing = (Double) value;
                case ANGLE -> effective.angle = (Double) value;
                case OUTLINE -> effective.outline = (Double) value;
                case SHADOW -> effective.shadow = (Double) value;
                case PRIMARY_COLOR -> effective.primaryColor = (Color) value;
                case SECONDARY_COLOR -> effective.secondaryColor = (Color) value;
                case OUTLINE_COLOR -> effective.outlineColor = (Color) value;
                case BACK_COLOR -> effective.backColor = (Color) value;
                case ALIGNMENT -> effective.alignment = (Alignment) value;
                case MARGIN_L -> effective.marginL = (Integer) value;
                case MARGIN_R -> effective.marginR = (Integer) value;
                case MARGIN_V -> effective.marginV = (Integer) value;
                case RESET, POSITION -> {
                }
            }
        }
        return effective;
    }

    /**
     * Current value of an attribute; {@code null} for attributes a style does not hold.
     */
    public Object get(StyleAttribute attribute) {
        return switch (attribute) {
            case BOLD -> bold;
            case ITALIC -> italic;
            case UNDERLINE -> underline;
            case STRIKEOUT -> strikeout;
            case DRAWING -> drawing;
            case FONT_NAME -> fontName;
            case FONT_SIZE -> fontSize;
            case SCALE_X -> scaleX;
            case SCALE_Y -> scaleY;
            case SPACING -> spacing;
            case ANGLE -> angle;
            case OUTLINE -> outline;
            case SHADOW -> shadow;
            case PRIMARY_COLOR -> primaryColor;
            case SECONDARY_COLOR -> secondaryColor;
            case OUTLINE_COLOR -> outlineColor;
            case BACK_COLOR -> backColor;
            case ALIGNMENT -> alignment;
            case MARGIN_L -> marginL;
            case MARGIN_R -> marginR;
            case MARGIN_V -> marginV;
            case RESET, POSITION -> null;
        };
    }

    // Getters and Setters
    public String getFontName() {
        return fontName;
    }

    public void setFontName(String fontName) {
        this.fontName = Objects.requireNonNull(fontName, "fontName");
    }

    public double getFontSize() {
        return fontSize;
    }

    public void setFontSize(double fontSize) {
        this.fontSize = fontSize;
    }

    public Color getPrimaryColor() {
        return primaryColor;
    }

    public void setPrimaryColor(Color primaryColor) {
        this.primaryColor = Objects.requireNonNull(primaryColor, "primaryColor");
    }

    public Color getSecondaryColor() {
        return secondaryColor;
    }

    public void setSecondaryColor(Color secondaryColor) {
        this.secondaryColor = Objects.requireNonNull(secondaryColor, "secondaryColor");
    }

    public Color getOutlineColor() {
        return outlineColor;
    }

    public void setOutlineColor(Color outlineColor) {
        this.outlineColor = Objects.requireNonNull(outlineColor, "outlineColor");
    }

    public Color getBackColor() {
        return backColor;
    }

    public void setBackColor(Color backColor) {
        this.backColor = Objects.requireNonNull(backColor, "backColor");
    }

    public boolean isBold() {
        return bold;
    }

    public void setBold(boolean bold) {
        this.bold = bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public void setItalic(boolean italic) {
        this.italic = italic;
    }

    public boolean isUnderline() {
        return underline;
    }

    public void setUnderline(boolean underline) {
        this.underline = underline;
    }

    public boolean isStrikeout() {
        return strikeout;
    }

    public void setStrikeout(boolean strikeout) {
        this.strikeout = strikeout;
    }

    /**
     * Set only on effective styles resolved from {@code \p} drawing mode.
     */
    public boolean isDrawing() {
        return drawing;
    }

    public double getScaleX() {
        return scaleX;
    }

    public void setScaleX(double scaleX) {
        this.scaleX = scaleX;
    }

    public double getScaleY() {
        return scaleY;
    }

    public void setScaleY(double scaleY) {
        this.scaleY = scaleY;
    }

    public double getSpacing() {
        return spacing;
    }

    public void setSpacing(double spacing) {
        this.spacing = spacing;
    }

    public double getAngle() {
        return angle;
    }

    public void setAngle(double angle) {
        this.angle = angle;
    }

    public int getBorderStyle() {
        return borderStyle;
    }

    public void setBorderStyle(int borderStyle) {
        this.borderStyle = borderStyle;
    }

    public double getOutline() {
        return outline;
    }

    public void setOutline(double outline) {
        this.outline = outline;
    }

    public double getShadow() {
        return shadow;
    }

    public void setShadow(double shadow) {
        this.shadow = shadow;
    }

    public Alignment getAlignment() {
        return alignment;
    }

    public void setAlignment(Alignment alignment) {
        this.alignment = Objects.requireNonNull(alignment, "alignment");
    }

    public int getMarginL() {
        return marginL;
    }

    public void setMarginL(int marginL) {
        this.marginL = marginL;
    }

    public int getMarginR() {
        return marginR;
    }

    public void setMarginR(int marginR) {
        this.marginR = marginR;
    }

    public int getMarginV() {
        return marginV;
    }

    public void setMarginV(int marginV) {
        this.marginV = marginV;
    }

    public int getAlphaLevel() {
        return alphaLevel;
    }

    public void setAlphaLevel(int alphaLevel) {
        this.alphaLevel = alphaLevel;
    }

    public int getEncoding() {
        return encoding;
    }

    public void setEncoding(int encoding) {
        this.encoding = encoding;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubtitleStyle other)) {
            return false;
        }
        return Double.compare(fontSize, other.fontSize) == 0
                && bold == other.bold
                && italic == other.italic
                && underline == other.underline
                && strikeout == other.strikeout
                && drawing == other.drawing
                && Double.compare(scaleX, other.scaleX) == 0
                && Double.compare(scaleY, other.scaleY) == 0
                && Double.compare(spacing, other.spacing) == 0
                && Double.compare(angle, other.angle) == 0
                && borderStyle == other.borderStyle
                && Double.compare(outline, other.outline) == 0
                && Double.compare(shadow, other.shadow) == 0
                && marginL == other.marginL
                && marginR == other.marginR
                && marginV == other.marginV
                && alphaLevel == other.alphaLevel
                && encoding == other.encoding
                && fontName.equals(other.fontName)
                && primaryColor.equals(other.primaryColor)
                && secondaryColor.equals(other.secondaryColor)
                && outlineColor.equals(other.outlineColor)
                && backColor.equals(other.backColor)
                && alignment == other.alignment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fontName, fontSize, primaryColor, secondaryColor, outlineColor, backColor, bold,
                italic, underline, strikeout, drawing, scaleX, scaleY, spacing, angle, borderStyle, outline,
                shadow, alignment, marginL, marginR, marginV, alphaLevel, encoding);
    }

    @Override
    public String toString() {
        return String.format("SubtitleStyle[%s %s%s%s]", fontName, formatSize(fontSize),
                bold ? " bold" : "", italic ? " italic" : "");
    }

    private static String formatSize(double size) {
        return size == Math.rint(size) ? Long.toString((long) size) : Double.toString(size);
    }
}
