package com.example.subtitlecodec.model;

/**
 * Text alignment in numpad layout (ASS {@code \an}); SSA uses a legacy numbering.
 */
public enum Alignment {
    BOTTOM_LEFT(1, 1),
    BOTTOM_CENTER(2, 2),
    BOTTOM_RIGHT(3, 3),
    MIDDLE_LEFT(4, 9),
    MIDDLE_CENTER(5, 10),
    MIDDLE_RIGHT(6, 11),
    TOP_LEFT(7, 5),
    TOP_CENTER(8, 6),
    TOP_RIGHT(9, 7);

    private final int numpad;
    private final int ssa;

    Alignment(int numpad, int ssa) {
        this.numpad = numpad;
        this.ssa = ssa;
    }

    public int numpad() {
        return numpad;
    }

    public int ssa() {
        return ssa;
    }

    public static Alignment fromNumpad(int value) {
        for (Alignment alignment : values()) {
            if (alignment.numpad == value) {
                return alignment;
            }
        }
        throw new IllegalArgumentException("Invalid numpad alignment: " + value);
    }

    public static Alignment fromSsa(int value) {
        for (Alignment alignment : values()) {
            if (alignment.ssa == value) {
                return alignment;
            }
        }
        throw new IllegalArgumentException("Invalid SSA alignment: " + value);
    }
}
