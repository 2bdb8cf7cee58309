package com.example.subtitlecodec.model;

/**
 * Per-event margin override. A zero component means "use the style's margin".
 */
public record EventMargins(int left, int right, int vertical) {

    public static final EventMargins NONE = new EventMargins(0, 0, 0);

    public boolean isNone() {
        return left == 0 && right == 0 && vertical == 0;
    }
}
