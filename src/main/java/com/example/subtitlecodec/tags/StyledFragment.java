package com.example.subtitlecodec.tags;

import com.example.subtitlecodec.model.Position;
import com.example.subtitlecodec.model.SubtitleStyle;

/**
 * A run of text together with the fully resolved style it is displayed in.
 *
 * @param position {@code \pos} in effect, or {@code null}
 */
public record StyledFragment(String text, SubtitleStyle style, Position position) {
}
