package com.example.subtitlecodec.model;

/**
 * Absolute position from a {@code \pos(x,y)} override, in script resolution pixels.
 */
public record Position(double x, double y) {
}
