package com.example.subtitlecodec.format;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * SubStation Alpha v4.00: no layers, and styles without underline, strikeout, scaling,
 * spacing or rotation.
 */
@Component
public class SsaCodec extends SubstationCodec {

    public static final String ID = "ssa";

    public SsaCodec() {
        super(false);
    }

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of(".ssa");
    }

    @Override
    public String displayName() {
        return "SubStation Alpha";
    }

    @Override
    public boolean canRead(String text) {
        return looksLikeScript(text) && !looksAdvanced(text);
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.SUBSTATION_V4;
    }
}
