package com.example.subtitlecodec.format;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Advanced SubStation Alpha (v4.00+). Carries every feature of the document model.
 */
@Component
public class AssCodec extends SubstationCodec {

    public static final String ID = "ass";

    public AssCodec() {
        super(true);
    }

    @Override
    public String identifier() {
        return ID;
    }

    @Override
    public List<String> fileExtensions() {
        return List.of(".ass");
    }

    @Override
    public String displayName() {
        return "Advanced SubStation Alpha";
    }

    @Override
    public boolean canRead(String text) {
        return looksLikeScript(text) && looksAdvanced(text);
    }

    @Override
    public ConversionPolicy policy() {
        return ConversionPolicy.LOSSLESS;
    }
}
