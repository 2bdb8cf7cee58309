package com.example.subtitlecodec.service;

/**
 * A candidate language with its probability in {@code [0, 1]}.
 */
public record LanguageGuess(String language, double probability) {

    public LanguageGuess {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
        if (!(probability >= 0 && probability <= 1)) {
            throw new IllegalArgumentException("probability must be within [0, 1]: " + probability);
        }
    }
}
