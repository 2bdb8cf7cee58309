package com.example.subtitlecodec.service;

import java.util.List;

/**
 * Guesses the language of a piece of subtitle text.
 */
public interface LanguageDetector {

    /** BCP 47 tag for text whose language cannot be determined. */
    String UNDETERMINED = "und";

    /**
     * Returns a BCP 47 language tag, {@link #UNDETERMINED} when the text gives no clue,
     * or {@code null} for text without letters.
     */
    String detect(String text);

    /**
     * The {@code topK} most likely languages, most likely first. Empty for text without letters.
     *
     * @throws IllegalArgumentException if {@code topK} is less than 1
     */
    List<LanguageGuess> detect(String text, int topK);

    static boolean hasLetters(String text) {
        return text != null && text.codePoints().anyMatch(Character::isLetter);
    }

    static void checkTopK(int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1: " + topK);
        }
    }
}
