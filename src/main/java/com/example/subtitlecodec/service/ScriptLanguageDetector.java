package com.example.subtitlecodec.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects language from the Unicode scripts of the letters in the text. Scripts used by a
 * single major language map to that language; Latin script and anything else is reported as
 * undetermined. The probability of a guess is the share of letters written in its scripts.
 */
public class ScriptLanguageDetector implements LanguageDetector {

    private static final Map<Character.UnicodeScript, String> LANGUAGES = new EnumMap<>(Character.UnicodeScript.class);

    static {
        LANGUAGES.put(Character.UnicodeScript.HEBREW, "he");
        LANGUAGES.put(Character.UnicodeScript.ARABIC, "ar");
        LANGUAGES.put(Character.UnicodeScript.CYRILLIC, "ru");
        LANGUAGES.put(Character.UnicodeScript.GREEK, "el");
        LANGUAGES.put(Character.UnicodeScript.HAN, "zh");
        LANGUAGES.put(Character.UnicodeScript.HIRAGANA, "ja");
        LANGUAGES.put(Character.UnicodeScript.KATAKANA, "ja");
        LANGUAGES.put(Character.UnicodeScript.HANGUL, "ko");
        LANGUAGES.put(Character.UnicodeScript.THAI, "th");
        LANGUAGES.put(Character.UnicodeScript.DEVANAGARI, "hi");
        LANGUAGES.put(Character.UnicodeScript.ARMENIAN, "hy");
        LANGUAGES.put(Character.UnicodeScript.GEORGIAN, "ka");
    }

    @Override
    public String detect(String text) {
        List<LanguageGuess> guesses = detect(text, 1);
        return guesses.isEmpty() ? null : guesses.get(0).language();
    }

    @Override
    public List<LanguageGuess> detect(String text, int topK) {
        LanguageDetector.checkTopK(topK);
        if (!LanguageDetector.hasLetters(text)) {
            return List.of();
        }
        Map<Character.UnicodeScript, Integer> counts = new EnumMap<>(Character.UnicodeScript.class);
        text.codePoints()
                .filter(Character::isLetter)
                .forEach(cp -> counts.merge(Character.UnicodeScript.of(cp), 1, Integer::sum));
        // Japanese text mixes kana with Han characters
        boolean kana = counts.containsKey(Character.UnicodeScript.HIRAGANA)
                || counts.containsKey(Character.UnicodeScript.KATAKANA);

        int total = 0;
        Map<String, Integer> perLanguage = new LinkedHashMap<>();
        for (Map.Entry<Character.UnicodeScript, Integer> entry : counts.entrySet()) {
            String language = kana && entry.getKey() == Character.UnicodeScript.HAN
                    ? "ja"
                    : LANGUAGES.getOrDefault(entry.getKey(), UNDETERMINED);
            perLanguage.merge(language, entry.getValue(), Integer::sum);
            total += entry.getValue();
        }

        List<LanguageGuess> guesses = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : perLanguage.entrySet()) {
            guesses.add(new LanguageGuess(entry.getKey(), (double) entry.getValue() / total));
        }
        guesses.sort((a, b) -> Double.compare(b.probability(), a.probability()));
        return guesses.size() > topK ? List.copyOf(guesses.subList(0, topK)) : List.copyOf(guesses);
    }
}
