package com.example.subtitlecodec.service;

import com.github.pemistahl.lingua.api.IsoCode639_1;
import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Statistical language detection backed by Lingua's n-gram models. Models are loaded lazily,
 * per candidate language, on first use. Text Lingua cannot classify falls back to the
 * {@link ScriptLanguageDetector}.
 */
@Component
public class LinguaLanguageDetector implements LanguageDetector {

    private static final Logger log = LoggerFactory.getLogger(LinguaLanguageDetector.class);

    private final com.github.pemistahl.lingua.api.LanguageDetector detector;
    private final LanguageDetector fallback = new ScriptLanguageDetector();

    /**
     * Detector over every language Lingua knows.
     */
    public LinguaLanguageDetector() {
        this("");
    }

    /**
     * @param languages comma-separated ISO 639-1 codes to choose from (at least two), or blank for all
     */
    @Autowired
    public LinguaLanguageDetector(@Value("${subtitle.language-detection.languages:}") String languages) {
        List<IsoCode639_1> codes = parseCodes(languages);
        if (codes.isEmpty()) {
            this.detector = LanguageDetectorBuilder.fromAllLanguages().build();
        } else {
            if (codes.size() < 2) {
                throw new IllegalArgumentException("At least two languages are needed for detection: " + languages);
            }
            this.detector = LanguageDetectorBuilder.fromIsoCodes639_1(codes.toArray(new IsoCode639_1[0])).build();
        }
        log.debug("Language detection over {}", codes.isEmpty() ? "all languages" : codes);
    }

    @Override
    public String detect(String text) {
        if (!LanguageDetector.hasLetters(text)) {
            return null;
        }
        Language language = detector.detectLanguageOf(preprocess(text));
        if (language == Language.UNKNOWN) {
            log.debug("No statistical match, using script detection");
            return fallback.detect(text);
        }
        return isoCode(language);
    }

    @Override
    public List<LanguageGuess> detect(String text, int topK) {
        LanguageDetector.checkTopK(topK);
        if (!LanguageDetector.hasLetters(text)) {
            return List.of();
        }
        Map<Language, Double> values = detector.computeLanguageConfidenceValues(preprocess(text));
        double sum = 0;
        for (Map.Entry<Language, Double> entry : values.entrySet()) {
            if (entry.getKey() != Language.UNKNOWN) {
                sum += entry.getValue();
            }
        }
        if (!(sum > 0)) {
            return fallback.detect(text, topK);
        }

        List<LanguageGuess> guesses = new ArrayList<>();
        for (Map.Entry<Language, Double> entry : values.entrySet()) {
            if (entry.getKey() != Language.UNKNOWN && entry.getValue() > 0) {
                guesses.add(new LanguageGuess(isoCode(entry.getKey()), Math.min(1.0, entry.getValue() / sum)));
            }
        }
        guesses.sort((a, b) -> Double.compare(b.probability(), a.probability()));
        return guesses.size() > topK ? List.copyOf(guesses.subList(0, topK)) : List.copyOf(guesses);
    }

    private static String preprocess(String text) {
        return text.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ').strip();
    }

    private static String isoCode(Language language) {
        return language.getIsoCode639_1().name().toLowerCase(Locale.ROOT);
    }

    private static List<IsoCode639_1> parseCodes(String languages) {
        if (languages == null || languages.isBlank()) {
            return List.of();
        }
        List<IsoCode639_1> codes = new ArrayList<>();
        for (String code : Arrays.asList(languages.split(","))) {
            String key = code.strip().toUpperCase(Locale.ROOT);
            if (key.isEmpty()) {
                continue;
            }
            IsoCode639_1 parsed;
            try {
                parsed = IsoCode639_1.valueOf(key);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown ISO 639-1 language code: " + code.strip(), e);
            }
            if (parsed == IsoCode639_1.NONE) {
                throw new IllegalArgumentException("Unknown ISO 639-1 language code: " + code.strip());
            }
            if (!codes.contains(parsed)) {
                codes.add(parsed);
            }
        }
        return codes;
    }
}
