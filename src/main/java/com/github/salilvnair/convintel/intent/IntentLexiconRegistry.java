package com.github.salilvnair.convintel.intent;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class IntentLexiconRegistry {

    private final Map<String, IntentLexicon> lexicons = new ConcurrentHashMap<>();
    private final ConvIntelProperties properties;

    public IntentLexiconRegistry(ConvIntelProperties properties) {
        this.properties = properties;
        register(IntentLexicons.english());
        register(IntentLexicons.arabic());
    }

    public void register(IntentLexicon lexicon) {
        IntentLexicon previous = lexicons.put(lexicon.getLocale(), lexicon);
        if (previous != null) {
            log.info("Replaced intent lexicon for locale={}", lexicon.getLocale());
        }
    }

    public Optional<IntentLexicon> find(String locale) {
        String normalized = LocaleDetector.normalize(locale);
        return normalized == null ? Optional.empty() : Optional.ofNullable(lexicons.get(normalized));
    }

    /**
     * Declared locale when a lexicon exists for it, else the locale detected from the message,
     * else the configured default.
     */
    public IntentLexicon resolve(String declaredLocale, String message) {
        Optional<IntentLexicon> declared = find(declaredLocale);
        if (declared.isPresent()) {
            return declared.get();
        }
        if (declaredLocale != null && !declaredLocale.isBlank()) {
            log.debug("No lexicon for declared locale={}, detecting from message", declaredLocale);
        }
        String defaultLocale = properties.getIntent().getDefaultLocale();
        String detected = LocaleDetector.detect(message, defaultLocale);
        return find(detected)
                .or(() -> find(defaultLocale))
                .orElseThrow(() -> new ConvIntelException(
                        ConvIntelErrorCode.UNKNOWN_LOCALE,
                        "No intent lexicon registered for default locale " + defaultLocale
                ));
    }
}
