package com.github.salilvnair.convintel.intent;

import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Keyword and regex tables for one locale, compiled once.
 * <p>
 * A keyword matches when it is not glued to surrounding word characters; the
 * {@code inflectionSuffix} regex is appended to keywords of at least
 * {@value #MIN_INFLECTED_LENGTH} characters so that {@code price} also matches
 * {@code prices} while {@code hi} does not match {@code his}. Patterns are used as given.
 */
@Getter
public final class IntentLexicon {

    public static final int MATCH_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public static final int MIN_INFLECTED_LENGTH = 4;

    private final String locale;
    private final Map<IntentCategory, List<Pattern>> keywordPatterns;
    private final Map<IntentCategory, List<Pattern>> patterns;

    public IntentLexicon(String locale,
                         String inflectionSuffix,
                         Map<IntentCategory, List<String>> keywords,
                         Map<IntentCategory, List<String>> patterns) {
        if (locale == null || locale.isBlank()) {
            throw new ConvIntelException(ConvIntelErrorCode.INVALID_LEXICON, "Lexicon locale is required");
        }
        this.locale = locale.trim().toLowerCase(Locale.ROOT);
        String suffix = inflectionSuffix == null ? "" : inflectionSuffix;
        this.keywordPatterns = compile(keywords, keyword -> keywordRegex(keyword.trim(), suffix));
        this.patterns = compile(patterns, regex -> regex);
    }

    public List<Pattern> keywordPatterns(IntentCategory category) {
        return keywordPatterns.getOrDefault(category, List.of());
    }

    public List<Pattern> patterns(IntentCategory category) {
        return patterns.getOrDefault(category, List.of());
    }

    private static String keywordRegex(String keyword, String suffix) {
        String inflection = keyword.length() >= MIN_INFLECTED_LENGTH ? suffix : "";
        return "(?<!\\w)" + Pattern.quote(keyword) + inflection + "(?!\\w)";
    }

    private Map<IntentCategory, List<Pattern>> compile(Map<IntentCategory, List<String>> source,
                                                       UnaryOperator<String> toRegex) {
        Map<IntentCategory, List<Pattern>> compiled = new EnumMap<>(IntentCategory.class);
        if (source == null) {
            return Collections.unmodifiableMap(compiled);
        }
        for (Map.Entry<IntentCategory, List<String>> entry : source.entrySet()) {
            List<Pattern> list = new ArrayList<>();
            for (String raw : entry.getValue()) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                try {
                    list.add(Pattern.compile(toRegex.apply(raw), MATCH_FLAGS));
                } catch (PatternSyntaxException e) {
                    throw new ConvIntelException(
                            ConvIntelErrorCode.INVALID_LEXICON,
                            "Invalid expression for locale " + locale + ", intent " + entry.getKey().code() + ": " + raw,
                            e
                    );
                }
            }
            compiled.put(entry.getKey(), List.copyOf(list));
        }
        return Collections.unmodifiableMap(compiled);
    }
}
