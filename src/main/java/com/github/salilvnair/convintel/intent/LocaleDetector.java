package com.github.salilvnair.convintel.intent;

import lombok.experimental.UtilityClass;

import java.util.Locale;

@UtilityClass
public class LocaleDetector {

    /**
     * Picks {@code ar} when Arabic letters outnumber Latin ones, otherwise the fallback.
     */
    public static String detect(String text, String fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        int arabic = 0;
        int latin = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!Character.isLetter(codePoint)) {
                continue;
            }
            Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
            if (script == Character.UnicodeScript.ARABIC) {
                arabic++;
            } else if (script == Character.UnicodeScript.LATIN) {
                latin++;
            }
        }
        return arabic > latin ? IntentLexicons.ARABIC : fallback;
    }

    /** {@code en-US}, {@code EN_us} and {@code en} all normalize to {@code en}. */
    public static String normalize(String locale) {
        if (locale == null || locale.isBlank()) {
            return null;
        }
        String trimmed = locale.trim().toLowerCase(Locale.ROOT);
        int separator = indexOfSeparator(trimmed);
        return separator > 0 ? trimmed.substring(0, separator) : trimmed;
    }

    private static int indexOfSeparator(String value) {
        int dash = value.indexOf('-');
        int underscore = value.indexOf('_');
        if (dash < 0) {
            return underscore;
        }
        if (underscore < 0) {
            return dash;
        }
        return Math.min(dash, underscore);
    }
}
