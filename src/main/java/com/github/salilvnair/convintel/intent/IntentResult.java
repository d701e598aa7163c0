package com.github.salilvnair.convintel.intent;

import java.util.List;

public record IntentResult(
        IntentCategory intent,
        double confidence,
        IntentCategory secondaryIntent,
        List<String> keywords,
        String locale
) {

    public IntentResult {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static IntentResult fallback(String locale) {
        return new IntentResult(IntentCategory.INQUIRY, 0.0d, null, List.of(), locale);
    }
}
