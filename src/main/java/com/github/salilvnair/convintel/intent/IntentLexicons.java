package com.github.salilvnair.convintel.intent;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.convintel.intent.IntentCategory.CLOSING;
import static com.github.salilvnair.convintel.intent.IntentCategory.COMMITMENT;
import static com.github.salilvnair.convintel.intent.IntentCategory.COMPARISON;
import static com.github.salilvnair.convintel.intent.IntentCategory.FEEDBACK;
import static com.github.salilvnair.convintel.intent.IntentCategory.GREETING;
import static com.github.salilvnair.convintel.intent.IntentCategory.INQUIRY;
import static com.github.salilvnair.convintel.intent.IntentCategory.OBJECTION;
import static com.github.salilvnair.convintel.intent.IntentCategory.PRICING;
import static com.github.salilvnair.convintel.intent.IntentCategory.SUPPORT;
import static com.github.salilvnair.convintel.intent.IntentCategory.TECHNICAL;

/**
 * Built-in lexicons. Additional locales are registered through {@link IntentLexiconRegistry#register}.
 */
@UtilityClass
public class IntentLexicons {

    public static final String ENGLISH = "en";
    public static final String ARABIC = "ar";

    private static final String ENGLISH_INFLECTIONS = "(?:s|es|ed|ing)?";

    public static IntentLexicon english() {
        return new IntentLexicon(
                ENGLISH,
                ENGLISH_INFLECTIONS,
                Map.of(
                        GREETING, List.of("hello", "hi", "hey", "good morning", "good afternoon", "good evening"),
                        INQUIRY, List.of("what is", "what are", "tell me about", "explain", "information"),
                        TECHNICAL, List.of("how to", "how do", "integrate", "integration", "API", "setup", "install", "configure"),
                        PRICING, List.of("price", "cost", "how much", "plan", "fee"),
                        COMPARISON, List.of("vs", "versus", "compare", "difference", "better", "alternative"),
                        OBJECTION, List.of("expensive", "not sure", "concern", "doubt", "worried"),
                        COMMITMENT, List.of("interested", "sign up", "demo", "trial", "get started"),
                        SUPPORT, List.of("help", "problem", "issue", "error", "broken"),
                        FEEDBACK, List.of("thanks", "great", "bad", "awesome"),
                        CLOSING, List.of("bye", "goodbye", "thank you", "see you")
                ),
                Map.of(
                        PRICING, List.of(
                                "\\b(prices?|pricing|costs?|how much|fees?)\\b",
                                "\\b(plans?|subscriptions?|packages?)\\b"
                        ),
                        TECHNICAL, List.of(
                                "\\b(how to|how do|set ?up|install|configure|api|integrat\\w*)\\b",
                                "\\b(documentation|docs|guide|tutorial)\\b"
                        ),
                        COMPARISON, List.of(
                                "\\b(vs\\.?|versus|compared? (?:to|with)|difference between)\\b"
                        ),
                        OBJECTION, List.of(
                                "\\b(expensive|too much|concerns?|worried)\\b",
                                "\\b(not sure|hesitant|doubts?)\\b"
                        ),
                        COMMITMENT, List.of(
                                "\\b(sign up|register|demo|trial|get started|subscribe)\\b",
                                "\\b(interested|want to|would like to|ready to)\\b"
                        ),
                        CLOSING, List.of(
                                "\\b(good ?bye|bye|see you)\\b"
                        )
                )
        );
    }

    public static IntentLexicon arabic() {
        return new IntentLexicon(
                ARABIC,
                "",
                Map.of(
                        GREETING, List.of("مرحبا", "السلام", "أهلا", "صباح الخير", "مساء الخير"),
                        INQUIRY, List.of("ايه هي", "عايز اعرف", "ما هو", "ما هي", "أخبرني"),
                        TECHNICAL, List.of("ازاي", "كيف", "ربط", "تكامل"),
                        PRICING, List.of("كم", "سعر", "السعر", "الأسعار", "تكلفة", "خطط", "باقات"),
                        COMPARISON, List.of("مقارنة", "الفرق", "أفضل"),
                        OBJECTION, List.of("غالي", "مش متأكد", "قلق"),
                        COMMITMENT, List.of("مهتم", "عايز اجرب", "تجربة", "اشتراك"),
                        SUPPORT, List.of("مشكلة", "خطأ", "مساعدة"),
                        FEEDBACK, List.of("شكرا", "ممتاز", "رائع", "سيء"),
                        CLOSING, List.of("مع السلامة", "شكرا جزيلا", "وداعا")
                ),
                Map.of(
                        PRICING, List.of(
                                "\\b(كم|سعر|السعر|الأسعار|تكلفة|التكلفة)\\b",
                                "\\b(باقة|باقات|خطة|خطط)\\b"
                        ),
                        TECHNICAL, List.of("\\b(ازاي|كيف|ربط|تكامل)\\b"),
                        COMMITMENT, List.of("\\b(مهتم|تجربة|اشتراك)\\b"),
                        OBJECTION, List.of("\\b(غالي|قلق|مش متأكد)\\b"),
                        CLOSING, List.of("(مع السلامة|شكرا جزيلا|وداعا)")
                )
        );
    }
}
