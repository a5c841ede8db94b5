package com.telcomax.assistant.agent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns validator rejection reasons into follow-up questions for the customer. Unverified
 * amounts are never echoed back.
 */
public final class ClarifyingQuestions {

    static final String PREAMBLE =
            "I need a bit more information to answer your question accurately:";

    private static final List<String> MISSING_CITATION_QUESTIONS = List.of(
            "Can you provide your account number or customer ID?",
            "What specific billing period are you asking about?",
            "Can you provide more details about your question?");

    private static final List<String> LOW_CONFIDENCE_QUESTIONS = List.of(
            "Can you be more specific about what you're looking for?",
            "Which billing period or invoice are you asking about?",
            "Can you provide your account details?");

    private static final List<String> UNVERIFIED_AMOUNT_QUESTIONS = List.of(
            "I found amounts in the answer that I couldn't verify against your records.",
            "Can you confirm which charges you're asking about?",
            "Which specific invoice or bill are you referring to?");

    private static final List<String> FALLBACK_QUESTIONS = List.of(
            "Can you provide more details about your question?",
            "What specific information are you looking for?");

    private ClarifyingQuestions() {
    }

    public static List<String> questions(List<String> reasons) {
        Set<String> questions = new LinkedHashSet<>();
        for (String reason : reasons) {
            if (ResponseValidator.MISSING_CITATIONS.equals(reason)) {
                questions.addAll(MISSING_CITATION_QUESTIONS);
            } else if (ResponseValidator.LOW_CONFIDENCE.equals(reason)) {
                questions.addAll(LOW_CONFIDENCE_QUESTIONS);
            } else if (reason.startsWith(ResponseValidator.UNVERIFIED_AMOUNT)) {
                questions.addAll(UNVERIFIED_AMOUNT_QUESTIONS);
            }
        }
        if (questions.isEmpty()) {
            questions.addAll(FALLBACK_QUESTIONS);
        }
        return List.copyOf(questions);
    }

    public static String message(List<String> reasons) {
        return questions(reasons).stream()
                .map(q -> "• " + q)
                .collect(Collectors.joining("\n", PREAMBLE + "\n", ""));
    }
}
