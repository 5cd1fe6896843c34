package uk.gegc.insightprep.features.question.domain.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Structural kind of a question. Determines the shape of the correct answer
 * and which handler judges a submission.
 */
public enum QuestionType {
    SINGLE_CHOICE,
    MULTIPLE_CHOICE,
    MATCH,
    ASSERTION_REASON;

    // Labels used by question banks and query rows, compared lower-cased
    private static final Map<String, QuestionType> LABELS = Map.ofEntries(
            Map.entry("single", SINGLE_CHOICE),
            Map.entry("single_choice", SINGLE_CHOICE),
            Map.entry("mcq", SINGLE_CHOICE),
            Map.entry("mcq-scenario", SINGLE_CHOICE),
            Map.entry("cohort-05-mcq", SINGLE_CHOICE),
            Map.entry("truefalse", SINGLE_CHOICE),
            Map.entry("multiple", MULTIPLE_CHOICE),
            Map.entry("multiple_choice", MULTIPLE_CHOICE),
            Map.entry("mcq-multiple", MULTIPLE_CHOICE),
            Map.entry("match", MATCH),
            Map.entry("assertion", ASSERTION_REASON),
            Map.entry("assertionreason", ASSERTION_REASON),
            Map.entry("assertion_reason", ASSERTION_REASON)
    );

    public static Optional<QuestionType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(LABELS.get(label.trim().toLowerCase(Locale.ROOT)));
    }

    public boolean isChoiceBased() {
        return this != MATCH;
    }
}
