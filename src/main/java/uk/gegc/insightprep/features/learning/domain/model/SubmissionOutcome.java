package uk.gegc.insightprep.features.learning.domain.model;

import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;

/**
 * Result of an accepted submission.
 *
 * @param feedback immediate feedback, or {@code null} when feedback is delayed
 */
public record SubmissionOutcome(
        int questionIndex,
        boolean verdict,
        SubmittedAnswer userAnswer,
        boolean retryOffered,
        boolean sessionComplete,
        QuestionFeedback feedback
) {
}
