package uk.gegc.insightprep.features.exam.domain.model;

import java.util.List;

/**
 * Per-question line of the exam report.
 *
 * @param correctAnswerText present only when the question was not answered correctly
 */
public record QuestionReview(
        int number,
        String questionId,
        String questionText,
        ReviewStatus status,
        boolean bookmarked,
        List<String> options,
        String userAnswerText,
        String correctAnswerText,
        List<MatchReviewRow> matchRows
) {
}
