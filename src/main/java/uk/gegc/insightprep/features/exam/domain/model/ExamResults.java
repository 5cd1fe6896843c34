package uk.gegc.insightprep.features.exam.domain.model;

/**
 * Aggregate outcome of a submitted exam. Unanswered questions count as not correct.
 *
 * @param percentage         correct answers over all questions, rounded
 * @param answeredPercentage correct answers over answered questions, rounded; 0 when nothing was answered
 */
public record ExamResults(
        int totalQuestions,
        int totalAnswered,
        int correctCount,
        int percentage,
        int answeredPercentage,
        long timeSpentSeconds
) {
}
