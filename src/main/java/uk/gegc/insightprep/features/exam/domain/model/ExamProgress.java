package uk.gegc.insightprep.features.exam.domain.model;

/**
 * Counters shown while navigating and in the finish confirmation.
 */
public record ExamProgress(int answered, int unanswered, int bookmarked, int answeredPercentage) {
}
