package uk.gegc.insightprep.features.exam.domain.model;

/**
 * @param userRight {@code null} when the user left the pair unmatched
 */
public record MatchReviewRow(String left, String expectedRight, String userRight, boolean correct) {
}
