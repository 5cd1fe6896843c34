package uk.gegc.insightprep.features.question.api.dto;

/**
 * Row of the {@code match_pairs} table.
 */
public record MatchPairRow(long id, long questionId, String leftText, String rightText) {
}
