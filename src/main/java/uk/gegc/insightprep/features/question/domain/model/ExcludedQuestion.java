package uk.gegc.insightprep.features.question.domain.model;

/**
 * A candidate question rejected during intake, with the reason it failed validation.
 *
 * @param questionId id of the candidate, or {@code "#<position>"} when the record had none
 * @param position   zero-based position in the candidate list
 * @param reason     specific validation failure
 */
public record ExcludedQuestion(String questionId, int position, String reason) {
}
