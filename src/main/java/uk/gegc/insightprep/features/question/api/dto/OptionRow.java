package uk.gegc.insightprep.features.question.api.dto;

/**
 * Row of the {@code options} table.
 */
public record OptionRow(long id, long questionId, String optionText, boolean correct) {
}
