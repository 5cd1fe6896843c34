package uk.gegc.insightprep.features.question.api.dto;

/**
 * Row of the {@code questions} table.
 */
public record QuestionRow(
        long id,
        String questionText,
        String questionType,
        String explanation,
        String reference,
        String topic,
        String subtopic
) {
}
