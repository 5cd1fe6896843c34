package uk.gegc.insightprep.features.learning.domain.model;

/**
 * What a renderer may show for one judged question. Null fields are withheld
 * by the session configuration or absent from the question.
 */
public record QuestionFeedback(
        int questionIndex,
        boolean correct,
        String correctAnswerText,
        String explanation,
        String reference,
        String topic,
        String subtopic
) {
}
