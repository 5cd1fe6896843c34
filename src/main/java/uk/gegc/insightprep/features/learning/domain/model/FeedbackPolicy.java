package uk.gegc.insightprep.features.learning.domain.model;

import uk.gegc.insightprep.features.question.domain.model.Question;

/**
 * Decides what feedback a judged question exposes. Timing (immediate or at
 * reveal) is the session's concern; this only gates content.
 */
public final class FeedbackPolicy {

    private FeedbackPolicy() {
    }

    public static QuestionFeedback feedbackFor(SessionConfig config, Question question, int index, LedgerEntry entry) {
        boolean explain = config.explanationMode().appliesTo(entry.correct());
        String correctAnswer = explain && config.showCorrectAnswer() && question.getCorrectAnswer() != null
                ? question.getCorrectAnswer().describe()
                : null;
        return new QuestionFeedback(
                index,
                entry.correct(),
                correctAnswer,
                explain ? question.getExplanation() : null,
                explain ? question.getReference() : null,
                config.showTopicSubtopic() ? question.getTopic() : null,
                config.showTopicSubtopic() ? question.getSubtopic() : null
        );
    }
}
