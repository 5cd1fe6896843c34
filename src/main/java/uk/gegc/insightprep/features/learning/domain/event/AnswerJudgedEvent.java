package uk.gegc.insightprep.features.learning.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;

/**
 * Published after every accepted learning-mode submission, so a renderer can
 * update the on-screen feedback of that question.
 */
public class AnswerJudgedEvent extends ApplicationEvent {

    private final String sessionId;
    private final int questionIndex;
    private final boolean verdict;
    private final SubmittedAnswer userAnswer;

    public AnswerJudgedEvent(Object source, String sessionId, int questionIndex, boolean verdict,
                             SubmittedAnswer userAnswer) {
        super(source);
        this.sessionId = sessionId;
        this.questionIndex = questionIndex;
        this.verdict = verdict;
        this.userAnswer = userAnswer;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getQuestionIndex() {
        return questionIndex;
    }

    public boolean isVerdict() {
        return verdict;
    }

    public SubmittedAnswer getUserAnswer() {
        return userAnswer;
    }
}
