package uk.gegc.insightprep.shared.exception;

/**
 * Thrown when a candidate question violates the question invariants.
 * Non-fatal: intake turns it into an exclusion.
 */
public class MalformedQuestionException extends RuntimeException {

    private final String questionId;
    private final String reason;

    public MalformedQuestionException(String questionId, String reason) {
        super("Question " + questionId + " is malformed: " + reason);
        this.questionId = questionId;
        this.reason = reason;
    }

    public String getQuestionId() {
        return questionId;
    }

    public String getReason() {
        return reason;
    }
}
