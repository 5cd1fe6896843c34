package uk.gegc.insightprep.shared.exception;

import uk.gegc.insightprep.features.question.domain.model.ExcludedQuestion;

import java.util.List;

/**
 * Thrown when intake leaves no valid question to build a session from.
 * No session object is produced.
 */
public class NoValidQuestionsException extends RuntimeException {

    private final NoValidQuestionsReason reason;
    private final List<ExcludedQuestion> excluded;

    public NoValidQuestionsException(NoValidQuestionsReason reason, List<ExcludedQuestion> excluded) {
        super(reason.getUserMessage());
        this.reason = reason;
        this.excluded = List.copyOf(excluded);
    }

    public NoValidQuestionsReason getReason() {
        return reason;
    }

    public List<ExcludedQuestion> getExcluded() {
        return excluded;
    }
}
