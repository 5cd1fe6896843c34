package uk.gegc.insightprep.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.QuestionType;

/**
 * Assertion/reason items carry a fixed set of verdict options but are judged
 * exactly like single-choice questions.
 */
@Component
public class AssertionReasonHandler extends SingleChoiceHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.ASSERTION_REASON;
    }
}
