package uk.gegc.insightprep.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.LetterRef;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.QuestionType;
import uk.gegc.insightprep.features.question.domain.model.SingleOption;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.features.question.domain.model.TextSet;
import uk.gegc.insightprep.features.question.domain.model.TextValue;
import uk.gegc.insightprep.shared.exception.MalformedQuestionException;

@Component
public class SingleChoiceHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.SINGLE_CHOICE;
    }

    @Override
    public boolean supports(SubmittedAnswer answer) {
        return answer instanceof LetterRef
                || answer instanceof TextValue
                || answer instanceof TextSet;
    }

    @Override
    protected void validateContent(Question question) throws MalformedQuestionException {
        validateChoiceOptions(question);
        if (question.getCorrectAnswer() == null) {
            throw new MalformedQuestionException(question.getId(), "Missing answer field");
        }
        if (!(question.getCorrectAnswer() instanceof SingleOption single)) {
            throw new MalformedQuestionException(question.getId(),
                    supportedType() + " must have exactly one correct answer");
        }
        requireMember(question, single.option());
    }

    @Override
    public boolean judge(Question question, SubmittedAnswer answer) {
        String resolved = resolve(question, answer);
        if (resolved == null || !(question.getCorrectAnswer() instanceof SingleOption single)) {
            return false;
        }
        return normalize(resolved).equals(normalize(single.option()));
    }

    private String resolve(Question question, SubmittedAnswer answer) {
        if (answer instanceof LetterRef letter) {
            return resolveLetter(question.getOptions(), letter);
        }
        if (answer instanceof TextValue text) {
            return text.value();
        }
        // a one-element selection is how single-select inputs report their choice
        if (answer instanceof TextSet set && set.values().size() == 1) {
            return resolveOption(question.getOptions(), set.values().get(0));
        }
        return null;
    }
}
