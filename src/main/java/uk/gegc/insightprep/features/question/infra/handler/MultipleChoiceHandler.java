package uk.gegc.insightprep.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.LetterRef;
import uk.gegc.insightprep.features.question.domain.model.OptionSet;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.QuestionType;
import uk.gegc.insightprep.features.question.domain.model.SingleOption;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.features.question.domain.model.TextSet;
import uk.gegc.insightprep.features.question.domain.model.TextValue;
import uk.gegc.insightprep.shared.exception.MalformedQuestionException;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class MultipleChoiceHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    public boolean supports(SubmittedAnswer answer) {
        return answer instanceof TextSet
                || answer instanceof LetterRef
                || answer instanceof TextValue;
    }

    @Override
    protected void validateContent(Question question) throws MalformedQuestionException {
        validateChoiceOptions(question);
        if (question.getCorrectAnswer() == null) {
            throw new MalformedQuestionException(question.getId(), "Missing answer field");
        }
        List<String> correct = question.getCorrectAnswer().optionValues();
        if (!(question.getCorrectAnswer() instanceof OptionSet || question.getCorrectAnswer() instanceof SingleOption)) {
            throw new MalformedQuestionException(question.getId(),
                    "MULTIPLE_CHOICE answer must be a set of options");
        }
        if (correct.isEmpty()) {
            throw new MalformedQuestionException(question.getId(),
                    "MULTIPLE_CHOICE must have at least one correct answer");
        }
        correct.forEach(answer -> requireMember(question, answer));
    }

    @Override
    public boolean judge(Question question, SubmittedAnswer answer) {
        Set<String> expected = question.getCorrectAnswer().optionValues().stream()
                .map(QuestionHandler::normalize)
                .collect(Collectors.toSet());
        Set<String> selected = resolveAll(question, answer).stream()
                .map(QuestionHandler::normalize)
                .collect(Collectors.toSet());
        return expected.size() == selected.size() && selected.containsAll(expected);
    }

    private List<String> resolveAll(Question question, SubmittedAnswer answer) {
        if (answer instanceof TextSet set) {
            return set.values().stream()
                    .map(value -> resolveOption(question.getOptions(), value))
                    .toList();
        }
        if (answer instanceof LetterRef letter) {
            return List.of(resolveLetter(question.getOptions(), letter));
        }
        if (answer instanceof TextValue text) {
            return List.of(text.value());
        }
        return List.of();
    }
}
