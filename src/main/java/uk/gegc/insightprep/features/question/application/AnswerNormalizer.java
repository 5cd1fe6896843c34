package uk.gegc.insightprep.features.question.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.LetterRef;
import uk.gegc.insightprep.features.question.domain.model.PairMap;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.features.question.domain.model.TextSet;
import uk.gegc.insightprep.features.question.domain.model.TextValue;
import uk.gegc.insightprep.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.insightprep.features.question.infra.handler.QuestionHandler;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The single correctness contract shared by learning sessions, exam submission
 * and the exam report. Comparison is case-insensitive and whitespace-trimmed
 * for every question kind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnswerNormalizer {

    private final QuestionHandlerFactory handlerFactory;

    /**
     * Pure verdict for one submission. Never throws: anything the handlers
     * cannot interpret is judged incorrect.
     */
    public boolean judge(Question question, SubmittedAnswer answer) {
        if (question == null || answer == null) {
            return false;
        }
        Optional<QuestionHandler> handler = handlerFactory.findHandler(question.getType());
        if (handler.isEmpty()) {
            log.warn("Normalization mismatch: no handler for type {} of question {}, judging incorrect",
                    question.getType(), question.getId());
            return false;
        }
        if (!handler.get().supports(answer)) {
            log.warn("Normalization mismatch: {} answer cannot be judged against {} question {}, judging incorrect",
                    answer.getClass().getSimpleName(), question.getType(), question.getId());
            return false;
        }
        boolean verdict = handler.get().judge(question, answer);
        log.debug("Judged question {} ({}): answer [{}] -> {}", question.getId(), question.getType(),
                answer.describe(), verdict);
        return verdict;
    }

    /**
     * Replaces option letters with the option text they point at, so the answer
     * keeps its meaning under a different option order. Letters outside the
     * options and non-choice answers are returned unchanged.
     */
    public SubmittedAnswer resolveLetters(Question question, SubmittedAnswer answer) {
        if (answer == null || question.getType() == null || !question.getType().isChoiceBased()) {
            return answer;
        }
        List<String> options = question.getOptions();
        if (answer instanceof LetterRef letter) {
            return letter.index() < options.size() ? new TextValue(options.get(letter.index())) : letter;
        }
        if (answer instanceof TextSet set) {
            return new TextSet(set.values().stream()
                    .map(value -> QuestionHandler.resolveOption(options, value))
                    .toList());
        }
        return answer;
    }

    /**
     * The user's answer with option letters replaced by option text, for display.
     */
    public String describeResolved(Question question, SubmittedAnswer answer) {
        if (answer == null) {
            return "";
        }
        if (answer instanceof LetterRef letter) {
            return QuestionHandler.resolveLetter(question.getOptions(), letter);
        }
        if (answer instanceof TextSet set) {
            return set.values().stream()
                    .map(value -> QuestionHandler.resolveOption(question.getOptions(), value))
                    .collect(Collectors.joining(", "));
        }
        if (answer instanceof TextValue text) {
            return text.value();
        }
        if (answer instanceof PairMap pairs) {
            return pairs.describe();
        }
        return answer.describe();
    }
}
