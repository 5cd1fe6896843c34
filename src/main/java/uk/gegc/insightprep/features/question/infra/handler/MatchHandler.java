package uk.gegc.insightprep.features.question.infra.handler;

import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.PairMap;
import uk.gegc.insightprep.features.question.domain.model.PairMapping;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.QuestionType;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.shared.exception.MalformedQuestionException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Component
public class MatchHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MATCH;
    }

    @Override
    public boolean supports(SubmittedAnswer answer) {
        return answer instanceof PairMap;
    }

    @Override
    protected void validateContent(Question question) throws MalformedQuestionException {
        if (!(question.getCorrectAnswer() instanceof PairMapping mapping)) {
            throw new MalformedQuestionException(question.getId(), "Match questions need matchPairs object");
        }
        if (mapping.pairs().isEmpty()) {
            throw new MalformedQuestionException(question.getId(), "Match questions need at least one pair");
        }

        Set<String> left = new HashSet<>();
        Set<String> right = new HashSet<>();
        for (Map.Entry<String, String> pair : mapping.pairs().entrySet()) {
            if (pair.getKey() == null || pair.getKey().isBlank()
                    || pair.getValue() == null || pair.getValue().isBlank()) {
                throw new MalformedQuestionException(question.getId(), "Match pair has a blank left or right item");
            }
            if (!left.add(normalize(pair.getKey()))) {
                throw new MalformedQuestionException(question.getId(), "Duplicate left item: \"" + pair.getKey() + "\"");
            }
            right.add(normalize(pair.getValue()));
        }
        if (left.size() != right.size()) {
            throw new MalformedQuestionException(question.getId(),
                    "Match pairs must map each left item to a distinct right item");
        }
    }

    @Override
    public boolean judge(Question question, SubmittedAnswer answer) {
        if (!(question.getCorrectAnswer() instanceof PairMapping mapping) || !(answer instanceof PairMap submitted)) {
            return false;
        }
        Map<String, String> expected = normalizePairs(mapping.pairs());
        Map<String, String> actual = normalizePairs(submitted.pairs());
        // partially filled answers are incorrect, never partially credited
        return !expected.isEmpty() && expected.equals(actual);
    }

    public static Map<String, String> normalizePairs(Map<String, String> pairs) {
        Map<String, String> normalized = new HashMap<>();
        pairs.forEach((left, right) -> normalized.put(normalize(left), normalize(right)));
        return normalized;
    }
}
