package uk.gegc.insightprep.features.question.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.domain.model.CorrectAnswer;
import uk.gegc.insightprep.features.question.domain.model.OptionSet;
import uk.gegc.insightprep.features.question.domain.model.PairMapping;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.QuestionType;
import uk.gegc.insightprep.features.question.domain.model.SingleOption;
import uk.gegc.insightprep.shared.exception.MalformedQuestionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Converts loosely shaped question records into {@link Question}s. Only shape
 * problems are reported here; content invariants are checked by the handlers.
 */
@Component
public class QuestionRecordMapper {

    private static final List<String> TRUE_FALSE_OPTIONS = List.of("True", "False");

    public Question toQuestion(QuestionRecord record, int position) {
        String id = record.id() == null || record.id().isBlank() ? "#" + position : record.id().trim();

        if (record.type() == null || record.type().isBlank()) {
            throw new MalformedQuestionException(id, "Missing question type");
        }
        QuestionType type = QuestionType.fromLabel(record.type())
                .orElseThrow(() -> new MalformedQuestionException(id, "Unsupported question type: " + record.type()));

        List<String> answerValues = textValues(record.answer());
        if (type.isChoiceBased() && type != QuestionType.MULTIPLE_CHOICE && answerValues.size() > 1) {
            // an MCQ listing several correct options is judged as multi-select
            if (type != QuestionType.SINGLE_CHOICE || isTrueFalse(record)) {
                throw new MalformedQuestionException(id, "Question of type " + record.type().trim()
                        + " must have exactly one correct answer, got " + answerValues.size());
            }
            type = QuestionType.MULTIPLE_CHOICE;
        }

        Question question = new Question();
        question.setId(id);
        question.setText(record.question() == null ? null : record.question().trim());
        question.setType(type);
        question.setExplanation(record.explanation());
        question.setReference(record.reference());
        question.setTopic(record.topic());
        question.setSubtopic(record.subtopic());

        if (!type.isChoiceBased()) {
            Map<String, String> pairs = matchPairs(record);
            question.setCorrectAnswer(pairs == null ? null : new PairMapping(pairs));
            question.setOptions(pairs == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(pairs.values())));
        } else {
            question.setOptions(options(record));
            question.setCorrectAnswer(choiceAnswer(type, record.answer(), answerValues));
        }
        return question;
    }

    private List<String> options(QuestionRecord record) {
        if ((record.options() == null || record.options().isEmpty()) && isTrueFalse(record)) {
            return TRUE_FALSE_OPTIONS;
        }
        if (record.options() == null) {
            return List.of();
        }
        List<String> options = new ArrayList<>(record.options().size());
        for (String option : record.options()) {
            options.add(option == null ? null : option.trim());
        }
        return options;
    }

    private static boolean isTrueFalse(QuestionRecord record) {
        return "truefalse".equalsIgnoreCase(record.type().trim());
    }

    private CorrectAnswer choiceAnswer(QuestionType type, JsonNode answer, List<String> values) {
        if (answer == null || answer.isNull() || values.isEmpty()) {
            return null;
        }
        if (type == QuestionType.MULTIPLE_CHOICE) {
            return new OptionSet(new LinkedHashSet<>(values));
        }
        return new SingleOption(values.get(0));
    }

    private Map<String, String> matchPairs(QuestionRecord record) {
        if (record.matchPairs() != null) {
            return record.matchPairs();
        }
        JsonNode answer = record.answer();
        if (answer == null || !answer.isObject()) {
            return null;
        }
        Map<String, String> pairs = new LinkedHashMap<>();
        answer.fields().forEachRemaining(e -> pairs.put(e.getKey(), e.getValue().isNull() ? null : e.getValue().asText()));
        return pairs;
    }

    private static List<String> textValues(JsonNode answer) {
        if (answer == null || answer.isNull() || answer.isObject()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (answer.isArray()) {
            answer.forEach(node -> {
                if (!node.isNull() && !node.asText().isBlank()) {
                    values.add(node.asText().trim());
                }
            });
        } else if (!answer.asText().isBlank()) {
            values.add(answer.asText().trim());
        }
        return values;
    }
}
