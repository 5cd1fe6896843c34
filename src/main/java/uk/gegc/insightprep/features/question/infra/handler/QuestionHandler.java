package uk.gegc.insightprep.features.question.infra.handler;

import uk.gegc.insightprep.features.question.domain.model.LetterRef;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.QuestionType;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.shared.exception.MalformedQuestionException;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Per-kind validation and judging. Handlers are stateless; a single instance
 * serves every session.
 */
public abstract class QuestionHandler {

    /**
     * Returns the question type that this handler supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    /**
     * Whether this handler can judge the given answer shape at all.
     * An unsupported shape is a normalization mismatch, judged incorrect by the caller.
     */
    public abstract boolean supports(SubmittedAnswer answer);

    public final void validate(Question question) throws MalformedQuestionException {
        if (question.getText() == null || question.getText().isBlank()) {
            throw new MalformedQuestionException(question.getId(), "Missing question text");
        }
        validateContent(question);
    }

    protected abstract void validateContent(Question question) throws MalformedQuestionException;

    /**
     * Judges a submission. Callers must check {@link #supports(SubmittedAnswer)} first.
     */
    public abstract boolean judge(Question question, SubmittedAnswer answer);

    /**
     * Resolves a raw selection element to option text. A single upper-case
     * letter within range is a positional code; anything else is literal text.
     */
    public static String resolveOption(List<String> options, String raw) {
        if (raw == null) {
            return null;
        }
        if (raw.length() == 1 && raw.charAt(0) >= 'A' && raw.charAt(0) <= 'Z') {
            int index = raw.charAt(0) - 'A';
            if (index < options.size()) {
                return options.get(index);
            }
        }
        return raw;
    }

    public static String resolveLetter(List<String> options, LetterRef letter) {
        int index = letter.index();
        return index < options.size() ? options.get(index) : letter.describe();
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    protected static void validateChoiceOptions(Question question) {
        List<String> options = question.getOptions();
        if (options == null || options.isEmpty()) {
            throw new MalformedQuestionException(question.getId(), "Missing or empty options array");
        }
        if (options.size() < 2) {
            throw new MalformedQuestionException(question.getId(), "Question must have at least 2 options");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < options.size(); i++) {
            String option = options.get(i);
            if (option == null || option.isBlank()) {
                throw new MalformedQuestionException(question.getId(), "Option " + (i + 1) + " is empty");
            }
            if (!seen.add(normalize(option))) {
                throw new MalformedQuestionException(question.getId(), "Duplicate option: \"" + option + "\"");
            }
        }
    }

    protected static void requireMember(Question question, String answer) {
        String wanted = normalize(answer);
        boolean found = question.getOptions().stream()
                .anyMatch(option -> normalize(option).equals(wanted));
        if (!found) {
            throw new MalformedQuestionException(question.getId(),
                    "Answer \"" + answer + "\" not found in options: ["
                            + String.join(", ", question.getOptions()) + "]");
        }
    }
}
