package uk.gegc.insightprep.features.question.domain.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * One assessment item. Sessions own deep copies of their questions, so
 * reshuffling options on a rendered question never leaks into the source list.
 */
@Getter
@Setter
@NoArgsConstructor
public class Question {

    public static final String DEFAULT_TOPIC = "Unknown Topic";
    public static final String DEFAULT_SUBTOPIC = "General";

    private String id;
    private String text;
    private QuestionType type;
    private List<String> options = new ArrayList<>();
    private CorrectAnswer correctAnswer;
    private String explanation;
    private String reference;
    private String topic;
    private String subtopic;

    public String getTopic() {
        return topic == null || topic.isBlank() ? DEFAULT_TOPIC : topic;
    }

    public String getSubtopic() {
        return subtopic == null || subtopic.isBlank() ? DEFAULT_SUBTOPIC : subtopic;
    }

    public void setOptions(List<String> options) {
        this.options = options == null ? new ArrayList<>() : new ArrayList<>(options);
    }

    /**
     * Whether the renderer should offer a single selection. A multiple-choice
     * question with exactly one correct option is still presented as
     * single-select, but it is judged with set semantics.
     */
    public boolean isSingleSelect() {
        if (type == QuestionType.SINGLE_CHOICE || type == QuestionType.ASSERTION_REASON) {
            return true;
        }
        return type == QuestionType.MULTIPLE_CHOICE
                && correctAnswer != null
                && correctAnswer.optionValues().size() == 1;
    }

    public Question copy() {
        Question copy = new Question();
        copy.id = id;
        copy.text = text;
        copy.type = type;
        copy.options = new ArrayList<>(options);
        // correct answer variants are immutable records
        copy.correctAnswer = correctAnswer;
        copy.explanation = explanation;
        copy.reference = reference;
        copy.topic = topic;
        copy.subtopic = subtopic;
        return copy;
    }

    @Override
    public String toString() {
        return "Question{id='" + id + "', type=" + type + ", options=" + options.size() + "}";
    }
}
