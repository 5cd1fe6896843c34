package uk.gegc.insightprep.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Map;

/**
 * A raw answer as submitted by the user, before letter resolution.
 * <p>
 * Letter codes are a presentation artifact: options are shown as A, B, C...
 * in their current (shuffled) order, and the code is mapped back to option
 * text only at judging time.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LetterRef.class, name = "letter"),
        @JsonSubTypes.Type(value = TextValue.class, name = "text"),
        @JsonSubTypes.Type(value = TextSet.class, name = "selection"),
        @JsonSubTypes.Type(value = PairMap.class, name = "pairs")
})
public interface SubmittedAnswer {

    static LetterRef letter(char letter) {
        return new LetterRef(letter);
    }

    static TextValue text(String value) {
        return new TextValue(value);
    }

    static TextSet selection(List<String> values) {
        return new TextSet(values);
    }

    static TextSet selection(String... values) {
        return new TextSet(List.of(values));
    }

    static PairMap pairs(Map<String, String> pairs) {
        return new PairMap(pairs);
    }

    /**
     * Compact textual form, as entered (letters are not resolved).
     */
    String describe();
}
