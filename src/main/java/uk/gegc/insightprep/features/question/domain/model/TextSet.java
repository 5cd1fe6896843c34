package uk.gegc.insightprep.features.question.domain.model;

import java.util.List;

/**
 * A multi-select answer. Each element is either a single option letter or literal option text.
 */
public record TextSet(List<String> values) implements SubmittedAnswer {

    public TextSet {
        values = List.copyOf(values);
    }

    @Override
    public String describe() {
        return String.join(", ", values);
    }
}
