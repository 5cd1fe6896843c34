package uk.gegc.insightprep.features.question.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Correct answer of a multiple-choice question. Comparison against a selection
 * uses set semantics, so declaration order carries no meaning.
 */
public record OptionSet(Set<String> options) implements CorrectAnswer {

    public OptionSet {
        options = Collections.unmodifiableSet(new LinkedHashSet<>(options));
    }

    public static OptionSet of(String... options) {
        return new OptionSet(new LinkedHashSet<>(List.of(options)));
    }

    @Override
    public List<String> optionValues() {
        return new ArrayList<>(options);
    }

    @Override
    public String describe() {
        return String.join(", ", options);
    }
}
