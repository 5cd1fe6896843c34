package uk.gegc.insightprep.features.question.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Correct answer of a match question: left item to right item.
 */
public record PairMapping(Map<String, String> pairs) implements CorrectAnswer {

    public PairMapping {
        pairs = Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
    }

    @Override
    public List<String> optionValues() {
        return List.of();
    }

    @Override
    public String describe() {
        return pairs.entrySet().stream()
                .map(e -> e.getKey() + " → " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
