package uk.gegc.insightprep.features.question.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

public record PairMap(Map<String, String> pairs) implements SubmittedAnswer {

    public PairMap {
        pairs = Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
    }

    @Override
    public String describe() {
        return pairs.entrySet().stream()
                .map(e -> e.getKey() + " → " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
